package com.filedrop.frame;

import static org.assertj.core.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("FileInfo Tests")
class FileInfoTest {

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("toJson should produce filename and filesize fields")
    void toJsonShouldProduceBothFields() {
        String json = new String(new FileInfo("report.pdf", 1234).toJson(), StandardCharsets.UTF_8);

        assertThat(json).isEqualTo("{\"filename\":\"report.pdf\",\"filesize\":1234}");
    }

    @Test
    @DisplayName("fromJson should read what toJson wrote, including non-ASCII names")
    void fromJsonShouldReadToJsonOutput() throws FrameFormatException {
        FileInfo info = new FileInfo("résumé – 2024.txt", 5_000_000_000L);

        assertThat(FileInfo.fromJson(info.toJson())).isEqualTo(info);
    }

    @Test
    @DisplayName("fromJson should accept spaced JSON with extra properties")
    void fromJsonShouldIgnoreUnknownProperties() throws FrameFormatException {
        FileInfo info = FileInfo.fromJson(utf8("{\"filename\": \"a.txt\", \"filesize\": 0, \"mode\": \"0644\"}"));

        assertThat(info.filename()).isEqualTo("a.txt");
        assertThat(info.filesize()).isZero();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "not json",
            "",
            "[1, 2]",
            "{\"filesize\": 10}",
            "{\"filename\": \"a.txt\"}",
            "{\"filename\": 42, \"filesize\": 10}",
            "{\"filename\": \"a.txt\", \"filesize\": \"10\"}",
            "{\"filename\": \"a.txt\", \"filesize\": 1.5}",
            "{\"filename\": \"a.txt\", \"filesize\": -1}"
    })
    @DisplayName("fromJson should reject malformed metadata")
    void fromJsonShouldRejectMalformedMetadata(String json) {
        assertThatThrownBy(() -> FileInfo.fromJson(utf8(json)))
                .isInstanceOf(FrameFormatException.class)
                .hasMessageStartingWith("Failed to parse file info");
    }

    @Test
    @DisplayName("fromJson should reject invalid UTF-8")
    void fromJsonShouldRejectInvalidUtf8() {
        byte[] payload = { '{', '"', 'f', (byte) 0xC3, (byte) 0x28, '"', ':', '1', '}' };

        assertThatThrownBy(() -> FileInfo.fromJson(payload))
                .isInstanceOf(FrameFormatException.class);
    }

    @Test
    @DisplayName("constructor should reject negative size")
    void constructorShouldRejectNegativeSize() {
        assertThatThrownBy(() -> new FileInfo("a", -5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
