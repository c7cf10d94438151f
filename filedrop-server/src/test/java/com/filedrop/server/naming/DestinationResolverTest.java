package com.filedrop.server.naming;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("DestinationResolver Tests")
class DestinationResolverTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("should use the name as is when free")
    void shouldUseFreeName() {
        assertThat(DestinationResolver.resolve(dir, "a.txt")).isEqualTo(dir.resolve("a.txt"));
    }

    @Test
    @DisplayName("should append _1 then _2 before the extension")
    void shouldAppendCounter() throws IOException {
        Files.createFile(dir.resolve("a.txt"));

        Path first = DestinationResolver.resolve(dir, "a.txt");
        assertThat(first).isEqualTo(dir.resolve("a_1.txt"));

        Files.createFile(first);
        assertThat(DestinationResolver.resolve(dir, "a.txt")).isEqualTo(dir.resolve("a_2.txt"));
    }

    @Test
    @DisplayName("should keep only the last extension as suffix")
    void shouldUseLastExtension() throws IOException {
        Files.createFile(dir.resolve("backup.tar.gz"));

        assertThat(DestinationResolver.resolve(dir, "backup.tar.gz")).isEqualTo(dir.resolve("backup.tar_1.gz"));
    }

    @Test
    @DisplayName("should append the counter to names without extension and to dotfiles")
    void shouldHandleNoExtension() throws IOException {
        Files.createFile(dir.resolve("README"));
        Files.createFile(dir.resolve(".env"));

        assertThat(DestinationResolver.resolve(dir, "README")).isEqualTo(dir.resolve("README_1"));
        assertThat(DestinationResolver.resolve(dir, ".env")).isEqualTo(dir.resolve(".env_1"));
    }

    @Test
    @DisplayName("should skip over existing numbered names")
    void shouldSkipNumberedNames() throws IOException {
        Files.createFile(dir.resolve("a.txt"));
        Files.createFile(dir.resolve("a_1.txt"));
        Files.createFile(dir.resolve("a_2.txt"));

        assertThat(DestinationResolver.resolve(dir, "a.txt")).isEqualTo(dir.resolve("a_3.txt"));
    }
}
