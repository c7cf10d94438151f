package com.filedrop.server.naming;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("FilenameSanitizer Tests")
class FilenameSanitizerTest {

    @Nested
    @DisplayName("Character filtering")
    class FilteringTests {

        @ParameterizedTest(name = "''{0}'' -> ''{1}''")
        @CsvSource({
                "report.pdf, report.pdf",
                "my report (final).pdf, myreportfinal.pdf",
                "data-set_v2.tar.gz, data-set_v2.tar.gz",
                "a*b?c<d>e|f.txt, abcdef.txt",
                "'semi;colon,comma.txt', semicoloncomma.txt",
                "résumé.doc, résumé.doc",
                "日本語.txt, 日本語.txt"
        })
        @DisplayName("should keep letters, digits, dot, dash and underscore only")
        void shouldKeepAllowedCharacters(String input, String expected) {
            assertThat(FilenameSanitizer.sanitize(input)).isEqualTo(expected);
        }

        @Test
        @DisplayName("should drop emoji and other symbols")
        void shouldDropSymbols() {
            assertThat(FilenameSanitizer.sanitize("party\uD83C\uDF89.txt")).isEqualTo("party.txt");
        }
    }

    @Nested
    @DisplayName("Directory components")
    class TraversalTests {

        @ParameterizedTest
        @ValueSource(strings = { "../../etc/passwd", "/etc/passwd", "..\\..\\etc\\passwd", "C:\\etc\\passwd",
                "dir/sub/passwd" })
        @DisplayName("should keep only the last path component")
        void shouldKeepBasename(String input) {
            assertThat(FilenameSanitizer.sanitize(input)).isEqualTo("passwd");
        }

        @ParameterizedTest
        @ValueSource(strings = { "", "..", ".", "...", "/", "dir/", "***", "a/b/.." })
        @DisplayName("should fall back to the placeholder when nothing usable is left")
        void shouldUsePlaceholder(String input) {
            assertThat(FilenameSanitizer.sanitize(input)).isEqualTo(FilenameSanitizer.PLACEHOLDER);
        }

        @Test
        @DisplayName("should treat null as empty")
        void shouldHandleNull() {
            assertThat(FilenameSanitizer.sanitize(null)).isEqualTo("unnamed_file");
        }

        @Test
        @DisplayName("should keep dotfiles")
        void shouldKeepDotfiles() {
            assertThat(FilenameSanitizer.sanitize(".profile")).isEqualTo(".profile");
        }
    }

    @Nested
    @DisplayName("Length cap")
    class LengthTests {

        @Test
        @DisplayName("should leave a 255 character name untouched")
        void shouldKeepMaximumLength() {
            String name = "a".repeat(251) + ".txt";
            assertThat(FilenameSanitizer.sanitize(name)).isEqualTo(name);
        }

        @Test
        @DisplayName("should truncate the stem and keep the extension")
        void shouldTruncateStem() {
            String result = FilenameSanitizer.sanitize("b".repeat(300) + ".txt");

            assertThat(result).hasSize(FilenameSanitizer.MAX_LENGTH);
            assertThat(result).endsWith(".txt").startsWith("bbb");
        }

        @Test
        @DisplayName("should truncate a long name without extension")
        void shouldTruncateWithoutExtension() {
            assertThat(FilenameSanitizer.sanitize("c".repeat(400))).isEqualTo("c".repeat(255));
        }

        @Test
        @DisplayName("should truncate the whole name when the extension alone is too long")
        void shouldTruncateHugeExtension() {
            String result = FilenameSanitizer.sanitize("x." + "e".repeat(300));

            assertThat(result).hasSize(255).startsWith("x.e");
        }

        @Test
        @DisplayName("should count code points, not chars")
        void shouldCountCodePoints() {
            String result = FilenameSanitizer.sanitize("\uD835\uDC00".repeat(300));

            assertThat(result.codePointCount(0, result.length())).isEqualTo(255);
        }
    }

    @Nested
    @DisplayName("Idempotence")
    class IdempotenceTests {

        @ParameterizedTest
        @ValueSource(strings = { "report.pdf", "../../x y z.tar.gz", "", "..", "*?*", "naïve file.txt",
                "trailing.", ".hidden", "a\\b/c.d" })
        @DisplayName("should be stable when applied twice and always produce a safe name")
        void shouldBeIdempotent(String input) {
            String once = FilenameSanitizer.sanitize(input);

            assertThat(FilenameSanitizer.sanitize(once)).isEqualTo(once);
            assertThat(FilenameSanitizer.isSafe(once)).isTrue();
            assertThat(once).isNotEmpty();
        }

        @Test
        @DisplayName("should be stable on a truncated name")
        void shouldBeIdempotentAfterTruncation() {
            String once = FilenameSanitizer.sanitize("d".repeat(500) + ".log");

            assertThat(FilenameSanitizer.sanitize(once)).isEqualTo(once);
        }
    }

    @Nested
    @DisplayName("Extension detection")
    class ExtensionTests {

        @ParameterizedTest(name = "''{0}'' -> {1}")
        @CsvSource({
                "a.txt, 1",
                "archive.tar.gz, 11",
                "noext, -1",
                ".profile, -1",
                "..tar, -1",
                "trailing., -1"
        })
        @DisplayName("should locate the extension dot")
        void shouldLocateExtension(String name, int expected) {
            assertThat(FilenameSanitizer.extensionIndex(name)).isEqualTo(expected);
        }
    }
}
