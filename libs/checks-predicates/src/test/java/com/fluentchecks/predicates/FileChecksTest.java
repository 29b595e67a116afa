package com.fluentchecks.predicates;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fluentchecks.core.PollingConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link FileChecks} validating existence and content checks against a temporary
 * directory.
 */
@DisplayName("FileChecks")
class FileChecksTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("fileExists")
    class FileExists {

        @Test
        @DisplayName("should detect existing and missing files")
        void shouldDetectFiles() throws IOException {
            Path existing = Files.createFile(tempDir.resolve("exists.txt"));

            assertThat(FileChecks.fileExists(existing).evaluate()).isTrue();
            assertThat(FileChecks.fileExists(tempDir.resolve("missing.txt")).evaluate()).isFalse();
        }

        @Test
        @DisplayName("should not treat a directory as a file")
        void shouldRejectDirectory() {
            assertThat(FileChecks.fileExists(tempDir).evaluate()).isFalse();
        }

        @Test
        @DisplayName("should observe a file created after the check was built")
        void shouldObserveLateFile() throws IOException {
            Path late = tempDir.resolve("late.txt");
            var check = FileChecks.fileExists(late);

            assertThat(check.evaluate()).isFalse();
            Files.writeString(late, "now");
            assertThat(check.evaluate()).isTrue();
        }
    }

    @Nested
    @DisplayName("directoryExists")
    class DirectoryExists {

        @Test
        @DisplayName("should detect existing and missing directories")
        void shouldDetectDirectories() throws IOException {
            Path dir = Files.createDirectory(tempDir.resolve("exists_dir"));

            assertThat(FileChecks.directoryExists(dir).evaluate()).isTrue();
            assertThat(FileChecks.directoryExists(tempDir.resolve("missing_dir")).evaluate()).isFalse();
        }
    }

    @Nested
    @DisplayName("fileContains")
    class FileContains {

        @Test
        @DisplayName("should find a byte sequence in the file")
        void shouldFindBytes() throws IOException {
            Path file = Files.writeString(tempDir.resolve("test.txt"), "hello fluent checks");

            assertThat(FileChecks.fileContains(file, "fluent".getBytes(UTF_8)).evaluate()).isTrue();
            assertThat(FileChecks.fileContains(file, "world".getBytes(UTF_8)).evaluate()).isFalse();
            assertThat(FileChecks.fileContains(file, new byte[0]).evaluate()).isTrue();
        }

        @Test
        @DisplayName("should be false for a missing file")
        void shouldBeFalseForMissingFile() {
            assertThat(FileChecks.fileContains(tempDir.resolve("no.txt"), new byte[0]).evaluate()).isFalse();
        }

        @Test
        @DisplayName("should not be affected by later changes to the expected array")
        void shouldCopyExpectedBytes() throws IOException {
            Path file = Files.writeString(tempDir.resolve("copy.txt"), "abc");
            byte[] expected = "abc".getBytes(UTF_8);
            var check = FileChecks.fileContains(file, expected);

            expected[0] = 'z';

            assertThat(check.evaluate()).isTrue();
        }

        @Test
        @DisplayName("should compose with polling while the file is written")
        void shouldComposeWithPolling() throws IOException {
            Path file = Files.writeString(tempDir.resolve("log.txt"), "booting\n");
            var check = FileChecks.fileContains(file, "ready".getBytes(UTF_8))
                    .onFailure(() -> append(file, "ready\n"));

            assertThat(check.eventually(Duration.ofSeconds(5), PollingConfig.defaults()).evaluate()).isTrue();
        }

        @Test
        @DisplayName("should reject null arguments")
        void shouldRejectNullArguments() {
            assertThatThrownBy(() -> FileChecks.fileContains(null, new byte[0]))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("path");
            assertThatThrownBy(() -> FileChecks.fileContains(tempDir, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("expected");
        }

        @Test
        @DisplayName("should locate byte sequences")
        void shouldLocateByteSequences() {
            assertThat(FileChecks.indexOf(new byte[] {1, 2, 3, 4}, new byte[] {3, 4})).isEqualTo(2);
            assertThat(FileChecks.indexOf(new byte[] {1, 2, 1, 2, 3}, new byte[] {1, 2, 3})).isEqualTo(2);
            assertThat(FileChecks.indexOf(new byte[] {1, 2}, new byte[] {1, 2, 3})).isEqualTo(-1);
        }

        private void append(Path file, String text) {
            try {
                Files.writeString(file, Files.readString(file) + text);
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }
    }
}
