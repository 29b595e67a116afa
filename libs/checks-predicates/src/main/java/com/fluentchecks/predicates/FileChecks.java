package com.fluentchecks.predicates;

import com.fluentchecks.core.Check;
import com.fluentchecks.core.CheckEvaluationException;
import com.fluentchecks.core.CustomCheck;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Filesystem checks. The path is inspected on every evaluation, so these checks can be
 * polled while another process creates or writes the file.
 * <p>
 * Example usage:
 * <pre>{@code
 * FileChecks.fileContains(logFile, "started".getBytes(UTF_8))
 *         .eventually(Duration.ofSeconds(10))
 *         .evaluate();
 * }</pre>
 */
public final class FileChecks {

    private FileChecks() {
        // utility class
    }

    /**
     * {@code true} when {@code path} exists and is a regular file.
     */
    public static Check fileExists(Path path) {
        requirePath(path);
        return new CustomCheck("file " + path + " exists", () -> Files.isRegularFile(path));
    }

    /**
     * {@code true} when {@code path} exists and is a directory.
     */
    public static Check directoryExists(Path path) {
        requirePath(path);
        return new CustomCheck("directory " + path + " exists", () -> Files.isDirectory(path));
    }

    /**
     * {@code true} when {@code path} is a regular file whose content contains
     * {@code expected} as a contiguous byte sequence. A missing file gives {@code false};
     * an I/O error while reading an existing file propagates as a
     * {@link CheckEvaluationException}.
     */
    public static Check fileContains(Path path, byte[] expected) {
        requirePath(path);
        if (expected == null) {
            throw new IllegalArgumentException("expected must not be null");
        }
        byte[] needle = expected.clone();
        return new CustomCheck("file " + path + " contains " + needle.length + " bytes",
                () -> Files.isRegularFile(path) && indexOf(Files.readAllBytes(path), needle) >= 0);
    }

    static int indexOf(byte[] haystack, byte[] needle) {
        if (needle.length == 0) {
            return 0;
        }
        outer:
        for (int i = 0; i <= haystack.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    private static void requirePath(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path must not be null");
        }
    }
}
