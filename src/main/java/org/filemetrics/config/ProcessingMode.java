package org.filemetrics.config;

import java.util.Locale;
import java.util.Optional;

/**
 * Execution mode requested by the caller for a batch of files.
 */
public enum ProcessingMode {
    SEQUENTIAL, // One file at a time on the calling thread
    PARALLEL,   // One worker per file
    BENCHMARK;  // Both of the above over the same files

    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a mode token ({@code sequential}, {@code parallel}, {@code benchmark}), ignoring case.
     */
    public static Optional<ProcessingMode> fromToken(final String token) {
        if (token == null || token.isBlank()) return Optional.empty();
        for (ProcessingMode mode : values()) {
            if (mode.token().equals(token.trim().toLowerCase(Locale.ROOT))) return Optional.of(mode);
        }
        return Optional.empty();
    }
}
