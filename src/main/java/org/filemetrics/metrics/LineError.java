package org.filemetrics.metrics;

import java.util.Objects;

/**
 * An invalid line or record inside a file that was otherwise processed.
 *
 * @param lineNumber 1-based; for CSV the first data line after the header is line 1
 * @param reason     why the line was rejected
 * @param content    the offending line, cut to {@link #MAX_CONTENT_LENGTH} characters plus "..."
 */
public record LineError(int lineNumber, String reason, String content) {

    public static final int MAX_CONTENT_LENGTH = 50;

    public LineError {
        if (lineNumber < 1) throw new IllegalArgumentException("Line numbers start at 1, got " + lineNumber);
        Objects.requireNonNull(reason, "reason");
        content = content == null ? "" : content;
    }
}
