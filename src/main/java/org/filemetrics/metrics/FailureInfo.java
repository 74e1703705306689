package org.filemetrics.metrics;

import java.util.Objects;

/**
 * Why a whole file failed.
 *
 * @param kind      failure category
 * @param reason    human readable reason, e.g. {@code File not found: data/a.csv}
 * @param errorType decoder or exception type name, {@code null} when there is none
 * @param detail    raw decoder/exception message, {@code null} when there is none
 * @param position  {@code position N} for decode errors, {@code unknown} when it can't be told, else {@code null}
 */
public record FailureInfo(FailureKind kind, String reason, String errorType, String detail, String position) {

    public FailureInfo {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(reason, "reason");
    }

    public static FailureInfo of(final FailureKind kind, final String reason) {
        return new FailureInfo(kind, reason, null, null, null);
    }
}
