package org.filemetrics.metrics;

import java.util.Collection;
import java.util.Locale;

/**
 * Status of a whole run, derived from the outcome of each file.
 */
public enum RunStatus {
    SUCCESS,
    PARTIAL,
    ERROR;

    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * {@code SUCCESS} when every file succeeded (an empty run included), {@code ERROR} when every file
     * failed, {@code PARTIAL} otherwise.
     */
    public static RunStatus of(final Collection<? extends HasStatus> results) {
        if (results.isEmpty()) return SUCCESS;
        boolean allSuccess = results.stream().allMatch(r -> r.status() == Status.SUCCESS);
        if (allSuccess) return SUCCESS;
        boolean allFailed = results.stream().allMatch(r -> r.status() == Status.FAILURE);
        return allFailed ? ERROR : PARTIAL;
    }
}
