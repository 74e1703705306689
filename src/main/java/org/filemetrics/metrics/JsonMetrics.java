package org.filemetrics.metrics;

import java.util.List;

/**
 * User/session snapshot figures. {@code fieldsPresent} lists the top-level keys, sorted.
 */
public record JsonMetrics(int totalUsers, int activeUsers, int totalSessions,
                          List<String> fieldsPresent) implements Metrics {

    public JsonMetrics {
        fieldsPresent = fieldsPresent == null ? List.of() : List.copyOf(fieldsPresent);
    }

    @Override
    public FileFormat format() {
        return FileFormat.JSON;
    }
}
