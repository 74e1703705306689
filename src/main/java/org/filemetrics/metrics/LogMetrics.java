package org.filemetrics.metrics;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Log file figures. Every {@link LogLevel} has an entry in {@code levelCounts}, zero included.
 */
public record LogMetrics(long totalLines, long validLines, long invalidLines, Map<LogLevel, Long> levelCounts,
                         double validRate, double invalidRate) implements Metrics {

    public LogMetrics {
        EnumMap<LogLevel, Long> counts = new EnumMap<>(LogLevel.class);
        for (LogLevel level : LogLevel.values()) counts.put(level, 0L);
        if (levelCounts != null) counts.putAll(levelCounts);
        levelCounts = Collections.unmodifiableMap(counts);
    }

    public long count(final LogLevel level) {
        return levelCounts.get(level);
    }

    @Override
    public FileFormat format() {
        return FileFormat.LOG;
    }
}
