package org.filemetrics.metrics;

/**
 * Format specific figures of one processed file.
 */
public sealed interface Metrics permits CsvMetrics, JsonMetrics, LogMetrics {

    FileFormat format();
}
