package org.filemetrics.metrics;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Sales CSV figures. {@code totalLines} counts the non-blank data lines, so it always equals
 * {@code validRecords + invalidRecords}. {@code totalSales} is rounded half-up to 2 decimals.
 */
public record CsvMetrics(long validRecords, long invalidRecords, long totalLines, BigDecimal totalSales,
                         int uniqueProducts, double successRate, double errorRate) implements Metrics {

    public CsvMetrics {
        Objects.requireNonNull(totalSales, "totalSales");
    }

    @Override
    public FileFormat format() {
        return FileFormat.CSV;
    }
}
