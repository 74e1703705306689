package org.filemetrics;

import org.filemetrics.config.ProcessingMode;
import org.filemetrics.metrics.BatchResult;
import org.filemetrics.metrics.BenchmarkReport;
import org.filemetrics.metrics.ExecutionRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * Everything one run produces. For benchmark runs {@code batch} is the parallel batch and
 * {@code benchmark} holds both.
 */
public record ExecutionOutcome(ProcessingMode mode, BatchResult batch, BenchmarkReport benchmark, ExecutionRecord record) {

    public ExecutionOutcome {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(batch, "batch");
        Objects.requireNonNull(record, "record");
        if ((mode == ProcessingMode.BENCHMARK) != (benchmark != null))
            throw new IllegalArgumentException("A benchmark report comes with benchmark mode only");
    }

    public Optional<BenchmarkReport> benchmarkReport() {
        return Optional.ofNullable(benchmark);
    }
}
