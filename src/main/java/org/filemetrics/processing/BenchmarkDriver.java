package org.filemetrics.processing;

import org.filemetrics.metrics.BatchResult;
import org.filemetrics.metrics.BenchmarkReport;
import org.filemetrics.metrics.FileTask;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs the same files sequentially and then in parallel and compares wall-clock times.
 */
public class BenchmarkDriver {
    private static final Logger LOGGER = Logger.getLogger(BenchmarkDriver.class.getName());

    static final double NOTABLE_IMPROVEMENT = 1.1;

    private final SequentialProcessor sequential;
    private final Coordinator coordinator;
    private final Duration perWorkerTimeout;

    public BenchmarkDriver(final SequentialProcessor sequential, final Coordinator coordinator, final Duration perWorkerTimeout) {
        this.sequential = Objects.requireNonNull(sequential, "sequential");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.perWorkerTimeout = Objects.requireNonNull(perWorkerTimeout, "perWorkerTimeout");
    }

    public BenchmarkReport runBenchmark(final List<FileTask> tasks) {
        if (tasks.isEmpty()) LOGGER.warning("No files for benchmark, reporting zero times.");
        LOGGER.info(() -> "BENCHMARK: Sequential vs Parallel, files: " + tasks.size());

        final BatchResult sequentialBatch = sequential.run(tasks);
        final BatchResult parallelBatch = coordinator.run(tasks, perWorkerTimeout);
        final BenchmarkReport report = BenchmarkReport.of(sequentialBatch, parallelBatch);

        LOGGER.info(() -> "Sequential: " + report.sequentialMs() + " ms, Parallel: " + report.parallelMs() + " ms");
        if (report.improvement() >= NOTABLE_IMPROVEMENT)
            LOGGER.info(() -> "Parallel is " + report.improvement() + "x faster (" + report.percentFaster() + "% improvement)");
        else
            LOGGER.info(() -> "Improvement is minimal (" + report.improvement() + "x)");
        return report;
    }
}
