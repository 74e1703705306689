package org.filemetrics.processing;

import org.filemetrics.config.ProcessingMode;
import org.filemetrics.metrics.BatchResult;
import org.filemetrics.metrics.FileTask;
import org.filemetrics.metrics.ProcessingResult;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Processes files one after another on the calling thread, in input order.
 */
public class SequentialProcessor {
    private static final Logger LOGGER = Logger.getLogger(SequentialProcessor.class.getName());

    private final FileProcessor processor;

    public SequentialProcessor(final FileProcessor processor) {
        this.processor = Objects.requireNonNull(processor, "processor");
    }

    public List<ProcessingResult> runSequential(final List<FileTask> tasks) {
        final List<ProcessingResult> results = new ArrayList<>(tasks.size());
        for (final FileTask task : tasks) {
            results.add(Worker.processIsolated(processor, task));
        }
        return results;
    }

    public BatchResult run(final List<FileTask> tasks) {
        final Instant start = Instant.now();
        LOGGER.info(() -> "Starting sequential processing of " + tasks.size() + " files.");
        final List<ProcessingResult> results = runSequential(tasks);

        final Map<FileTask, ProcessingResult> byTask = new LinkedHashMap<>();
        for (int i = 0; i < tasks.size(); i++) {
            byTask.put(tasks.get(i), results.get(i));
        }
        final BatchResult batch = BatchResult.assemble(ProcessingMode.SEQUENTIAL, tasks, byTask, Duration.between(start, Instant.now()));
        LOGGER.info(() -> "Sequential processing completed in " + batch.totalMillis() + "ms.");
        return batch;
    }
}
