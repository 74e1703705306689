package org.filemetrics.processing;

import org.filemetrics.metrics.FileTask;
import org.filemetrics.metrics.ProcessingResult;
import org.filemetrics.metrics.StatusHelper;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Processes exactly one file on its own thread and delivers exactly one {@link WorkerMessage}.
 * Faults raised while processing are turned into a failed result here and never reach the coordinator.
 */
public class Worker implements Runnable {
    private static final Logger LOGGER = Logger.getLogger(Worker.class.getName());

    private final FileTask task;
    private final FileProcessor processor;
    private final Queue<WorkerMessage> channel;

    public Worker(final FileTask task, final FileProcessor processor, final Queue<WorkerMessage> channel) {
        this.task = Objects.requireNonNull(task, "task");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    public FileTask task() {
        return task;
    }

    @Override
    public void run() {
        final ProcessingResult result = processIsolated(processor, task);
        if (!channel.offer(new WorkerMessage(task, result)))
            LOGGER.severe("Result channel refused the result of " + task.fileName());
    }

    /**
     * Runs {@link FileProcessor#process(FileTask)} and converts any fault into a failed result.
     * Used by the sequential path too, so both paths fail the same way.
     */
    public static ProcessingResult processIsolated(final FileProcessor processor, final FileTask task) {
        try {
            return processor.process(task);
        } catch (final CancellationException e) {
            LOGGER.fine(() -> "Worker for " + task.fileName() + " cancelled: " + e.getMessage());
            return StatusHelper.createWorkerFaultResult(task, e);
        } catch (final RuntimeException | LinkageError | AssertionError e) {
            LOGGER.log(Level.SEVERE, "Uncaught fault processing " + task.path(), e);
            return StatusHelper.createWorkerFaultResult(task, e);
        }
    }
}
