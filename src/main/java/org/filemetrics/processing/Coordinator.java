package org.filemetrics.processing;

import org.filemetrics.config.ProcessingMode;
import org.filemetrics.metrics.BatchResult;
import org.filemetrics.metrics.FileTask;
import org.filemetrics.metrics.ProcessingResult;
import org.filemetrics.metrics.StatusHelper;
import org.filemetrics.util.ConcurrencyUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Fans a batch out to one {@link Worker} per file and collects the results from a shared channel.
 * <p>
 * Every worker is submitted before the first result is awaited. Collection then runs one slot per file:
 * each slot waits at most {@code perWorkerTimeout} for a message about a file still outstanding. When a
 * slot expires, the earliest dispatched outstanding file gets a timeout result and its worker is
 * interrupted; anything that worker sends later is dropped. A batch therefore returns within
 * {@code N * perWorkerTimeout} and every result is filed under the task named in its message.
 * <p>
 * Workers share nothing but the channel, and the calling thread is its only reader.
 */
public class Coordinator {
    private static final Logger LOGGER = Logger.getLogger(Coordinator.class.getName());

    static final String WORKER_THREAD_PREFIX = "FileWorker-";
    static final String EXECUTOR_NAME = "FileWorkerExecutor";

    private final FileProcessor processor;
    private final int maxWorkers;
    private final boolean verbose;

    public Coordinator(final FileProcessor processor) {
        this(processor, 0, false);
    }

    /**
     * @param maxWorkers 0 for one thread per file, otherwise the pool size cap
     * @param verbose    log every collected result, not only timeouts
     */
    public Coordinator(final FileProcessor processor, final int maxWorkers, final boolean verbose) {
        this.processor = Objects.requireNonNull(processor, "processor");
        if (maxWorkers < 0) throw new IllegalArgumentException("maxWorkers must not be negative: " + maxWorkers);
        this.maxWorkers = maxWorkers;
        this.verbose = verbose;
    }

    public BatchResult run(final List<FileTask> tasks, final Duration perWorkerTimeout) {
        Objects.requireNonNull(tasks, "tasks");
        Objects.requireNonNull(perWorkerTimeout, "perWorkerTimeout");
        if (perWorkerTimeout.isNegative() || perWorkerTimeout.isZero())
            throw new IllegalArgumentException("perWorkerTimeout must be positive: " + perWorkerTimeout);
        requireUniqueIds(tasks);

        final Instant batchStart = Instant.now();
        if (tasks.isEmpty()) {
            LOGGER.info("No files to process in parallel.");
            return BatchResult.assemble(ProcessingMode.PARALLEL, tasks, Map.of(), Duration.between(batchStart, Instant.now()));
        }

        final int poolSize = maxWorkers > 0 ? Math.min(maxWorkers, tasks.size()) : tasks.size();
        final ExecutorService workerExecutor = Executors.newFixedThreadPool(poolSize,
                ConcurrencyUtils.createPlatformThreadFactory(WORKER_THREAD_PREFIX));
        final BlockingQueue<WorkerMessage> channel = new LinkedBlockingQueue<>();
        final Map<Integer, Future<?>> inFlight = new LinkedHashMap<>();
        final Map<FileTask, ProcessingResult> collected = new HashMap<>();

        LOGGER.info(() -> "Starting parallel processing of " + tasks.size() + " files on " + poolSize
                          + " workers (timeout " + perWorkerTimeout.toMillis() + "ms per result).");
        boolean abandon = true;
        try {
            for (final FileTask task : tasks) {
                inFlight.put(task.id(), workerExecutor.submit(new Worker(task, processor, channel)));
            }
            abandon = collectResults(tasks, perWorkerTimeout, channel, inFlight, collected);
        } finally {
            if (abandon)
                ConcurrencyUtils.abandonExecutorService(workerExecutor, EXECUTOR_NAME);
            else
                ConcurrencyUtils.shutdownExecutorService(workerExecutor, EXECUTOR_NAME);
        }

        final BatchResult batch = BatchResult.assemble(ProcessingMode.PARALLEL, tasks, collected,
                Duration.between(batchStart, Instant.now()));
        LOGGER.info(() -> "Parallel processing completed in " + batch.totalMillis() + "ms. Results: "
                          + batch.successCount() + " successful, " + batch.partialCount() + " partial, "
                          + batch.errorCount() + " errors");
        return batch;
    }

    /**
     * Fills {@code collected} with one result per task.
     *
     * @return whether some worker may still be running (a timeout or an interrupt happened)
     */
    private boolean collectResults(final List<FileTask> tasks, final Duration perWorkerTimeout,
                                   final BlockingQueue<WorkerMessage> channel, final Map<Integer, Future<?>> inFlight,
                                   final Map<FileTask, ProcessingResult> collected) {
        final Map<Integer, FileTask> outstanding = new LinkedHashMap<>();
        for (final FileTask task : tasks) outstanding.put(task.id(), task);

        final int total = tasks.size();
        boolean timedOut = false;
        int slot = 0;
        try {
            while (!outstanding.isEmpty()) {
                slot++;
                final long deadline = System.nanoTime() + perWorkerTimeout.toNanos();
                final WorkerMessage message = awaitOutstanding(channel, outstanding, deadline);
                if (message != null) {
                    final FileTask task = outstanding.remove(message.task().id());
                    collected.put(task, message.result());
                    if (verbose) {
                        final int current = slot;
                        LOGGER.info(() -> "[" + current + "/" + total + "] " + task.fileName() + " -> " + message.result().status());
                    }
                } else {
                    final FileTask late = outstanding.values().iterator().next();
                    outstanding.remove(late.id());
                    LOGGER.warning("[" + slot + "/" + total + "] Timeout after " + perWorkerTimeout.toMillis()
                                   + "ms, no result from " + late.fileName());
                    collected.put(late, StatusHelper.createTimeoutResult(late, perWorkerTimeout));
                    inFlight.get(late.id()).cancel(true);
                    timedOut = true;
                }
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warning("Interrupted while waiting for " + outstanding.size() + " of " + total + " results.");
            for (final FileTask task : outstanding.values()) {
                collected.put(task, StatusHelper.createInterruptedResult(task));
            }
            return true;
        }
        return timedOut;
    }

    /**
     * Next message about an outstanding task, or {@code null} once {@code deadline} passes. Messages from
     * tasks that already timed out are dropped without extending the deadline.
     */
    private static WorkerMessage awaitOutstanding(final BlockingQueue<WorkerMessage> channel,
                                                  final Map<Integer, FileTask> outstanding,
                                                  final long deadline) throws InterruptedException {
        while (true) {
            final long remaining = deadline - System.nanoTime();
            final WorkerMessage message = remaining > 0 ? channel.poll(remaining, TimeUnit.NANOSECONDS) : channel.poll();
            if (message == null) return null;
            if (outstanding.containsKey(message.task().id())) return message;
            LOGGER.fine(() -> "Discarding late result of " + message.task().fileName());
        }
    }

    private static void requireUniqueIds(final List<FileTask> tasks) {
        final Map<Integer, FileTask> seen = new HashMap<>();
        for (final FileTask task : tasks) {
            final FileTask previous = seen.put(task.id(), task);
            if (previous != null)
                throw new IllegalArgumentException("Duplicate task id " + task.id() + ": " + previous.path() + ", " + task.path());
        }
    }
}
