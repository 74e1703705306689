package org.filemetrics.util;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility methods for handling concurrency and executors.
 */
public final class ConcurrencyUtils {
    private static final Logger LOGGER = Logger.getLogger(ConcurrencyUtils.class.getName());

    static final Duration SHUTDOWN_WAIT_TIMEOUT = Duration.ofSeconds(60);

    private ConcurrencyUtils() {
    } // Prevent instantiation

    /**
     * Creates a ThreadFactory for named daemon platform threads ({@code prefix0}, {@code prefix1}, ...).
     * Daemon threads keep an abandoned worker from holding the JVM open.
     */
    public static ThreadFactory createPlatformThreadFactory(final String prefix) {
        final AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Gracefully shuts down an ExecutorService.
     */
    public static void shutdownExecutorService(final ExecutorService executor, final String name) {
        shutdownExecutorService(executor, name, SHUTDOWN_WAIT_TIMEOUT);
    }

    public static void shutdownExecutorService(final ExecutorService executor, final String name, final Duration wait) {
        if (executor == null) return;
        LOGGER.fine(() -> "Attempting graceful shutdown of executor: " + name);

        executor.shutdown(); // Disable new tasks
        try {
            if (!executor.awaitTermination(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warning(() -> "Executor " + name + " did not terminate in " + wait.toMillis() + "ms, attempting forceful shutdown...");
                final List<Runnable> droppedTasks = executor.shutdownNow(); // Cancel executing tasks
                LOGGER.warning(() -> "Executor " + name + " forcing shutdown. Dropped " + droppedTasks.size() + " waiting tasks.");

                if (!executor.awaitTermination(wait.toMillis(), TimeUnit.MILLISECONDS))
                    LOGGER.severe(() -> "Executor " + name + " did not terminate even after forcing.");
                else
                    LOGGER.fine(() -> "Executor " + name + " terminated after forcing.");

            } else
                LOGGER.fine(() -> "Executor " + name + " terminated gracefully.");

        } catch (final InterruptedException ie) {
            LOGGER.log(Level.WARNING, "Shutdown wait for executor " + name + " interrupted. Forcing shutdown now.");
            executor.shutdownNow(); // Re-cancel if interrupted
            Thread.currentThread().interrupt(); // Preserve interrupt status
        }
    }

    /**
     * Interrupts running tasks and drops queued ones without waiting, for executors holding workers
     * that already missed their deadline.
     */
    public static int abandonExecutorService(final ExecutorService executor, final String name) {
        if (executor == null) return 0;
        final List<Runnable> droppedTasks = executor.shutdownNow();
        LOGGER.warning(() -> "Executor " + name + " abandoned with unfinished workers. Dropped "
                             + droppedTasks.size() + " waiting tasks.");
        return droppedTasks.size();
    }
}
