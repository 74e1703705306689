package org.filemetrics.config;

import java.time.Duration;

/**
 * Runtime settings, usually read from {@code conf/config.yaml} by {@link ConfigManager}.
 * Any key left out of the YAML document falls back to its default.
 *
 * @param workerTimeoutMs    how long the coordinator waits for each result slot
 * @param defaultMode        mode token used when the caller does not give one
 * @param maxWorkers         0 starts one worker per file, a positive value bounds the pool
 * @param countBlankLogLines whether blank lines of a log file count towards its total
 * @param verbose            logs every collected result, not only timeouts
 */
public record AppConfig(Long workerTimeoutMs, String defaultMode, Integer maxWorkers,
                        Boolean countBlankLogLines, Boolean verbose) {

    public static final long DEFAULT_WORKER_TIMEOUT_MS = 5000L;
    public static final String DEFAULT_MODE = "parallel";

    public AppConfig {
        if (workerTimeoutMs == null) workerTimeoutMs = DEFAULT_WORKER_TIMEOUT_MS;
        if (defaultMode == null || defaultMode.isBlank()) defaultMode = DEFAULT_MODE;
        if (maxWorkers == null) maxWorkers = 0;
        if (countBlankLogLines == null) countBlankLogLines = Boolean.FALSE;
        if (verbose == null) verbose = Boolean.FALSE;

        if (workerTimeoutMs <= 0)
            throw new IllegalArgumentException("workerTimeoutMs must be positive, got " + workerTimeoutMs);
        if (maxWorkers < 0)
            throw new IllegalArgumentException("maxWorkers must be 0 (one per file) or positive, got " + maxWorkers);
        if (ProcessingMode.fromToken(defaultMode).isEmpty())
            throw new IllegalArgumentException("Unknown defaultMode: " + defaultMode);
    }

    public static AppConfig defaults() {
        return new AppConfig(null, null, null, null, null);
    }

    public Duration workerTimeout() {
        return Duration.ofMillis(workerTimeoutMs);
    }

    public ProcessingMode mode() {
        return ProcessingMode.fromToken(defaultMode).orElse(ProcessingMode.PARALLEL);
    }

    public AppConfig withWorkerTimeoutMs(final long timeoutMs) {
        return new AppConfig(timeoutMs, defaultMode, maxWorkers, countBlankLogLines, verbose);
    }
}
