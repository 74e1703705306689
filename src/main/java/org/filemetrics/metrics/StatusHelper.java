package org.filemetrics.metrics;

import org.filemetrics.util.Utils;

import java.time.Duration;
import java.util.List;

/**
 * Helper methods for creating results, especially for failure cases, and determining file status.
 */
public final class StatusHelper {

    private StatusHelper() {
    } // Prevent instantiation

    // --- Failure Result Creators ---

    public static ProcessingResult createFailedResult(final FileTask task, final FailureInfo failure) {
        return ProcessingResult.failure(task.fileName(), task.format(), failure)
                .withExecution(Thread.currentThread().getName(), Duration.ZERO);
    }

    public static ProcessingResult createFileNotFoundResult(final FileTask task) {
        return createFailedResult(task, FailureInfo.of(FailureKind.FILE_NOT_FOUND, "File not found: " + task.path()));
    }

    public static ProcessingResult createUnsupportedTypeResult(final FileTask task) {
        String ext = Utils.extension(task.path());
        String reason = ext.isEmpty() ? "Unsupported file type" : "Unsupported file type: " + ext;
        return createFailedResult(task, FailureInfo.of(FailureKind.UNSUPPORTED_TYPE, reason));
    }

    public static ProcessingResult createTimeoutResult(final FileTask task, final Duration timeout) {
        return createFailedResult(task, FailureInfo.of(FailureKind.TIMEOUT, "Worker timeout after " + timeout.toMillis() + "ms"));
    }

    public static ProcessingResult createWorkerFaultResult(final FileTask task, final Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return createFailedResult(task, new FailureInfo(FailureKind.WORKER_FAULT, "Unexpected worker failure: " + message,
                cause.getClass().getName(), cause.getMessage(), null));
    }

    public static ProcessingResult createInterruptedResult(final FileTask task) {
        return createFailedResult(task, FailureInfo.of(FailureKind.INTERRUPTED, "Coordinator interrupted"));
    }

    // --- Status Determination ---

    /**
     * Status of a line oriented file once every line was classified.
     */
    public static Status determineStatus(final long valid, final long invalid) {
        if (invalid == 0 && valid > 0) return Status.SUCCESS;
        return valid > 0 ? Status.PARTIAL : Status.FAILURE;
    }

    /**
     * Builds the result of a line oriented file: success, partial, or a failure that still carries
     * its metrics and line errors when no line validated.
     */
    public static ProcessingResult createLineResult(final String fileName, final Metrics metrics,
                                                    final long valid, final List<LineError> errors) {
        Status status = determineStatus(valid, errors.size());
        FailureInfo failure = status == Status.FAILURE
                ? FailureInfo.of(FailureKind.NO_VALID_RECORDS, "No valid records (" + errors.size() + " invalid)")
                : null;
        return new ProcessingResult(fileName, metrics.format(), status, metrics, errors, failure, null, null);
    }
}
