package org.filemetrics.metrics;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one file, produced exactly once per {@link FileTask} by either execution path.
 * {@code metrics} is {@code null} when the file could not be read or decoded, {@code failure} is set
 * only for {@link Status#FAILURE}. {@code threadName} and {@code duration} describe the run, not the
 * content, and are left out by {@link #withoutTiming()}.
 */
public record ProcessingResult(String fileName, FileFormat format, Status status, Metrics metrics,
                               List<LineError> lineErrors, FailureInfo failure,
                               String threadName, Duration duration) implements HasStatus {

    public ProcessingResult {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(status, "status");
        lineErrors = lineErrors == null ? List.of() : List.copyOf(lineErrors);
        duration = duration == null ? Duration.ZERO : duration;
        if (status == Status.FAILURE && failure == null)
            throw new IllegalArgumentException("A failed result needs a failure reason: " + fileName);
        if (status != Status.FAILURE && failure != null)
            throw new IllegalArgumentException("Only failed results carry a failure reason: " + fileName);
    }

    public static ProcessingResult success(String fileName, Metrics metrics) {
        return new ProcessingResult(fileName, metrics.format(), Status.SUCCESS, metrics, List.of(), null, null, null);
    }

    public static ProcessingResult failure(String fileName, FileFormat format, FailureInfo failure) {
        return new ProcessingResult(fileName, format, Status.FAILURE, null, List.of(), failure, null, null);
    }

    public ProcessingResult withExecution(final String threadName, final Duration duration) {
        return new ProcessingResult(fileName, format, status, metrics, lineErrors, failure, threadName, duration);
    }

    public ProcessingResult withoutTiming() {
        return withExecution(null, Duration.ZERO);
    }

    public <T extends Metrics> T metricsAs(final Class<T> type) {
        if (!type.isInstance(metrics))
            throw new IllegalStateException(fileName + " has no " + type.getSimpleName()
                                            + " (status " + status + ", format " + format + ")");
        return type.cast(metrics);
    }

    public String errorMessage() {
        return failure != null ? failure.reason() : null;
    }

    public String recommendation() {
        if (status == Status.SUCCESS)
            return format == FileFormat.JSON ? "Valid and well-formed JSON"
                    : format == FileFormat.LOG ? "Valid log file" : "Valid file";
        if (status == Status.PARTIAL)
            return format == FileFormat.LOG ? "Review format of invalid lines" : "Review data format in lines with errors";

        return switch (failure.kind()) {
            case DECODE_ERROR -> "Check JSON syntax, quotes and braces";
            case FILE_NOT_FOUND -> "Check the file path";
            case UNSUPPORTED_TYPE -> "Use a .csv, .json or .log file";
            case EMPTY_FILE -> "The file is empty";
            case NO_DATA -> "Add data lines after the header";
            case NO_VALID_RECORDS -> "Review data format in lines with errors";
            case TIMEOUT -> "Retry with a longer worker timeout";
            default -> "Check file permissions and format";
        };
    }
}
