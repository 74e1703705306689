package org.filemetrics.metrics;

import org.filemetrics.config.ProcessingMode;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * What a history store keeps about one run. The status comes from the structured results.
 *
 * @param files      file names joined with {@code ", "}
 * @param reportPath rendered report artifact, {@code null} when none was written
 */
public record ExecutionRecord(Instant timestamp, String files, ProcessingMode mode, long totalTimeMs,
                              RunStatus status, Path reportPath) {

    public ExecutionRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(status, "status");
        files = files == null ? "" : files;
    }

    public static ExecutionRecord from(final BatchResult batch, final ProcessingMode mode, final long totalTimeMs) {
        String files = batch.tasks().stream().map(FileTask::fileName).collect(Collectors.joining(", "));
        return new ExecutionRecord(Instant.now(), files, mode, totalTimeMs, batch.runStatus(), null);
    }

    public ExecutionRecord withReportPath(final Path path) {
        return new ExecutionRecord(timestamp, files, mode, totalTimeMs, status, path);
    }
}
