package org.filemetrics.metrics;

import org.filemetrics.config.ProcessingMode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Every file of one batch with its result, in submission order, plus aggregate counts.
 */
public record BatchResult(ProcessingMode mode, List<FileTask> tasks, Map<FileTask, ProcessingResult> results,
                          int successCount, int partialCount, int errorCount, Duration totalDuration) {

    public BatchResult {
        Objects.requireNonNull(mode, "mode");
        tasks = List.copyOf(tasks);
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        totalDuration = totalDuration == null ? Duration.ZERO : totalDuration;
    }

    /**
     * Orders {@code collected} by the submitted task list and counts outcomes.
     *
     * @throws IllegalStateException if a task has no result or a result belongs to no task
     */
    public static BatchResult assemble(final ProcessingMode mode, final List<FileTask> tasks,
                                       final Map<FileTask, ProcessingResult> collected, final Duration totalDuration) {
        if (collected.size() != tasks.size())
            throw new IllegalStateException("Expected " + tasks.size() + " results, collected " + collected.size());

        final Map<FileTask, ProcessingResult> ordered = new LinkedHashMap<>();
        int success = 0, partial = 0, error = 0;
        for (FileTask task : tasks) {
            ProcessingResult result = collected.get(task);
            if (result == null) throw new IllegalStateException("No result for " + task);
            ordered.put(task, result);
            switch (result.status()) {
                case SUCCESS -> success++;
                case PARTIAL -> partial++;
                case FAILURE -> error++;
            }
        }
        return new BatchResult(mode, tasks, ordered, success, partial, error, totalDuration);
    }

    public List<ProcessingResult> orderedResults() {
        return List.copyOf(results.values());
    }

    public ProcessingResult resultFor(final FileTask task) {
        return results.get(task);
    }

    public int size() {
        return results.size();
    }

    public long totalMillis() {
        return totalDuration.toMillis();
    }

    public RunStatus runStatus() {
        return RunStatus.of(results.values());
    }

    public long countByFormat(final FileFormat format) {
        return results.values().stream().filter(r -> r.format() == format).count();
    }

    public List<ProcessingResult> failures() {
        final List<ProcessingResult> failed = new ArrayList<>();
        for (ProcessingResult result : results.values()) {
            if (result.status() == Status.FAILURE) failed.add(result);
        }
        return failed;
    }
}
