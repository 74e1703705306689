package org.filemetrics.processing;

import org.filemetrics.metrics.FileTask;
import org.filemetrics.metrics.ProcessingResult;

import java.util.Objects;

/**
 * What a worker delivers to the coordinator: its result, tagged with the task it was started for.
 */
public record WorkerMessage(FileTask task, ProcessingResult result) {

    public WorkerMessage {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(result, "result");
    }
}
