package org.filemetrics.metrics;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One file submitted for processing. {@code id} is the position in the submitted list, so the same
 * path submitted twice still yields two distinct tasks.
 */
public record FileTask(int id, Path path, FileFormat format) {

    public FileTask {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(format, "format");
        if (id < 0) throw new IllegalArgumentException("Task id must not be negative: " + id);
    }

    public static FileTask of(final int id, final Path path) {
        return new FileTask(id, path, FileFormat.fromPath(path));
    }

    public static List<FileTask> listOf(final List<Path> paths) {
        final List<FileTask> tasks = new ArrayList<>(paths.size());
        for (int i = 0; i < paths.size(); i++) {
            tasks.add(of(i, paths.get(i)));
        }
        return List.copyOf(tasks);
    }

    public String fileName() {
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }
}
