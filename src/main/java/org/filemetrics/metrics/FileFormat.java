package org.filemetrics.metrics;

import org.filemetrics.util.Utils;

import java.nio.file.Path;
import java.util.Locale;

/**
 * File format inferred from the file extension.
 */
public enum FileFormat {
    CSV(".csv"),
    JSON(".json"),
    LOG(".log"),
    UNKNOWN("");

    private final String extension;

    FileFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static FileFormat fromPath(final Path path) {
        String ext = Utils.extension(path).toLowerCase(Locale.ROOT);
        if (ext.isEmpty()) return UNKNOWN;
        for (FileFormat format : values()) {
            if (format != UNKNOWN && format.extension.equals(ext)) return format;
        }
        return UNKNOWN;
    }
}
