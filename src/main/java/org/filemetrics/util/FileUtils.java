package org.filemetrics.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class FileUtils {
    private static final Logger LOGGER = Logger.getLogger(FileUtils.class.getName());

    private FileUtils() {
    }

    /**
     * Regular files directly under {@code sourceDir}, sorted by file name. A missing directory yields an empty list.
     */
    public static List<Path> listFiles(final Path sourceDir) throws IOException {
        if (!Files.isDirectory(sourceDir)) {
            LOGGER.warning("Dir not found: " + sourceDir + ". Empty list.");
            return List.of();
        }
        try (Stream<Path> stream = Files.list(sourceDir)) {
            return stream.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    /**
     * Expands directories among {@code inputs} into their files and keeps plain paths as given, in input order.
     * Paths that do not exist are kept so that the processor reports them as not found.
     */
    public static List<Path> expandInputs(final List<Path> inputs) throws IOException {
        final List<Path> files = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) files.addAll(listFiles(input));
            else files.add(input);
        }
        return files;
    }
}
