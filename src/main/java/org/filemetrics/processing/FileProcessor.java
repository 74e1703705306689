package org.filemetrics.processing;

import org.filemetrics.config.AppConfig;
import org.filemetrics.datasources.CsvSalesParser;
import org.filemetrics.datasources.JsonSnapshotParser;
import org.filemetrics.datasources.LogLineParser;
import org.filemetrics.metrics.FailureInfo;
import org.filemetrics.metrics.FailureKind;
import org.filemetrics.metrics.FileFormat;
import org.filemetrics.metrics.FileTask;
import org.filemetrics.metrics.ProcessingResult;
import org.filemetrics.metrics.StatusHelper;
import org.filemetrics.plugin.FileParser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads one file and hands it to the parser registered for its format. Both the sequential path and
 * the workers go through {@link #process(FileTask)}, which is what keeps their results identical.
 */
public class FileProcessor {
    private static final Logger LOGGER = Logger.getLogger(FileProcessor.class.getName());

    private final Map<FileFormat, FileParser> parsers;

    public FileProcessor(final Collection<? extends FileParser> parsers) {
        this.parsers = new EnumMap<>(FileFormat.class);
        for (FileParser parser : parsers) {
            if (parser.format() == FileFormat.UNKNOWN)
                throw new IllegalArgumentException("A parser can't be registered for " + FileFormat.UNKNOWN);
            if (this.parsers.putIfAbsent(parser.format(), parser) != null)
                throw new IllegalArgumentException("Duplicate parser for " + parser.format());
        }
    }

    public static FileProcessor withDefaultParsers(final AppConfig config) {
        return new FileProcessor(List.of(new CsvSalesParser(), new JsonSnapshotParser(),
                new LogLineParser(config.countBlankLogLines())));
    }

    /**
     * Processes one file. Missing, unreadable and unsupported files come back as failed results;
     * this method only throws if a parser breaks its own contract.
     */
    public ProcessingResult process(final FileTask task) {
        final Instant start = Instant.now();
        final String threadName = Thread.currentThread().getName();

        final FileParser parser = parsers.get(task.format());
        if (parser == null) {
            LOGGER.warning("Unsupported file type, skipping " + task.path());
            return StatusHelper.createUnsupportedTypeResult(task);
        }

        final byte[] content;
        try {
            content = Files.readAllBytes(task.path());
        } catch (NoSuchFileException e) {
            LOGGER.warning("File not found: " + task.path());
            return StatusHelper.createFileNotFoundResult(task);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "IOException for file " + task.path(), e);
            String message = e.getMessage() == null ? "File read/access error" : e.getMessage();
            return StatusHelper.createFailedResult(task, new FailureInfo(FailureKind.IO_ERROR,
                    "Error reading file " + task.path() + ": " + message, e.getClass().getSimpleName(), e.getMessage(), null));
        }

        final ProcessingResult result = parser.parse(task.fileName(), content);
        LOGGER.fine(() -> task.fileName() + " -> " + result.status() + " (" + result.lineErrors().size() + " line errors)");
        return result.withExecution(threadName, Duration.between(start, Instant.now()));
    }
}
