package org.filemetrics.processing;

import org.filemetrics.metrics.LineError;
import org.filemetrics.plugin.FileParser;
import org.filemetrics.util.Utils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Base for parsers that classify a file line by line and keep going past bad lines.
 */
public abstract class AbstractLineParser implements FileParser {

    private static final char BOM = '\uFEFF';
    private static final int INTERRUPT_CHECK_INTERVAL = 1024;

    protected final Logger logger = Logger.getLogger(getClass().getName());

    /**
     * Checks one non-blank line. Returns the rejection reason, or empty when the line is valid; a valid
     * line is expected to be folded into the parser's own accumulators by the validator.
     */
    @FunctionalInterface
    protected interface LineValidator {
        Optional<String> validate(String line);
    }

    protected record LineScan(long validCount, long blankCount, List<LineError> errors) {
        public long invalidCount() {
            return errors.size();
        }
    }

    protected static List<String> splitLines(final byte[] content) {
        String text = new String(content, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == BOM) text = text.substring(1);
        return text.lines().collect(Collectors.toList());
    }

    protected static boolean isBlank(final String line) {
        return line.trim().isEmpty();
    }

    /**
     * Validates {@code lines} in order. Blank lines are skipped. Errors come back in ascending line order,
     * numbered from {@code firstLineNumber}.
     *
     * @throws CancellationException if the running thread was interrupted, e.g. after a worker timeout
     */
    protected LineScan scan(final String fileName, final List<String> lines, final int firstLineNumber,
                            final LineValidator validator) {
        long valid = 0L;
        long blank = 0L;
        final List<LineError> errors = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            if (i % INTERRUPT_CHECK_INTERVAL == 0 && Thread.currentThread().isInterrupted())
                throw new CancellationException("Processing of " + fileName + " cancelled");

            final String line = lines.get(i);
            if (isBlank(line)) {
                blank++;
                continue;
            }
            final int lineNumber = firstLineNumber + i;
            final Optional<String> rejection = validator.validate(line);
            if (rejection.isPresent()) {
                errors.add(new LineError(lineNumber, rejection.get(), Utils.truncate(line, LineError.MAX_CONTENT_LENGTH)));
                if (logger.isLoggable(Level.FINE))
                    logger.fine(fileName + ":" + lineNumber + " rejected: " + rejection.get());
            } else {
                valid++;
            }
        }

        if (!errors.isEmpty())
            logger.log(Level.FINE, "Record errors in file {0}: {1} of {2}",
                    new Object[]{fileName, errors.size(), valid + errors.size()});
        return new LineScan(valid, blank, errors);
    }
}
