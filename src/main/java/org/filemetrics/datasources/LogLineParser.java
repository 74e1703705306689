package org.filemetrics.datasources;

import org.filemetrics.metrics.FailureInfo;
import org.filemetrics.metrics.FailureKind;
import org.filemetrics.metrics.FileFormat;
import org.filemetrics.metrics.LogLevel;
import org.filemetrics.metrics.LogMetrics;
import org.filemetrics.metrics.ProcessingResult;
import org.filemetrics.metrics.StatusHelper;
import org.filemetrics.processing.AbstractLineParser;
import org.filemetrics.util.Utils;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Application log: every line starts with {@code yyyy-MM-dd HH:mm:ss [LEVEL]}, the level token in any case.
 * Blank lines are skipped; whether they count towards the total is configurable and off by default.
 */
public class LogLineParser extends AbstractLineParser {

    static final Pattern LOG_LINE = Pattern.compile(
            "^\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2} \\[(DEBUG|INFO|WARN|ERROR|FATAL)\\]", Pattern.CASE_INSENSITIVE);
    static final int MAX_MESSAGE_SNIPPET = 30;
    static final String EMPTY_REASON = "Empty file";

    private final boolean countBlankLines;

    public LogLineParser() {
        this(false);
    }

    public LogLineParser(final boolean countBlankLines) {
        this.countBlankLines = countBlankLines;
    }

    @Override
    public FileFormat format() {
        return FileFormat.LOG;
    }

    @Override
    public ProcessingResult parse(final String fileName, final byte[] content) {
        final List<String> lines = splitLines(content);
        if (lines.stream().allMatch(AbstractLineParser::isBlank)) {
            logger.warning(fileName + ": " + EMPTY_REASON);
            return ProcessingResult.failure(fileName, FileFormat.LOG, FailureInfo.of(FailureKind.EMPTY_FILE, EMPTY_REASON));
        }

        final Map<LogLevel, Long> levels = new EnumMap<>(LogLevel.class);
        final LineScan scan = scan(fileName, lines, 1, line -> {
            Matcher matcher = LOG_LINE.matcher(line);
            if (!matcher.find())
                return Optional.of("Invalid format: " + Utils.truncate(line, MAX_MESSAGE_SNIPPET));
            levels.merge(LogLevel.valueOf(matcher.group(1).toUpperCase(Locale.ROOT)), 1L, Long::sum);
            return Optional.empty();
        });

        final long classified = scan.validCount() + scan.invalidCount();
        final long total = countBlankLines ? classified + scan.blankCount() : classified;
        final LogMetrics metrics = new LogMetrics(total, scan.validCount(), scan.invalidCount(), levels,
                Utils.percentage(scan.validCount(), classified), Utils.percentage(scan.invalidCount(), classified));
        return StatusHelper.createLineResult(fileName, metrics, scan.validCount(), scan.errors());
    }
}
