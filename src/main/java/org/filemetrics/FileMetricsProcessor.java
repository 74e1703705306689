package org.filemetrics;

import org.filemetrics.config.AppConfig;
import org.filemetrics.config.ConfigManager;
import org.filemetrics.config.ProcessingMode;
import org.filemetrics.metrics.BatchResult;
import org.filemetrics.metrics.BenchmarkReport;
import org.filemetrics.metrics.CsvMetrics;
import org.filemetrics.metrics.ExecutionRecord;
import org.filemetrics.metrics.FileTask;
import org.filemetrics.metrics.JsonMetrics;
import org.filemetrics.metrics.LineError;
import org.filemetrics.metrics.LogLevel;
import org.filemetrics.metrics.LogMetrics;
import org.filemetrics.metrics.Metrics;
import org.filemetrics.metrics.ProcessingResult;
import org.filemetrics.processing.BenchmarkDriver;
import org.filemetrics.processing.Coordinator;
import org.filemetrics.processing.FileProcessor;
import org.filemetrics.processing.SequentialProcessor;
import org.filemetrics.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Processes CSV, JSON and log files sequentially, in parallel (one worker per file), or both for a
 * benchmark. Configuration is read by {@link ConfigManager}, usually from {@code conf/config.yaml}.
 */
public class FileMetricsProcessor {
    private static final Logger LOGGER = Logger.getLogger(FileMetricsProcessor.class.getName());

    private final AppConfig appConfig;
    private final SequentialProcessor sequential;
    private final Coordinator coordinator;
    private final BenchmarkDriver benchmarkDriver;

    public FileMetricsProcessor(final AppConfig appConfig) {
        this(appConfig, FileProcessor.withDefaultParsers(Objects.requireNonNull(appConfig, "Configuration cannot be null")));
    }

    public FileMetricsProcessor(final AppConfig appConfig, final FileProcessor fileProcessor) {
        this.appConfig = Objects.requireNonNull(appConfig, "Configuration cannot be null");
        this.sequential = new SequentialProcessor(fileProcessor);
        this.coordinator = new Coordinator(fileProcessor, appConfig.maxWorkers(), appConfig.verbose());
        this.benchmarkDriver = new BenchmarkDriver(sequential, coordinator, appConfig.workerTimeout());
    }

    // --- Entry Point ---
    public ExecutionOutcome execute(final List<Path> files, final ProcessingMode mode) {
        Objects.requireNonNull(files, "files");
        Objects.requireNonNull(mode, "mode");
        final List<FileTask> tasks = FileTask.listOf(files);

        switch (mode) {
            case SEQUENTIAL: {
                BatchResult batch = sequential.run(tasks);
                return new ExecutionOutcome(mode, batch, null, ExecutionRecord.from(batch, mode, batch.totalMillis()));
            }
            case BENCHMARK: {
                BenchmarkReport report = benchmarkDriver.runBenchmark(tasks);
                long totalMs = report.sequentialMs() + report.parallelMs();
                return new ExecutionOutcome(mode, report.parallel(), report, ExecutionRecord.from(report.parallel(), mode, totalMs));
            }
            case PARALLEL:
            default: {
                BatchResult batch = coordinator.run(tasks, appConfig.workerTimeout());
                return new ExecutionOutcome(ProcessingMode.PARALLEL, batch, null, ExecutionRecord.from(batch, ProcessingMode.PARALLEL, batch.totalMillis()));
            }
        }
    }

    // --- Main Method ---
    public static void main(final String[] args) throws IOException {
        AppConfig appConfig = ConfigManager.getConfig();
        ProcessingMode mode = appConfig.mode();
        final List<Path> inputs = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("-h".equals(arg) || "--help".equals(arg)) {
                printUsage();
                return;
            } else if (("-m".equals(arg) || "--mode".equals(arg)) && i + 1 < args.length) {
                String token = args[++i];
                mode = ProcessingMode.fromToken(token).orElseGet(() -> {
                    LOGGER.warning("Unknown mode '" + token + "', using parallel");
                    return ProcessingMode.PARALLEL;
                });
            } else if (("-t".equals(arg) || "--timeout".equals(arg)) && i + 1 < args.length) {
                String value = args[++i];
                try {
                    appConfig = appConfig.withWorkerTimeoutMs(Long.parseLong(value));
                } catch (IllegalArgumentException e) {
                    LOGGER.warning("Invalid timeout '" + value + "', keeping " + appConfig.workerTimeoutMs() + "ms");
                }
            } else {
                inputs.add(Path.of(arg));
            }
        }

        if (inputs.isEmpty()) {
            System.err.println("Error: You need to specify a file or directory");
            printUsage();
            return;
        }

        final List<Path> files = FileUtils.expandInputs(inputs);
        System.out.println("========================================================");
        System.out.printf(" File Processor - %s mode, %d files%n", mode.token(), files.size());
        System.out.println("========================================================");

        ExecutionOutcome outcome = new FileMetricsProcessor(appConfig).execute(files, mode);
        printSummary(outcome);
    }

    private static void printUsage() {
        System.out.println("Usage: file-metrics-processor [-m sequential|parallel|benchmark] [-t timeoutMs] <file-or-directory>...");
    }

    // --- Summary Printing ---
    private static void printSummary(final ExecutionOutcome outcome) {
        final BatchResult batch = outcome.batch();
        System.out.println("---------------------- SUMMARY ----------------------");
        System.out.printf("Mode: %s | Files: %d | Time: %d ms | Status: %s%n", outcome.mode().token(), batch.size(),
                outcome.record().totalTimeMs(), outcome.record().status().token());
        System.out.printf("Successful: %d | Partial: %d | Errors: %d%n", batch.successCount(), batch.partialCount(), batch.errorCount());
        for (final ProcessingResult result : batch.orderedResults()) {
            System.out.printf("  [%-7s] %-30s %s%n", result.status(), result.fileName(), describe(result));
            for (final LineError error : result.lineErrors()) {
                System.out.printf("      line %d: %s%n", error.lineNumber(), error.reason());
            }
        }
        outcome.benchmarkReport().ifPresent(report -> {
            System.out.println("---------------------- BENCHMARK ----------------------");
            System.out.printf("Sequential: %d ms | Parallel: %d ms | Improvement: %.2fx | Faster: %.1f%% | Saved: %d ms (%s)%n",
                    report.sequentialMs(), report.parallelMs(), report.improvement(), report.percentFaster(),
                    report.timeSavedMs(), report.verdict());
        });
        System.out.println("-------------------------------------------------------");
    }

    private static String describe(final ProcessingResult result) {
        if (result.metrics() == null) return "ERROR: " + result.errorMessage();
        final Metrics metrics = result.metrics();
        if (metrics instanceof CsvMetrics csv) {
            return String.format("valid %d, invalid %d, sales %s, products %d", csv.validRecords(),
                    csv.invalidRecords(), csv.totalSales().toPlainString(), csv.uniqueProducts());
        } else if (metrics instanceof JsonMetrics json) {
            return String.format("users %d (active %d), sessions %d", json.totalUsers(), json.activeUsers(), json.totalSessions());
        } else {
            LogMetrics log = (LogMetrics) metrics;
            return String.format("lines %d, invalid %d, DEBUG %d INFO %d WARN %d ERROR %d FATAL %d", log.totalLines(),
                    log.invalidLines(), log.count(LogLevel.DEBUG), log.count(LogLevel.INFO), log.count(LogLevel.WARN),
                    log.count(LogLevel.ERROR), log.count(LogLevel.FATAL));
        }
    }

    AppConfig getAppConfig() {
        return appConfig;
    }
}
