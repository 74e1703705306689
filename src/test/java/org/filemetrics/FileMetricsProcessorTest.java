package org.filemetrics;

import org.filemetrics.config.AppConfig;
import org.filemetrics.config.ProcessingMode;
import org.filemetrics.metrics.BenchmarkReport;
import org.filemetrics.metrics.RunStatus;
import org.filemetrics.util.TestDataGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class FileMetricsProcessorTest {

    private static final String ALL_FILES = "ventas.csv, usuarios.json, app.log, notes.txt, missing.csv";

    @TempDir
    Path tempDir;

    @Test
    void testConstructor_nullConfig() {
        NullPointerException e = assertThrows(NullPointerException.class, () -> new FileMetricsProcessor(null));
        assertEquals("Configuration cannot be null", e.getMessage());
    }

    @Test
    void testExecute_sequential() throws IOException {
        List<Path> files = TestDataGenerator.createMixedBatch(tempDir);

        ExecutionOutcome outcome = new FileMetricsProcessor(AppConfig.defaults()).execute(files, ProcessingMode.SEQUENTIAL);

        assertEquals(ProcessingMode.SEQUENTIAL, outcome.mode());
        assertEquals(5, outcome.batch().size());
        assertTrue(outcome.benchmarkReport().isEmpty());
        assertEquals(ALL_FILES, outcome.record().files());
        assertEquals(RunStatus.PARTIAL, outcome.record().status());
        assertEquals(outcome.batch().totalMillis(), outcome.record().totalTimeMs());
    }

    @Test
    @Timeout(value = 20, unit = TimeUnit.SECONDS)
    void testExecute_parallel() throws IOException {
        List<Path> files = TestDataGenerator.createMixedBatch(tempDir);

        ExecutionOutcome outcome = new FileMetricsProcessor(AppConfig.defaults()).execute(files, ProcessingMode.PARALLEL);

        assertEquals(ProcessingMode.PARALLEL, outcome.batch().mode());
        assertEquals(2, outcome.batch().successCount());
        assertEquals(1, outcome.batch().partialCount());
        assertEquals(2, outcome.batch().errorCount());
        assertEquals(ProcessingMode.PARALLEL, outcome.record().mode());
    }

    @Test
    @Timeout(value = 20, unit = TimeUnit.SECONDS)
    void testExecute_benchmark() throws IOException {
        List<Path> files = TestDataGenerator.createMixedBatch(tempDir);

        ExecutionOutcome outcome = new FileMetricsProcessor(AppConfig.defaults()).execute(files, ProcessingMode.BENCHMARK);

        BenchmarkReport report = outcome.benchmarkReport().orElseThrow();
        assertEquals(5, report.filesCount());
        assertSame(report.parallel(), outcome.batch());
        assertEquals(ProcessingMode.BENCHMARK, outcome.record().mode());
        assertEquals(report.sequentialMs() + report.parallelMs(), outcome.record().totalTimeMs());
    }

    @Test
    void testExecute_noFiles() {
        ExecutionOutcome outcome = new FileMetricsProcessor(AppConfig.defaults()).execute(List.of(), ProcessingMode.PARALLEL);

        assertEquals(0, outcome.batch().size());
        assertEquals(RunStatus.SUCCESS, outcome.record().status());
        assertEquals("", outcome.record().files());
    }

    @Test
    @Timeout(value = 20, unit = TimeUnit.SECONDS)
    void testMain_directoryInput() throws IOException {
        TestDataGenerator.createMixedBatch(tempDir);
        PrintStream originalOut = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            FileMetricsProcessor.main(new String[]{"-m", "sequential", tempDir.toString()});
        } finally {
            System.setOut(originalOut);
        }

        String output = captured.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("sequential mode, 4 files"), output);
        assertTrue(output.contains("Successful: 2 | Partial: 1 | Errors: 1"), output);
        assertTrue(output.contains("line 5: Invalid format: garbage line"), output);
    }

    @Test
    @Timeout(value = 20, unit = TimeUnit.SECONDS)
    void testMain_invalidTimeoutKeepsConfiguredValue() throws IOException {
        TestDataGenerator.write(tempDir, "ventas.csv", TestDataGenerator.SALES_CSV);
        PrintStream originalOut = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            assertDoesNotThrow(() -> FileMetricsProcessor.main(new String[]{"-t", "abc", "-m", "parallel", tempDir.toString()}));
        } finally {
            System.setOut(originalOut);
        }

        String output = captured.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("parallel mode, 1 files"), output);
        assertTrue(output.contains("Successful: 1 | Partial: 0 | Errors: 0"), output);
    }
}
