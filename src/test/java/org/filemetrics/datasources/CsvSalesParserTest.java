package org.filemetrics.datasources;

import org.filemetrics.metrics.CsvMetrics;
import org.filemetrics.metrics.FailureKind;
import org.filemetrics.metrics.LineError;
import org.filemetrics.metrics.ProcessingResult;
import org.filemetrics.metrics.Status;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

import static org.filemetrics.util.TestDataGenerator.SALES_CSV;
import static org.filemetrics.util.TestDataGenerator.SALES_HEADER;
import static org.junit.jupiter.api.Assertions.*;

class CsvSalesParserTest {

    private final CsvSalesParser parser = new CsvSalesParser();

    private ProcessingResult parse(String content) {
        return parser.parse("ventas.csv", content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testParse_validAndMalformedLine() {
        ProcessingResult result = parse(SALES_HEADER + "\n"
                                        + "2024-01-01,Widget,Tools,10.00,2,10\n"
                                        + "2024-01-01,,Tools,10.00,2,10\n");

        assertEquals(Status.PARTIAL, result.status());
        CsvMetrics metrics = result.metricsAs(CsvMetrics.class);
        assertEquals(1, metrics.validRecords());
        assertEquals(1, metrics.invalidRecords());
        assertEquals(2, metrics.totalLines());
        assertEquals(new BigDecimal("18.00"), metrics.totalSales());
        assertEquals(1, metrics.uniqueProducts());
        assertEquals(50.0, metrics.successRate());
        assertEquals(50.0, metrics.errorRate());

        assertEquals(1, result.lineErrors().size());
        LineError error = result.lineErrors().get(0);
        assertEquals(2, error.lineNumber(), "Line numbers count data lines after the header.");
        assertEquals("Empty product name", error.reason());
        assertEquals("2024-01-01,,Tools,10.00,2,10", error.content());
        assertNull(result.failure());
    }

    @Test
    void testParse_allValid() {
        ProcessingResult result = parse(SALES_CSV);

        assertEquals(Status.SUCCESS, result.status());
        CsvMetrics metrics = result.metricsAs(CsvMetrics.class);
        assertEquals(3, metrics.validRecords());
        assertEquals(0, metrics.invalidRecords());
        // 18.00 + 25.50 + 15.00
        assertEquals(new BigDecimal("58.50"), metrics.totalSales());
        assertEquals(2, metrics.uniqueProducts());
        assertTrue(result.lineErrors().isEmpty());
        assertEquals("Valid file", result.recommendation());
    }

    @Test
    void testParse_lenientNumericPrefix() {
        ProcessingResult result = parse(SALES_HEADER + "\n2024-01-01,Widget,Tools,19.99USD,1pc,0%\n");

        assertEquals(Status.SUCCESS, result.status());
        assertEquals(new BigDecimal("19.99"), result.metricsAs(CsvMetrics.class).totalSales());
    }

    @Test
    void testParse_totalRoundedHalfUp() {
        ProcessingResult result = parse(SALES_HEADER + "\n2024-01-01,Widget,Tools,0.125,1,0\n");

        assertEquals(new BigDecimal("0.13"), result.metricsAs(CsvMetrics.class).totalSales());
    }

    @Test
    void testParse_reportsEveryFieldProblemInColumnOrder() {
        ProcessingResult result = parse(SALES_HEADER + "\n"
                                        + "2024-01-01,Widget,Tools,10,1,0\n"
                                        + "2024,Widget,,abc,0,150\n");

        assertEquals(Status.PARTIAL, result.status());
        assertEquals("Invalid date format (too short), Empty category, Invalid price: 'abc', "
                     + "Quantity must be positive (found: 0), Discount too high: 150% (max 100%)",
                result.lineErrors().get(0).reason());
    }

    @Test
    void testParse_rejectionReasons() {
        ProcessingResult result = parse(SALES_HEADER + "\n"
                                        + "2024-01-01,Widget,Tools,10,1,0\n"
                                        + "2024-01-01,Widget,Tools\n"
                                        + ",Widget,Tools,-5,1,0\n"
                                        + "2024-01-01,Widget,Tools,10,,-1\n"
                                        + "2024-01-01,Widget,Tools,,x,abc\n");

        assertEquals(4, result.lineErrors().size());
        assertEquals("Incomplete line (3 fields instead of 6)", result.lineErrors().get(0).reason());
        assertEquals("Empty date, Price must be positive (found: -5)", result.lineErrors().get(1).reason());
        assertEquals("Empty quantity, Negative discount: -1%", result.lineErrors().get(2).reason());
        assertEquals("Empty price, Invalid quantity: 'x', Invalid discount: 'abc'", result.lineErrors().get(3).reason());
    }

    @Test
    void testParse_errorsInAscendingLineOrder() {
        ProcessingResult result = parse(SALES_HEADER + "\n"
                                        + "bad\n"
                                        + "2024-01-01,Widget,Tools,10,1,0\n"
                                        + "also bad\n"
                                        + "\n"
                                        + "still bad\n");

        assertEquals(3, result.lineErrors().size());
        assertEquals(1, result.lineErrors().get(0).lineNumber());
        assertEquals(3, result.lineErrors().get(1).lineNumber());
        assertEquals(5, result.lineErrors().get(2).lineNumber(), "Blank lines keep their place in the numbering.");
    }

    @Test
    void testParse_uniqueProductsFromValidLinesOnly() {
        ProcessingResult result = parse(SALES_HEADER + "\n"
                                        + "2024-01-01,Widget,Tools,10,1,0\n"
                                        + "2024-01-01,Gadget,Tools,0,1,0\n");

        assertEquals(1, result.metricsAs(CsvMetrics.class).uniqueProducts());
    }

    @Test
    void testParse_blankLinesAndCrLfIgnored() {
        ProcessingResult result = parse(SALES_HEADER + "\r\n2024-01-01,Widget,Tools,10,1,0\r\n\r\n   \r\n");

        assertEquals(Status.SUCCESS, result.status());
        CsvMetrics metrics = result.metricsAs(CsvMetrics.class);
        assertEquals(1, metrics.validRecords());
        assertEquals(1, metrics.totalLines());
    }

    @Test
    void testParse_noValidRecordsIsFailure() {
        ProcessingResult result = parse(SALES_HEADER + "\nbad,line\n,,,,,\n");

        assertEquals(Status.FAILURE, result.status());
        assertEquals(FailureKind.NO_VALID_RECORDS, result.failure().kind());
        assertEquals(2, result.lineErrors().size());
        CsvMetrics metrics = result.metricsAs(CsvMetrics.class);
        assertEquals(0, metrics.validRecords());
        assertEquals(BigDecimal.ZERO.setScale(2), metrics.totalSales());
    }

    @Test
    void testParse_headerOnlyIsNoData() {
        ProcessingResult result = parse(SALES_HEADER + "\n");

        assertEquals(Status.FAILURE, result.status());
        assertEquals(FailureKind.NO_DATA, result.failure().kind());
        assertEquals("Empty file or no data after header", result.errorMessage());
        assertNull(result.metrics());
    }

    @Test
    void testParse_emptyFileIsNoData() {
        ProcessingResult result = parse("");

        assertEquals(Status.FAILURE, result.status());
        assertEquals(FailureKind.NO_DATA, result.failure().kind());
    }

    @Test
    void testParse_longLineContentTruncated() {
        String longLine = "x".repeat(80);
        ProcessingResult result = parse(SALES_HEADER + "\n2024-01-01,Widget,Tools,10,1,0\n" + longLine + "\n");

        String content = result.lineErrors().get(0).content();
        assertEquals("x".repeat(LineError.MAX_CONTENT_LENGTH) + "...", content);
    }

    @Test
    void testNetSale() {
        assertEquals(0, new BigDecimal("18").compareTo(
                CsvSalesParser.netSale(new BigDecimal("10.00"), new BigDecimal("2"), new BigDecimal("10"))));
    }

    @Test
    void testParsePrefix() {
        assertEquals(new BigDecimal("19.99"), CsvSalesParser.parseDecimalPrefix(" 19.99USD ").orElseThrow());
        assertEquals(new BigDecimal("2"), CsvSalesParser.parseIntegerPrefix("2.5").orElseThrow());
        assertTrue(CsvSalesParser.parseDecimalPrefix("USD19.99").isEmpty());
        assertTrue(CsvSalesParser.parseIntegerPrefix("").isEmpty());
    }

    @Test
    void testParse_outOfRangeExponentIsLineError() {
        ProcessingResult result = parse(SALES_HEADER + "\n"
                                        + "2024-01-01,Widget,Tools,10.00,2,10\n"
                                        + "2024-01-02,Widget,Tools,10.00,2,1e2147483647\n"
                                        + "2024-01-03,Widget,Tools,1e1500000000,2,10\n"
                                        + "2024-01-04,Widget,Tools,10.00,2,1e1500000000\n");

        assertEquals(Status.PARTIAL, result.status());
        CsvMetrics metrics = result.metricsAs(CsvMetrics.class);
        assertEquals(1, metrics.validRecords());
        assertEquals(3, metrics.invalidRecords());
        assertEquals(new BigDecimal("18.00"), metrics.totalSales());
        assertEquals("Invalid discount: '1e2147483647'", result.lineErrors().get(0).reason());
        assertEquals("Invalid price: '1e1500000000'", result.lineErrors().get(1).reason());
        assertEquals("Invalid discount: '1e1500000000'", result.lineErrors().get(2).reason());
    }

    @Test
    void testParsePrefix_scaleBounded() {
        assertEquals(new BigDecimal("1E+3"), CsvSalesParser.parseDecimalPrefix("1e3").orElseThrow());
        assertTrue(CsvSalesParser.parseDecimalPrefix("1e" + CsvSalesParser.MAX_SCALE).isPresent());
        assertTrue(CsvSalesParser.parseDecimalPrefix("1e" + (CsvSalesParser.MAX_SCALE + 1)).isEmpty());
        assertTrue(CsvSalesParser.parseDecimalPrefix("1e-2147483647").isEmpty());
        assertTrue(CsvSalesParser.parseDecimalPrefix("1e99999999999").isEmpty());
    }
}
