package org.filemetrics.datasources;

import org.filemetrics.metrics.FailureKind;
import org.filemetrics.metrics.JsonMetrics;
import org.filemetrics.metrics.ProcessingResult;
import org.filemetrics.metrics.Status;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.filemetrics.util.TestDataGenerator.USERS_JSON;
import static org.junit.jupiter.api.Assertions.*;

class JsonSnapshotParserTest {

    private final JsonSnapshotParser parser = new JsonSnapshotParser();

    private ProcessingResult parse(String content) {
        return parser.parse("usuarios.json", content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testParse_emptyObjectDefaultsToZero() {
        ProcessingResult result = parse("{}");

        assertEquals(Status.SUCCESS, result.status(), "Missing optional arrays are not structural errors.");
        JsonMetrics metrics = result.metricsAs(JsonMetrics.class);
        assertEquals(0, metrics.totalUsers());
        assertEquals(0, metrics.activeUsers());
        assertEquals(0, metrics.totalSessions());
        assertTrue(metrics.fieldsPresent().isEmpty());
    }

    @Test
    void testParse_countsUsersAndSessions() {
        ProcessingResult result = parse(USERS_JSON);

        assertEquals(Status.SUCCESS, result.status());
        JsonMetrics metrics = result.metricsAs(JsonMetrics.class);
        assertEquals(3, metrics.totalUsers());
        assertEquals(2, metrics.activeUsers());
        assertEquals(2, metrics.totalSessions());
        assertEquals(List.of("sesiones", "usuarios"), metrics.fieldsPresent());
        assertEquals("Valid and well-formed JSON", result.recommendation());
    }

    @Test
    void testParse_activeOnlyWhenBooleanTrue() {
        ProcessingResult result = parse("{\"usuarios\": [{\"activo\": true}, {\"activo\": \"true\"}, {\"activo\": 1},"
                                        + " {}, \"plain\", {\"activo\": null}, {\"activo\": false}]}");

        JsonMetrics metrics = result.metricsAs(JsonMetrics.class);
        assertEquals(7, metrics.totalUsers());
        assertEquals(1, metrics.activeUsers());
    }

    @Test
    void testParse_nullArraysCountAsEmpty() {
        ProcessingResult result = parse("{\"usuarios\": null, \"sesiones\": []}");

        assertEquals(Status.SUCCESS, result.status());
        assertEquals(0, result.metricsAs(JsonMetrics.class).totalUsers());
    }

    @Test
    void testParse_truncatedDocumentIsDecodeFailure() {
        ProcessingResult result = assertDoesNotThrow(() -> parse("{\"usuarios\": ["));

        assertEquals(Status.FAILURE, result.status());
        assertEquals(FailureKind.DECODE_ERROR, result.failure().kind());
        assertEquals("Malformed JSON", result.errorMessage());
        assertNotNull(result.failure().errorType());
        assertNotNull(result.failure().detail());
        assertTrue(result.failure().position().startsWith("position "), result.failure().position());
        assertNull(result.metrics());
        assertEquals("Check JSON syntax, quotes and braces", result.recommendation());
    }

    @Test
    void testParse_trailingContentIsDecodeFailure() {
        ProcessingResult result = parse("{} {}");

        assertEquals(Status.FAILURE, result.status());
        assertEquals(FailureKind.DECODE_ERROR, result.failure().kind());
    }

    @Test
    void testParse_emptyContentIsDecodeFailure() {
        ProcessingResult result = parse("   ");

        assertEquals(Status.FAILURE, result.status());
        assertEquals(FailureKind.DECODE_ERROR, result.failure().kind());
    }

    @Test
    void testParse_arrayRootIsStructureFailure() {
        ProcessingResult result = parse("[1, 2]");

        assertEquals(Status.FAILURE, result.status());
        assertEquals(FailureKind.UNEXPECTED_STRUCTURE, result.failure().kind());
        assertEquals("JSON root must be an object (found ARRAY)", result.errorMessage());
    }

    @Test
    void testParse_usersNotAnArrayIsStructureFailure() {
        ProcessingResult result = parse("{\"usuarios\": {\"ana\": true}}");

        assertEquals(Status.FAILURE, result.status());
        assertEquals(FailureKind.UNEXPECTED_STRUCTURE, result.failure().kind());
        assertEquals("Field 'usuarios' must be an array", result.errorMessage());
    }

    @Test
    void testPosition_unknownWithoutLocation() {
        assertEquals("unknown", JsonSnapshotParser.position(null));
    }
}
