package org.filemetrics.datasources;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.filemetrics.metrics.FailureInfo;
import org.filemetrics.metrics.FailureKind;
import org.filemetrics.metrics.FileFormat;
import org.filemetrics.metrics.JsonMetrics;
import org.filemetrics.metrics.ProcessingResult;
import org.filemetrics.plugin.FileParser;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * User/session snapshot: one JSON object with optional {@code usuarios} and {@code sesiones} arrays.
 * Missing arrays count as empty. A user is active only when its {@code activo} field is boolean {@code true}.
 * The document is decoded as a whole, so any syntax error fails the file.
 */
public class JsonSnapshotParser implements FileParser {
    private static final Logger LOGGER = Logger.getLogger(JsonSnapshotParser.class.getName());

    public static final String USERS_FIELD = "usuarios";
    public static final String SESSIONS_FIELD = "sesiones";
    public static final String ACTIVE_FIELD = "activo";
    static final String MALFORMED_REASON = "Malformed JSON";

    private final ObjectMapper objectMapper;

    public JsonSnapshotParser() {
        this(new ObjectMapper());
    }

    JsonSnapshotParser(final ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public FileFormat format() {
        return FileFormat.JSON;
    }

    @Override
    public ProcessingResult parse(final String fileName, final byte[] content) {
        final JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            LOGGER.log(Level.WARNING, "Malformed JSON in " + fileName + ": " + e.getOriginalMessage());
            return ProcessingResult.failure(fileName, FileFormat.JSON, new FailureInfo(FailureKind.DECODE_ERROR,
                    MALFORMED_REASON, e.getClass().getSimpleName(), e.getOriginalMessage(), position(e.getLocation())));
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Error reading JSON " + fileName, e);
            return ProcessingResult.failure(fileName, FileFormat.JSON, new FailureInfo(FailureKind.IO_ERROR,
                    "Error processing JSON: " + e.getMessage(), e.getClass().getSimpleName(), e.getMessage(), null));
        }

        if (root == null || root.isMissingNode()) {
            return ProcessingResult.failure(fileName, FileFormat.JSON, new FailureInfo(FailureKind.DECODE_ERROR,
                    MALFORMED_REASON, "EmptyContent", "No content to decode", "position 0"));
        }
        if (!root.isObject()) {
            return structureFailure(fileName, "JSON root must be an object (found " + root.getNodeType() + ")");
        }

        final JsonNode users = root.path(USERS_FIELD);
        final JsonNode sessions = root.path(SESSIONS_FIELD);
        if (!isArrayOrAbsent(users)) return structureFailure(fileName, "Field '" + USERS_FIELD + "' must be an array");
        if (!isArrayOrAbsent(sessions)) return structureFailure(fileName, "Field '" + SESSIONS_FIELD + "' must be an array");

        int activeUsers = 0;
        for (JsonNode user : users) {
            JsonNode active = user.path(ACTIVE_FIELD);
            if (active.isBoolean() && active.booleanValue()) activeUsers++;
        }

        final List<String> fields = new ArrayList<>();
        for (Iterator<String> names = root.fieldNames(); names.hasNext(); ) fields.add(names.next());
        fields.sort(null);

        return ProcessingResult.success(fileName, new JsonMetrics(users.size(), activeUsers, sessions.size(), fields));
    }

    private static boolean isArrayOrAbsent(final JsonNode node) {
        return node.isMissingNode() || node.isNull() || node.isArray();
    }

    private static ProcessingResult structureFailure(final String fileName, final String reason) {
        LOGGER.warning(fileName + ": " + reason);
        return ProcessingResult.failure(fileName, FileFormat.JSON,
                new FailureInfo(FailureKind.UNEXPECTED_STRUCTURE, reason, null, null, null));
    }

    /**
     * Character offset of the error for text input, byte offset for byte input.
     */
    static String position(final JsonLocation location) {
        if (location == null) return "unknown";
        long offset = location.getCharOffset() >= 0 ? location.getCharOffset() : location.getByteOffset();
        return offset >= 0 ? "position " + offset : "unknown";
    }
}
