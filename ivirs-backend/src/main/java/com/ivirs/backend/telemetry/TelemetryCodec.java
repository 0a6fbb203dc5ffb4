package com.ivirs.backend.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Encodes telemetry records as single-line JSON objects and back.
 *
 * <p>Every line carries {@code recordType} and {@code schemaVersion}. Decoding rejects a
 * version it does not know.
 */
public class TelemetryCodec {

    public static final int SCHEMA_VERSION = 1;
    public static final String RECORD_TYPE_FIELD = "recordType";
    public static final String SCHEMA_VERSION_FIELD = "schemaVersion";

    private static final Map<String, Class<? extends TelemetryRecord>> TYPES = Map.of(
            ReportRecord.TYPE, ReportRecord.class,
            StatisticsRow.TYPE, StatisticsRow.class,
            DispatchEvent.TYPE, DispatchEvent.class
    );

    private final ObjectMapper objectMapper;

    public TelemetryCodec() {
        this(new ObjectMapper());
    }

    public TelemetryCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(TelemetryRecord record) {
        ObjectNode node = objectMapper.valueToTree(record);
        node.put(RECORD_TYPE_FIELD, record.recordType());
        node.put(SCHEMA_VERSION_FIELD, SCHEMA_VERSION);
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode " + record.recordType() + " record", e);
        }
    }

    public TelemetryRecord decode(String line) {
        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a JSON record: " + line, e);
        }
        if (!(parsed instanceof ObjectNode)) {
            throw new IllegalArgumentException("Expected a JSON object: " + line);
        }
        ObjectNode node = (ObjectNode) parsed;

        int version = node.path(SCHEMA_VERSION_FIELD).asInt(-1);
        if (version != SCHEMA_VERSION) {
            throw new IllegalArgumentException("Unsupported schema version " + version);
        }
        String type = node.path(RECORD_TYPE_FIELD).asText("");
        Class<? extends TelemetryRecord> target = TYPES.get(type);
        if (target == null) {
            throw new IllegalArgumentException("Unknown record type '" + type + "'");
        }

        node.remove(RECORD_TYPE_FIELD);
        node.remove(SCHEMA_VERSION_FIELD);
        try {
            return objectMapper.treeToValue(node, target);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + type + " record: " + line, e);
        }
    }
}
