package com.ivirs.backend.telemetry;

/**
 * Structured record emitted for downstream report generation. Each record type is one
 * line in its log, tagged with {@link #recordType()} and the schema version.
 */
public interface TelemetryRecord {

    String recordType();
}
