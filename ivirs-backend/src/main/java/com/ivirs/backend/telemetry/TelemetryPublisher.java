package com.ivirs.backend.telemetry;

public interface TelemetryPublisher {

    void publish(TelemetryRecord record);

    default void close() {
    }
}
