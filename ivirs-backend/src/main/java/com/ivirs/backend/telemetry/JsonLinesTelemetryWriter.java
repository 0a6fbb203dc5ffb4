package com.ivirs.backend.telemetry;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends each record to the log file for its type, one JSON object per line.
 *
 * <p>A write failure disables the writer for the rest of the run; the tick loop keeps going.
 */
@Slf4j
public class JsonLinesTelemetryWriter implements TelemetryPublisher {

    public static final String REPORTS_FILE = "incident_reports.jsonl";
    public static final String STATISTICS_FILE = "simulation_stats.jsonl";
    public static final String DISPATCHES_FILE = "dispatches.jsonl";

    private final TelemetryCodec codec;
    private final Map<String, BufferedWriter> writers = new LinkedHashMap<>();
    private boolean disabled;

    public JsonLinesTelemetryWriter(Path outputDir, TelemetryCodec codec) {
        this.codec = codec;
        try {
            Files.createDirectories(outputDir);
            writers.put(ReportRecord.TYPE, Files.newBufferedWriter(outputDir.resolve(REPORTS_FILE), StandardCharsets.UTF_8));
            writers.put(StatisticsRow.TYPE, Files.newBufferedWriter(outputDir.resolve(STATISTICS_FILE), StandardCharsets.UTF_8));
            writers.put(DispatchEvent.TYPE, Files.newBufferedWriter(outputDir.resolve(DISPATCHES_FILE), StandardCharsets.UTF_8));
        } catch (IOException e) {
            closeQuietly();
            throw new UncheckedIOException("Cannot open telemetry logs under " + outputDir, e);
        }
        log.info("Telemetry logs written to {}", outputDir.toAbsolutePath());
    }

    @Override
    public synchronized void publish(TelemetryRecord record) {
        if (disabled) {
            return;
        }
        BufferedWriter writer = writers.get(record.recordType());
        if (writer == null) {
            return;
        }
        try {
            writer.write(codec.encode(record));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            disabled = true;
            log.error("Telemetry file output disabled after write failure", new UncheckedIOException(e));
        }
    }

    @Override
    public synchronized void close() {
        closeQuietly();
        disabled = true;
    }

    private void closeQuietly() {
        for (Map.Entry<String, BufferedWriter> entry : writers.entrySet()) {
            try {
                entry.getValue().close();
            } catch (IOException e) {
                log.warn("Failed to close {} log: {}", entry.getKey(), e.getMessage());
            }
        }
    }
}
