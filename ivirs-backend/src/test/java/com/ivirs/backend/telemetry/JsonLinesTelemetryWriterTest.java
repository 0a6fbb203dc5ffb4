package com.ivirs.backend.telemetry;

import com.ivirs.backend.model.IncidentReport;
import com.ivirs.backend.model.Position;
import com.ivirs.backend.model.ReportType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesTelemetryWriterTest {

    @TempDir
    Path outputDir;

    @Test
    void recordsLandInTheFileForTheirType() throws Exception {
        TelemetryCodec codec = new TelemetryCodec();
        JsonLinesTelemetryWriter writer = new JsonLinesTelemetryWriter(outputDir.resolve("run"), codec);
        TelemetrySink sink = new TelemetrySink(List.of(writer), 1);

        IncidentReport report = new IncidentReport("veh_1", ReportType.HAZARD, new Position(5, 5), 3.0, false);
        report.markRouted(0);
        report.completeValidation(0.8);
        sink.recordValidation(report, false);
        sink.recordDispatch(new DispatchEvent("veh_1", 3.0, List.of(5.0, 5.0), "amb_1"));
        sink.emitStatistics(3.0, 10);
        sink.emitStatistics(4.0, 11);
        sink.close();

        Path run = outputDir.resolve("run");
        List<String> reports = Files.readAllLines(run.resolve(JsonLinesTelemetryWriter.REPORTS_FILE), StandardCharsets.UTF_8);
        List<String> dispatches = Files.readAllLines(run.resolve(JsonLinesTelemetryWriter.DISPATCHES_FILE), StandardCharsets.UTF_8);
        List<String> statistics = Files.readAllLines(run.resolve(JsonLinesTelemetryWriter.STATISTICS_FILE), StandardCharsets.UTF_8);

        assertEquals(1, reports.size());
        assertEquals(1, dispatches.size());
        assertEquals(2, statistics.size());
        assertEquals(ReportRecord.of(report), codec.decode(reports.get(0)));
        assertEquals("amb_1", ((DispatchEvent) codec.decode(dispatches.get(0))).getResponderId());
        assertEquals(11, ((StatisticsRow) codec.decode(statistics.get(1))).getActiveVehicleCount());
    }

    @Test
    void nothingIsWrittenAfterClose() throws Exception {
        JsonLinesTelemetryWriter writer = new JsonLinesTelemetryWriter(outputDir, new TelemetryCodec());
        writer.close();

        writer.publish(new DispatchEvent("veh_1", 1.0, List.of(0.0, 0.0), null));

        assertTrue(Files.readAllLines(outputDir.resolve(JsonLinesTelemetryWriter.DISPATCHES_FILE)).isEmpty());
    }
}
