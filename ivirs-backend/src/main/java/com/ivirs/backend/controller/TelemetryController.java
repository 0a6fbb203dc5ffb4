package com.ivirs.backend.controller;

import com.ivirs.backend.service.IncidentPipeline;
import com.ivirs.backend.service.VehicleRegistry;
import com.ivirs.backend.telemetry.DispatchEvent;
import com.ivirs.backend.telemetry.ReportRecord;
import com.ivirs.backend.telemetry.StatisticsRow;
import com.ivirs.backend.telemetry.TelemetrySink;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/telemetry")
@CrossOrigin(origins = "*")
public class TelemetryController {

    private final TelemetrySink telemetry;
    private final IncidentPipeline pipeline;
    private final VehicleRegistry registry;

    public TelemetryController(TelemetrySink telemetry, IncidentPipeline pipeline, VehicleRegistry registry) {
        this.telemetry = telemetry;
        this.pipeline = pipeline;
        this.registry = registry;
    }

    /**
     * Live counters plus the run clock.
     */
    @GetMapping("/stats")
    public Map<String, Object> getStats() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("tick", pipeline.getTick());
        response.put("time", pipeline.getClock());
        response.put("finished", pipeline.isFinished());
        response.put("activeVehicles", registry.activeCount());
        response.putAll(telemetry.counters());
        return response;
    }

    @GetMapping("/history")
    public List<StatisticsRow> getHistory() {
        return telemetry.statistics();
    }

    @GetMapping("/reports")
    public List<ReportRecord> getReports() {
        return telemetry.reports();
    }

    @GetMapping("/dispatches")
    public List<DispatchEvent> getDispatches() {
        return telemetry.dispatches();
    }
}
