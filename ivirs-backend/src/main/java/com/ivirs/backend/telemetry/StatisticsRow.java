package com.ivirs.backend.telemetry;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatisticsRow implements TelemetryRecord {

    public static final String TYPE = "statistics";

    @JsonProperty("timestamp")
    private double timestamp;
    @JsonProperty("active_vehicle_count")
    private int activeVehicleCount;
    @JsonProperty("total_reports")
    private long totalReports;
    @JsonProperty("fake_reports")
    private long fakeReports;
    @JsonProperty("real_incidents")
    private long realIncidents;
    @JsonProperty("detected_fakes")
    private long detectedFakes;
    @JsonProperty("false_positives")
    private long falsePositives;
    @JsonProperty("emergency_dispatches")
    private long emergencyDispatches;
    @JsonProperty("dropped_reports")
    private long droppedReports;
    @JsonProperty("detection_accuracy")
    private double detectionAccuracy;

    @Override
    public String recordType() {
        return TYPE;
    }
}
