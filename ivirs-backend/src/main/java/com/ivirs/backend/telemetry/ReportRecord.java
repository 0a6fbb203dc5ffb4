package com.ivirs.backend.telemetry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ivirs.backend.model.IncidentReport;
import com.ivirs.backend.model.ReportType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReportRecord implements TelemetryRecord {

    public static final String TYPE = "report";

    @JsonProperty("reporter_id")
    private String reporterId;
    @JsonProperty("type")
    private ReportType type;
    @JsonProperty("location")
    private List<Double> location;
    @JsonProperty("timestamp")
    private double timestamp;
    @JsonProperty("is_fake")
    private boolean fake;
    @JsonProperty("witnesses")
    private List<String> witnesses;
    @JsonProperty("node_id")
    private Integer nodeId;
    @JsonProperty("validated")
    private boolean validated;
    @JsonProperty("trust_score")
    private double trustScore;

    public static ReportRecord of(IncidentReport report) {
        return new ReportRecord(
                report.getReporterId(),
                report.getType(),
                report.getLocation().toList(),
                report.getTimestamp(),
                report.isFake(),
                List.copyOf(report.getWitnesses()),
                report.getNodeId().orElse(null),
                report.isValidated(),
                report.getTrustScore());
    }

    @Override
    public String recordType() {
        return TYPE;
    }
}
