package com.ivirs.backend.telemetry;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One emergency response trigger. The responder is the nearest emergency-role vehicle present at
 * dispatch time, or null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DispatchEvent implements TelemetryRecord {

    public static final String TYPE = "dispatch";

    @JsonProperty("reporter_id")
    private String reporterId;
    @JsonProperty("timestamp")
    private double timestamp;
    @JsonProperty("location")
    private List<Double> location;
    @JsonProperty("responder_id")
    private String responderId;

    @Override
    public String recordType() {
        return TYPE;
    }
}
