package com.ivirs.backend.model;

import lombok.Value;

import java.util.Map;

/**
 * One vehicle as seen by the mobility feed in a single snapshot.
 * Attributes hold the raw role flags and event-timer fields, exactly as the feed supplies them.
 */
@Value
public class VehicleRecord {

    String id;
    Position position;
    Map<String, String> attributes;

    public VehicleRecord(String id, Position position, Map<String, String> attributes) {
        this.id = id;
        this.position = position;
        this.attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }
}
