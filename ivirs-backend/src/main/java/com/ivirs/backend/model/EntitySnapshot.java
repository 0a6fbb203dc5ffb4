package com.ivirs.backend.model;

import lombok.Value;

import java.util.List;

/**
 * Read-only view of every active vehicle at one simulation instant.
 */
@Value
public class EntitySnapshot {

    /** Simulation clock in seconds. */
    double time;
    List<VehicleRecord> vehicles;

    public EntitySnapshot(double time, List<VehicleRecord> vehicles) {
        this.time = time;
        this.vehicles = vehicles == null ? List.of() : List.copyOf(vehicles);
    }
}
