package com.ivirs.backend.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Fixed collection point. Holds routed reports until the validation engine drains them.
 */
public class RoadsideNode {

    private final int id;
    private final Position position;
    private final double coverageRadius;

    private final ConcurrentLinkedQueue<IncidentReport> pendingReports = new ConcurrentLinkedQueue<>();

    // rebuilt every tick
    private volatile Set<String> vehiclesInRange = Set.of();

    public RoadsideNode(int id, Position position, double coverageRadius) {
        if (coverageRadius <= 0) {
            throw new IllegalArgumentException("Coverage radius of node " + id + " must be positive");
        }
        this.id = id;
        this.position = position;
        this.coverageRadius = coverageRadius;
    }

    public double distanceTo(Position point) {
        return position.distanceTo(point);
    }

    public boolean covers(Position point) {
        return distanceTo(point) <= coverageRadius;
    }

    public void enqueue(IncidentReport report) {
        pendingReports.add(report);
    }

    /** Removes and returns every queued report in arrival order. */
    public List<IncidentReport> drain() {
        List<IncidentReport> drained = new ArrayList<>();
        IncidentReport next;
        while ((next = pendingReports.poll()) != null) {
            drained.add(next);
        }
        return drained;
    }

    public int pendingCount() {
        return pendingReports.size();
    }

    public void updateVehiclesInRange(Set<String> vehicleIds) {
        this.vehiclesInRange = Set.copyOf(vehicleIds);
    }

    public Set<String> getVehiclesInRange() {
        return vehiclesInRange;
    }

    public int getId() { return id; }
    public Position getPosition() { return position; }
    public double getCoverageRadius() { return coverageRadius; }
}
