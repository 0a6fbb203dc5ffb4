package com.ivirs.backend.model;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * A single incident claim made by one vehicle.
 *
 * <p>The declared fields are fixed at creation. The witness set may only grow before the
 * report is routed, and the validation result is written exactly once.
 */
public class IncidentReport {

    @Getter
    private final String reporterId;
    @Getter
    private final ReportType type;
    @Getter
    private final Position location;
    @Getter
    private final double timestamp;

    /** Ground truth for evaluation. Never an input to scoring. */
    @Getter
    private final boolean fake;

    private final Set<String> witnesses = new LinkedHashSet<>();

    private boolean routed;
    private Integer nodeId;
    private ValidationStatus status = ValidationStatus.PENDING;
    private double trustScore = 0.5;

    public IncidentReport(String reporterId, ReportType type, Position location, double timestamp, boolean fake) {
        this.reporterId = reporterId;
        this.type = type;
        this.location = location;
        this.timestamp = timestamp;
        this.fake = fake;
    }

    public synchronized void addWitness(String witnessId) {
        if (routed) {
            throw new IllegalStateException("Witness set of report from " + reporterId + " is closed after routing");
        }
        witnesses.add(witnessId);
    }

    public synchronized Set<String> getWitnesses() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(witnesses));
    }

    public synchronized int witnessCount() {
        return witnesses.size();
    }

    /** Closes the witness set. {@code nodeId} is null when no node accepted the report. */
    public synchronized void markRouted(Integer nodeId) {
        if (routed) {
            throw new IllegalStateException("Report from " + reporterId + " at " + timestamp + " was already routed");
        }
        this.routed = true;
        this.nodeId = nodeId;
    }

    public synchronized boolean isRouted() {
        return routed;
    }

    public synchronized Optional<Integer> getNodeId() {
        return Optional.ofNullable(nodeId);
    }

    /**
     * Moves the report from pending to validated.
     *
     * @return false if the report had already been validated, in which case nothing changes
     */
    public synchronized boolean completeValidation(double score) {
        if (status == ValidationStatus.VALIDATED) {
            return false;
        }
        this.trustScore = score;
        this.status = ValidationStatus.VALIDATED;
        return true;
    }

    public synchronized ValidationStatus getStatus() {
        return status;
    }

    public synchronized boolean isValidated() {
        return status == ValidationStatus.VALIDATED;
    }

    public synchronized double getTrustScore() {
        return trustScore;
    }

    @Override
    public String toString() {
        return "IncidentReport{" + reporterId + ", " + type.wireName() + " @" + timestamp + "}";
    }
}
