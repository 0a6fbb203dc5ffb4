package com.ivirs.backend.service;

import com.ivirs.backend.model.IncidentReport;
import com.ivirs.backend.model.Position;
import com.ivirs.backend.model.VehicleRole;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds honest vehicles close to a genuine incident and writes a report on behalf of each.
 *
 * <p>Every witness is added to the originating report's witness set, which must still be
 * open. Witness reports themselves carry no witnesses. Fake reports are never corroborated.
 */
public class WitnessCorroboration {

    public static final double DEFAULT_RADIUS = 200.0;

    private final double radius;

    public WitnessCorroboration(double radius) {
        this.radius = radius;
    }

    public List<IncidentReport> corroborate(IncidentReport incident, VehicleRegistry registry) {
        if (incident.isFake()) {
            return List.of();
        }
        List<IncidentReport> witnessReports = new ArrayList<>();
        for (String witnessId : registry.vehiclesWithRole(VehicleRole.HONEST)) {
            if (witnessId.equals(incident.getReporterId())) {
                continue;
            }
            Optional<Position> position = registry.positionOf(witnessId);
            if (position.isEmpty() || position.get().distanceTo(incident.getLocation()) >= radius) {
                continue;
            }
            incident.addWitness(witnessId);
            witnessReports.add(new IncidentReport(
                    witnessId, incident.getType(), incident.getLocation(), incident.getTimestamp(), false));
        }
        return witnessReports;
    }
}
