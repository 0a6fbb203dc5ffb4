package com.ivirs.backend.service;

import com.ivirs.backend.model.IncidentReport;
import com.ivirs.backend.model.Position;
import com.ivirs.backend.model.RoadsideNode;
import com.ivirs.backend.model.SkipReason;
import com.ivirs.backend.telemetry.TelemetrySink;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Assigns reports to roadside nodes.
 *
 * <p>The nearest node wins, ties going to the lowest node id. If the nearest node does not
 * cover the declared location the report is dropped, even when a farther node with a wider
 * radius would cover it. Dropped reports never count towards the report total but still land
 * in the report log without a node.
 */
@Slf4j
public class CoverageRouter {

    private final TelemetrySink telemetry;

    public CoverageRouter(TelemetrySink telemetry) {
        this.telemetry = telemetry;
    }

    public Optional<Integer> route(IncidentReport report, List<RoadsideNode> nodes) {
        RoadsideNode nearest = nearestNode(report.getLocation(), nodes);
        if (nearest == null || !nearest.covers(report.getLocation())) {
            report.markRouted(null);
            telemetry.recordSkip(SkipReason.OUT_OF_COVERAGE);
            telemetry.recordDropped(report);
            log.debug("Dropped {}: location {} outside coverage", report, report.getLocation());
            return Optional.empty();
        }
        report.markRouted(nearest.getId());
        nearest.enqueue(report);
        telemetry.recordAccepted();
        return Optional.of(nearest.getId());
    }

    /** Recomputes which present vehicles each node currently covers. */
    public void refreshCoverage(List<RoadsideNode> nodes, Map<String, Position> positions) {
        for (RoadsideNode node : nodes) {
            Set<String> inRange = new HashSet<>();
            positions.forEach((id, position) -> {
                if (node.covers(position)) {
                    inRange.add(id);
                }
            });
            node.updateVehiclesInRange(inRange);
        }
    }

    static RoadsideNode nearestNode(Position location, List<RoadsideNode> nodes) {
        RoadsideNode nearest = null;
        double best = Double.MAX_VALUE;
        for (RoadsideNode node : nodes) {
            double d = node.distanceTo(location);
            if (d < best || (d == best && nearest != null && node.getId() < nearest.getId())) {
                best = d;
                nearest = node;
            }
        }
        return nearest;
    }
}
