package com.ivirs.backend.service;

import com.ivirs.backend.model.EntitySnapshot;
import com.ivirs.backend.model.IncidentReport;
import com.ivirs.backend.model.Position;
import com.ivirs.backend.model.ReportType;
import com.ivirs.backend.model.RoadsideNode;
import com.ivirs.backend.model.SkipReason;
import com.ivirs.backend.model.VehicleRecord;
import com.ivirs.backend.telemetry.TelemetrySink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ValidationEngineTest {

    private ReputationStore reputation;
    private VehicleRegistry registry;
    private TelemetrySink telemetry;
    private ValidationEngine engine;

    @BeforeEach
    void setUp() {
        reputation = new ReputationStore();
        registry = new VehicleRegistry();
        telemetry = new TelemetrySink(List.of(), 100);
        engine = new ValidationEngine(reputation, registry, telemetry);
    }

    private void placeVehicle(String id, double x, double y) {
        registry.update(new EntitySnapshot(1.0, List.of(new VehicleRecord(id, new Position(x, y), Map.of()))));
    }

    private static IncidentReport report(String reporter, double x, double y, boolean fake, String... witnesses) {
        IncidentReport report = new IncidentReport(reporter, ReportType.ACCIDENT, new Position(x, y), 1.0, fake);
        for (String witness : witnesses) {
            report.addWitness(witness);
        }
        return report;
    }

    @Test
    void lonelyDistantClaimIsFlaggedAndPenalized() {
        placeVehicle("veh_a", 600, 0);
        IncidentReport claim = report("veh_a", 0, 0, true);

        ValidationOutcome outcome = engine.validate(claim).orElseThrow();

        assertEquals(0.0, outcome.getScore(), 1e-9);
        assertTrue(outcome.isFlaggedFake());
        assertEquals(0.2, outcome.getReputationAfter(), 1e-9);
        assertEquals(0.2, reputation.peek("veh_a"), 1e-9);
        assertEquals(1, telemetry.detectedFakes());
        assertEquals(0, telemetry.falsePositives());
        assertEquals(0, telemetry.skipCount(SkipReason.ENTITY_UNAVAILABLE));
    }

    @Test
    void wellWitnessedNearbyClaimFromTrustedReporterIsClamped() {
        reputation.adjust("veh_b", 0.4);
        placeVehicle("veh_b", 50, 0);
        IncidentReport claim = report("veh_b", 0, 0, false, "w1", "w2", "w3");

        ValidationOutcome outcome = engine.validate(claim).orElseThrow();

        assertEquals(1.0, outcome.getScore(), 1e-9);
        assertTrue(outcome.isAccepted());
        assertTrue(DispatchDeduplicator.isEligible(claim));
        assertEquals(1.0, reputation.peek("veh_b"), 1e-9);
    }

    @Test
    void unknownReporterPositionSkipsDistanceTerm() {
        IncidentReport claim = report("veh_c", 0, 0, false, "w1");

        ValidationOutcome outcome = engine.validate(claim).orElseThrow();

        assertEquals(0.7, outcome.getScore(), 1e-9);
        assertFalse(outcome.isFlaggedFake());
        assertEquals(0.6, reputation.peek("veh_c"), 1e-9);
        assertEquals(1, telemetry.skipCount(SkipReason.ENTITY_UNAVAILABLE));
    }

    @Test
    void midRangeDistanceHasNoEffect() {
        placeVehicle("veh_d", 300, 0);
        IncidentReport claim = report("veh_d", 0, 0, false, "w1");

        assertEquals(0.7, engine.score(claim), 1e-9);
    }

    @Test
    void genuineReportFlaggedFakeCountsAsFalsePositive() {
        placeVehicle("veh_e", 1000, 0);
        IncidentReport claim = report("veh_e", 0, 0, false);

        engine.validate(claim);

        assertEquals(1, telemetry.detectedFakes());
        assertEquals(1, telemetry.falsePositives());
    }

    @Test
    void scoreStaysInsideUnitRange() {
        reputation.adjust("low", -1.0);
        placeVehicle("low", 5000, 0);
        assertEquals(0.0, engine.score(report("low", 0, 0, true)));

        reputation.adjust("high", 1.0);
        assertEquals(1.0, engine.score(report("high", 0, 0, false, "a", "b")));
    }

    @Test
    void groundTruthDoesNotInfluenceScore() {
        placeVehicle("veh_f", 20, 0);

        assertEquals(engine.score(report("veh_f", 0, 0, false, "w")),
                engine.score(report("veh_f", 0, 0, true, "w")));
    }

    @Test
    void repeatedValidationChangesNothing() {
        IncidentReport claim = report("veh_g", 0, 0, false, "w1");
        engine.validate(claim);
        double reputationAfterFirst = reputation.peek("veh_g");
        double scoreAfterFirst = claim.getTrustScore();

        Optional<ValidationOutcome> second = engine.validate(claim);

        assertTrue(second.isEmpty());
        assertEquals(reputationAfterFirst, reputation.peek("veh_g"));
        assertEquals(scoreAfterFirst, claim.getTrustScore());
        assertEquals(1, telemetry.reports().size());
        assertEquals(0, telemetry.detectedFakes());
        assertEquals(1, telemetry.skipCount(SkipReason.DUPLICATE_VALIDATION));
    }

    @Test
    void reportQueuedTwiceIsValidatedOnce() {
        RoadsideNode node = new RoadsideNode(0, new Position(0, 0), 500);
        IncidentReport claim = report("veh_h", 0, 0, false, "w1");
        node.enqueue(claim);
        node.enqueue(claim);

        List<ValidationOutcome> outcomes = engine.drain(node);

        assertEquals(1, outcomes.size());
        assertEquals(0, node.pendingCount());
        assertEquals(0.6, reputation.peek("veh_h"), 1e-9);
    }

    @Test
    void drainAllGroupsOutcomesByNodeId() {
        RoadsideNode second = new RoadsideNode(2, new Position(2000, 0), 500);
        RoadsideNode first = new RoadsideNode(1, new Position(0, 0), 500);
        second.enqueue(report("veh_x", 2000, 0, false, "w"));
        first.enqueue(report("veh_y", 0, 0, false, "w"));

        List<ValidationOutcome> outcomes = engine.drainAll(List.of(second, first));

        assertEquals(List.of("veh_y", "veh_x"),
                outcomes.stream().map(o -> o.getReport().getReporterId()).collect(Collectors.toList()));
    }

    @Test
    void parallelNodesSerializeUpdatesOfOneReporter() {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            ValidationEngine parallel = new ValidationEngine(reputation, registry, telemetry, pool);
            RoadsideNode a = new RoadsideNode(0, new Position(0, 0), 500);
            RoadsideNode b = new RoadsideNode(1, new Position(2000, 0), 500);
            a.enqueue(report("twin", 0, 0, false, "w1", "w2"));
            b.enqueue(report("twin", 2000, 0, false, "w1", "w2"));

            List<ValidationOutcome> outcomes = parallel.drainAll(List.of(a, b));

            assertEquals(2, outcomes.size());
            assertEquals(0.7, reputation.peek("twin"), 1e-9);
            List<Double> after = outcomes.stream().map(ValidationOutcome::getReputationAfter).sorted().collect(Collectors.toList());
            assertEquals(0.6, after.get(0), 1e-9);
            assertEquals(0.7, after.get(1), 1e-9);
        } finally {
            pool.shutdownNow();
        }
    }
}
