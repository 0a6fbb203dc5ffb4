package com.ivirs.backend.service;

import com.ivirs.backend.config.IvirsProperties;
import com.ivirs.backend.feed.PushMobilityFeed;
import com.ivirs.backend.model.EntitySnapshot;
import com.ivirs.backend.model.Position;
import com.ivirs.backend.model.RoadsideNode;
import com.ivirs.backend.telemetry.TelemetrySink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SimulationTickServiceTest {

    private PushMobilityFeed feed;
    private IncidentPipeline pipeline;
    private IvirsProperties properties;
    private SimulationTickService service;

    @BeforeEach
    void setUp() {
        feed = new PushMobilityFeed(8);
        properties = new IvirsProperties();
        properties.getSimulation().setMaxTime(5.0);

        ReputationStore reputation = new ReputationStore();
        VehicleRegistry registry = new VehicleRegistry();
        TelemetrySink telemetry = new TelemetrySink(List.of(), 100);
        pipeline = new IncidentPipeline(List.of(new RoadsideNode(0, new Position(0, 0), 500)), registry,
                new EventScheduler(telemetry), new CoverageRouter(telemetry), new WitnessCorroboration(200),
                new ValidationEngine(reputation, registry, telemetry),
                new DispatchDeduplicator(DispatchKeyPolicy.REPORTER_AND_TIMESTAMP, registry, telemetry),
                telemetry, new Random(1));
        service = new SimulationTickService(feed, pipeline, properties);
    }

    @Test
    void consumesOneSnapshotPerTick() {
        feed.offer(new EntitySnapshot(1.0, List.of()));
        feed.offer(new EntitySnapshot(2.0, List.of()));

        service.runSimulationTick();
        assertEquals(1, pipeline.getTick());

        service.runSimulationTick();
        assertEquals(2, pipeline.getTick());
        assertEquals(2.0, pipeline.getClock());
    }

    @Test
    void emptyQueueIsNotATick() {
        service.runSimulationTick();

        assertEquals(0, pipeline.getTick());
        assertFalse(pipeline.isFinished());
    }

    @Test
    void snapshotPastTimeBudgetEndsRun() {
        feed.offer(new EntitySnapshot(5.0, List.of()));
        feed.offer(new EntitySnapshot(6.0, List.of()));

        service.runSimulationTick();
        service.runSimulationTick();

        assertEquals(1, pipeline.getTick());
        assertTrue(pipeline.isFinished());
    }

    @Test
    void endedFeedFinishesRunOnceDrained() {
        feed.offer(new EntitySnapshot(1.0, List.of()));
        feed.end();

        service.runSimulationTick();
        assertFalse(pipeline.isFinished());

        service.runSimulationTick();
        assertTrue(pipeline.isFinished());
    }

    @Test
    void disabledLoopDoesNothing() {
        properties.getSimulation().setEnabled(false);
        feed.offer(new EntitySnapshot(1.0, List.of()));

        service.runSimulationTick();

        assertEquals(0, pipeline.getTick());
        assertEquals(1, feed.queued());
    }
}
