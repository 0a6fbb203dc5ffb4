package com.ivirs.backend.service;

import com.ivirs.backend.config.IvirsProperties;
import com.ivirs.backend.feed.MobilityFeed;
import com.ivirs.backend.model.EntitySnapshot;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Drives the pipeline from the mobility feed, one snapshot per scheduled tick, until the feed
 * is exhausted or the simulated time budget runs out.
 */
@Slf4j
@Service
public class SimulationTickService {

    private final MobilityFeed feed;
    private final IncidentPipeline pipeline;
    private final IvirsProperties.Simulation settings;

    public SimulationTickService(MobilityFeed feed, IncidentPipeline pipeline, IvirsProperties properties) {
        this.feed = feed;
        this.pipeline = pipeline;
        this.settings = properties.getSimulation();
    }

    @Scheduled(fixedRateString = "${ivirs.simulation.tick-interval-ms:100}")
    public void runSimulationTick() {
        if (!settings.isEnabled() || pipeline.isFinished()) {
            return;
        }
        if (feed.isExhausted()) {
            log.info("Mobility feed exhausted, ending run");
            pipeline.finish();
            return;
        }

        Optional<EntitySnapshot> snapshot = feed.poll();
        if (snapshot.isEmpty()) {
            return;
        }
        if (snapshot.get().getTime() > settings.getMaxTime()) {
            log.info("Time budget of {}s reached, ending run", settings.getMaxTime());
            pipeline.finish();
            return;
        }
        pipeline.processTick(snapshot.get());
    }

    @PreDestroy
    public void shutdown() {
        pipeline.finish();
    }
}
