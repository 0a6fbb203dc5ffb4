package com.ivirs.backend.config;

import com.ivirs.backend.feed.MobilityFeed;
import com.ivirs.backend.feed.PushMobilityFeed;
import com.ivirs.backend.feed.SyntheticHighwayFeed;
import com.ivirs.backend.service.CoverageRouter;
import com.ivirs.backend.service.DispatchDeduplicator;
import com.ivirs.backend.service.EventScheduler;
import com.ivirs.backend.service.IncidentPipeline;
import com.ivirs.backend.service.ReputationStore;
import com.ivirs.backend.service.RoadsideLayoutService;
import com.ivirs.backend.service.ValidationEngine;
import com.ivirs.backend.service.VehicleRegistry;
import com.ivirs.backend.service.WitnessCorroboration;
import com.ivirs.backend.telemetry.JsonLinesTelemetryWriter;
import com.ivirs.backend.telemetry.TelemetryCodec;
import com.ivirs.backend.telemetry.TelemetryPublisher;
import com.ivirs.backend.telemetry.TelemetrySink;
import com.ivirs.backend.telemetry.WebSocketTelemetryPublisher;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the pipeline components. They are plain classes so tests can build them directly.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public TelemetryCodec telemetryCodec() {
        return new TelemetryCodec();
    }

    @Bean(destroyMethod = "close")
    public TelemetrySink telemetrySink(IvirsProperties properties, SimpMessagingTemplate messagingTemplate,
                                       TelemetryCodec codec) {
        List<TelemetryPublisher> publishers = new ArrayList<>();
        publishers.add(new WebSocketTelemetryPublisher(messagingTemplate));
        String outputDir = properties.getTelemetry().getOutputDir();
        if (outputDir != null && !outputDir.isBlank()) {
            publishers.add(new JsonLinesTelemetryWriter(Path.of(outputDir), codec));
        }
        return new TelemetrySink(publishers, properties.getTelemetry().getStatsIntervalTicks());
    }

    @Bean
    public ReputationStore reputationStore() {
        return new ReputationStore();
    }

    @Bean
    public VehicleRegistry vehicleRegistry() {
        return new VehicleRegistry();
    }

    @Bean
    public EventScheduler eventScheduler(TelemetrySink telemetrySink) {
        return new EventScheduler(telemetrySink);
    }

    @Bean
    public CoverageRouter coverageRouter(TelemetrySink telemetrySink) {
        return new CoverageRouter(telemetrySink);
    }

    @Bean
    public WitnessCorroboration witnessCorroboration(IvirsProperties properties) {
        return new WitnessCorroboration(properties.getWitness().getRadius());
    }

    // one worker per roadside node
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "ivirs.validation", name = "parallel", havingValue = "true")
    public ExecutorService validationExecutor(RoadsideLayoutService layoutService) {
        return Executors.newFixedThreadPool(layoutService.nodes().size());
    }

    @Bean
    public ValidationEngine validationEngine(ReputationStore reputationStore, VehicleRegistry vehicleRegistry,
                                             TelemetrySink telemetrySink,
                                             ObjectProvider<ExecutorService> validationExecutor) {
        ExecutorService executor = validationExecutor.getIfAvailable();
        if (executor != null) {
            return new ValidationEngine(reputationStore, vehicleRegistry, telemetrySink, executor);
        }
        return new ValidationEngine(reputationStore, vehicleRegistry, telemetrySink);
    }

    @Bean
    public DispatchDeduplicator dispatchDeduplicator(IvirsProperties properties, VehicleRegistry vehicleRegistry,
                                                     TelemetrySink telemetrySink) {
        return new DispatchDeduplicator(properties.getDispatch().getKeyPolicy(), vehicleRegistry, telemetrySink);
    }

    @Bean
    public IncidentPipeline incidentPipeline(IvirsProperties properties, RoadsideLayoutService layoutService,
                                             VehicleRegistry vehicleRegistry, EventScheduler eventScheduler,
                                             CoverageRouter coverageRouter, WitnessCorroboration witnessCorroboration,
                                             ValidationEngine validationEngine, DispatchDeduplicator dispatchDeduplicator,
                                             TelemetrySink telemetrySink) {
        return new IncidentPipeline(layoutService.nodes(), vehicleRegistry, eventScheduler, coverageRouter,
                witnessCorroboration, validationEngine, dispatchDeduplicator, telemetrySink,
                new Random(properties.getSimulation().getSeed()));
    }

    @Bean
    public MobilityFeed mobilityFeed(IvirsProperties properties) {
        IvirsProperties.Feed feed = properties.getFeed();
        switch (feed.getMode()) {
            case PUSH:
                return new PushMobilityFeed(feed.getPushCapacity());
            case SYNTHETIC:
                return new SyntheticHighwayFeed(feed.getSynthetic(),
                        properties.getSimulation().getStepSeconds(),
                        new Random(properties.getSimulation().getSeed() + 1));
            default:
                throw new IllegalStateException("Unknown feed mode " + feed.getMode());
        }
    }
}
