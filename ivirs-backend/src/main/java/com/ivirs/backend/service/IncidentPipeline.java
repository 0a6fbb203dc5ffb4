package com.ivirs.backend.service;

import com.ivirs.backend.model.EntitySnapshot;
import com.ivirs.backend.model.IncidentReport;
import com.ivirs.backend.model.Position;
import com.ivirs.backend.model.RoadsideNode;
import com.ivirs.backend.model.ScheduledEvent;
import com.ivirs.backend.model.SkipReason;
import com.ivirs.backend.telemetry.TelemetrySink;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Runs one tick of the report pipeline: snapshot, incident and fake-report hooks, routing,
 * corroboration, validation, dispatch and statistics, strictly in that order.
 */
@Slf4j
public class IncidentPipeline {

    /** Half-widths of the box a fake location is drawn from around the liar. */
    static final double FAKE_OFFSET_X = 500.0;
    static final double FAKE_OFFSET_Y = 200.0;

    private final List<RoadsideNode> nodes;
    private final VehicleRegistry registry;
    private final EventScheduler scheduler;
    private final CoverageRouter router;
    private final WitnessCorroboration corroboration;
    private final ValidationEngine validationEngine;
    private final DispatchDeduplicator dispatcher;
    private final TelemetrySink telemetry;
    private final Random random;

    private long tick;
    private double clock;
    private final AtomicBoolean finished = new AtomicBoolean(false);

    public IncidentPipeline(List<RoadsideNode> nodes,
                            VehicleRegistry registry,
                            EventScheduler scheduler,
                            CoverageRouter router,
                            WitnessCorroboration corroboration,
                            ValidationEngine validationEngine,
                            DispatchDeduplicator dispatcher,
                            TelemetrySink telemetry,
                            Random random) {
        this.nodes = Collections.unmodifiableList(nodes.stream()
                .sorted(Comparator.comparingInt(RoadsideNode::getId))
                .collect(Collectors.toList()));
        this.registry = registry;
        this.scheduler = scheduler;
        this.router = router;
        this.corroboration = corroboration;
        this.validationEngine = validationEngine;
        this.dispatcher = dispatcher;
        this.telemetry = telemetry;
        this.random = random;
    }

    public synchronized TickResult processTick(EntitySnapshot snapshot) {
        if (finished.get()) {
            throw new IllegalStateException("Run already finished at t=" + clock);
        }
        tick++;
        clock = snapshot.getTime();

        Set<String> departed = registry.update(snapshot);
        scheduler.forget(departed);
        scheduler.register(snapshot, registry);

        List<IncidentReport> created = new ArrayList<>();
        for (ScheduledEvent event : scheduler.popDue(clock)) {
            Optional<Position> position = registry.positionOf(event.getVehicleId());
            // the scheduler drops events of departed vehicles, this only guards the lookup
            if (position.isEmpty()) {
                telemetry.recordSkip(SkipReason.ENTITY_UNAVAILABLE);
                log.debug("Vehicle {} has no position for its {} event", event.getVehicleId(), event.getKind());
                continue;
            }
            if (event.getKind().isGenuine()) {
                created.addAll(createRealIncident(event, position.get()));
            } else {
                created.add(createFakeReport(event, position.get()));
            }
        }

        router.refreshCoverage(nodes, registry.positions());

        List<ValidationOutcome> outcomes = validationEngine.drainAll(nodes);

        int dispatches = 0;
        for (ValidationOutcome outcome : outcomes) {
            if (dispatcher.maybeDispatch(outcome.getReport())) {
                dispatches++;
            }
        }

        telemetry.maybeEmitStatistics(tick, clock, registry.activeCount());
        return new TickResult(tick, clock, created, outcomes, dispatches);
    }

    /**
     * Ends the run: writes the closing statistics row and releases the telemetry outputs.
     * Calling it again has no effect.
     */
    public void finish() {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        synchronized (this) {
            telemetry.emitStatistics(clock, registry.activeCount());
            telemetry.close();
            log.info("Run finished at t={}s after {} ticks: {} reports, {} detected fakes, {} dispatches",
                    String.format("%.1f", clock), tick, telemetry.totalReports(),
                    telemetry.detectedFakes(), telemetry.emergencyDispatches());
        }
    }

    public boolean isFinished() {
        return finished.get();
    }

    private List<IncidentReport> createRealIncident(ScheduledEvent event, Position position) {
        IncidentReport incident = new IncidentReport(event.getVehicleId(), event.getReportType(), position, clock, false);
        List<IncidentReport> witnessReports = corroboration.corroborate(incident, registry);
        telemetry.recordRealIncident();
        log.info("Real incident: {} by {} at {} ({} witnesses)",
                event.getReportType().wireName(), event.getVehicleId(), position, witnessReports.size());

        List<IncidentReport> created = new ArrayList<>();
        created.add(incident);
        router.route(incident, nodes);
        for (IncidentReport witnessReport : witnessReports) {
            router.route(witnessReport, nodes);
            created.add(witnessReport);
        }
        return created;
    }

    private IncidentReport createFakeReport(ScheduledEvent event, Position position) {
        Position fakeLocation = position.offset(
                uniform(-FAKE_OFFSET_X, FAKE_OFFSET_X),
                uniform(-FAKE_OFFSET_Y, FAKE_OFFSET_Y));
        IncidentReport report = new IncidentReport(event.getVehicleId(), event.getReportType(), fakeLocation, clock, true);
        telemetry.recordFakeReport();
        log.info("Fake report injected: {} by {} at {}", event.getReportType().wireName(), event.getVehicleId(), fakeLocation);
        router.route(report, nodes);
        return report;
    }

    private double uniform(double low, double high) {
        return low + (high - low) * random.nextDouble();
    }

    public List<RoadsideNode> getNodes() {
        return nodes;
    }

    public synchronized long getTick() {
        return tick;
    }

    public synchronized double getClock() {
        return clock;
    }
}
