package com.ivirs.backend.service;

import com.ivirs.backend.model.EntitySnapshot;
import com.ivirs.backend.model.ReportType;
import com.ivirs.backend.model.ScheduledEvent;
import com.ivirs.backend.model.ScheduledEvent.Kind;
import com.ivirs.backend.model.SkipReason;
import com.ivirs.backend.model.VehicleRecord;
import com.ivirs.backend.model.VehicleRole;
import com.ivirs.backend.telemetry.TelemetrySink;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Time-ordered queue of the report-worthy events announced through feed timer fields.
 *
 * <p>Each (vehicle, kind) pair is scheduled at most once while the vehicle stays in the
 * feed. A timer that cannot be read is left unscheduled and retried on the next snapshot.
 */
@Slf4j
public class EventScheduler {

    public static final String WILL_BREAKDOWN = "will_breakdown";
    public static final String BREAKDOWN_TIME = "breakdown_time";
    public static final String WILL_CRASH = "will_crash";
    public static final String CRASH_TIME = "crash_time";
    public static final String FAKE_REPORT_TIME = "fake_report_time";
    public static final String FAKE_REPORT_TYPE = "fake_report_type";

    private final TelemetrySink telemetry;
    private final PriorityQueue<ScheduledEvent> queue = new PriorityQueue<>(
            Comparator.comparingDouble(ScheduledEvent::getTime).thenComparingLong(ScheduledEvent::getSequence));
    private final Set<TimerKey> scheduled = new HashSet<>();
    private long sequence;

    public EventScheduler(TelemetrySink telemetry) {
        this.telemetry = telemetry;
    }

    /** Schedules every readable, not yet scheduled timer in {@code snapshot}. */
    public synchronized void register(EntitySnapshot snapshot, VehicleRegistry registry) {
        for (VehicleRecord vehicle : snapshot.getVehicles()) {
            if (vehicle.getId() == null || vehicle.getPosition() == null) {
                continue;
            }
            if ("true".equalsIgnoreCase(vehicle.attribute(WILL_BREAKDOWN))) {
                scheduleGenuine(vehicle, Kind.BREAKDOWN, BREAKDOWN_TIME, ReportType.BREAKDOWN);
            }
            if ("true".equalsIgnoreCase(vehicle.attribute(WILL_CRASH))) {
                scheduleGenuine(vehicle, Kind.CRASH, CRASH_TIME, ReportType.ACCIDENT);
            }
            if (registry.roleOf(vehicle.getId()) == VehicleRole.MALICIOUS
                    && (vehicle.attribute(FAKE_REPORT_TIME) != null || vehicle.attribute(FAKE_REPORT_TYPE) != null)) {
                scheduleFake(vehicle);
            }
        }
    }

    /** Pops every event whose time has been reached, oldest first. */
    public synchronized List<ScheduledEvent> popDue(double now) {
        List<ScheduledEvent> due = new ArrayList<>();
        while (!queue.isEmpty() && queue.peek().getTime() <= now) {
            due.add(queue.poll());
        }
        return due;
    }

    /**
     * Drops pending events and schedule markers of vehicles that left the feed. Each pending
     * event lost this way counts as an entity-unavailable skip.
     */
    public synchronized void forget(Set<String> departedIds) {
        if (departedIds.isEmpty()) {
            return;
        }
        Iterator<ScheduledEvent> iterator = queue.iterator();
        while (iterator.hasNext()) {
            ScheduledEvent event = iterator.next();
            if (departedIds.contains(event.getVehicleId())) {
                iterator.remove();
                telemetry.recordSkip(SkipReason.ENTITY_UNAVAILABLE);
                log.debug("Vehicle {} left before its {} event at t={} fired",
                        event.getVehicleId(), event.getKind(), event.getTime());
            }
        }
        scheduled.removeIf(key -> departedIds.contains(key.getVehicleId()));
    }

    public synchronized int pendingCount() {
        return queue.size();
    }

    private void scheduleGenuine(VehicleRecord vehicle, Kind kind, String timeKey, ReportType type) {
        if (scheduled.contains(new TimerKey(vehicle.getId(), kind))) {
            return;
        }
        Optional<Double> time = parseTime(vehicle.attribute(timeKey));
        if (time.isEmpty()) {
            malformed(vehicle.getId(), timeKey, vehicle.attribute(timeKey));
            return;
        }
        enqueue(vehicle.getId(), kind, type, time.get());
    }

    private void scheduleFake(VehicleRecord vehicle) {
        if (scheduled.contains(new TimerKey(vehicle.getId(), Kind.FAKE_REPORT))) {
            return;
        }
        Optional<Double> time = parseTime(vehicle.attribute(FAKE_REPORT_TIME));
        if (time.isEmpty()) {
            malformed(vehicle.getId(), FAKE_REPORT_TIME, vehicle.attribute(FAKE_REPORT_TIME));
            return;
        }
        Optional<ReportType> type = ReportType.parse(vehicle.attribute(FAKE_REPORT_TYPE));
        if (type.isEmpty()) {
            malformed(vehicle.getId(), FAKE_REPORT_TYPE, vehicle.attribute(FAKE_REPORT_TYPE));
            return;
        }
        enqueue(vehicle.getId(), Kind.FAKE_REPORT, type.get(), time.get());
    }

    private void enqueue(String vehicleId, Kind kind, ReportType type, double time) {
        queue.add(new ScheduledEvent(time, sequence++, vehicleId, kind, type));
        scheduled.add(new TimerKey(vehicleId, kind));
    }

    private void malformed(String vehicleId, String field, String raw) {
        telemetry.recordSkip(SkipReason.MALFORMED_EVENT_TIMER);
        log.debug("Timer field {}='{}' of vehicle {} is unreadable, event not due yet", field, raw, vehicleId);
    }

    static Optional<Double> parseTime(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    @Value
    private static class TimerKey {
        String vehicleId;
        Kind kind;
    }
}
