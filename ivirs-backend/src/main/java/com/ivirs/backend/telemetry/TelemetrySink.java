package com.ivirs.backend.telemetry;

import com.ivirs.backend.model.IncidentReport;
import com.ivirs.backend.model.SkipReason;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Run-wide counters plus the append-only report, statistics and dispatch logs.
 *
 * <p>Counters are safe to bump from concurrent validation tasks. Every appended record is
 * forwarded to the configured publishers.
 */
@Slf4j
public class TelemetrySink {

    private final List<TelemetryPublisher> publishers;
    private final int statsIntervalTicks;

    private final AtomicLong totalReports = new AtomicLong();
    private final AtomicLong fakeReports = new AtomicLong();
    private final AtomicLong realIncidents = new AtomicLong();
    private final AtomicLong detectedFakes = new AtomicLong();
    private final AtomicLong falsePositives = new AtomicLong();
    private final AtomicLong emergencyDispatches = new AtomicLong();
    private final Map<SkipReason, AtomicLong> skips = new EnumMap<>(SkipReason.class);

    private final List<ReportRecord> reportLog = Collections.synchronizedList(new ArrayList<>());
    private final List<StatisticsRow> statisticsLog = Collections.synchronizedList(new ArrayList<>());
    private final List<DispatchEvent> dispatchLog = Collections.synchronizedList(new ArrayList<>());

    private final AtomicBoolean closed = new AtomicBoolean(false);

    public TelemetrySink(List<TelemetryPublisher> publishers, int statsIntervalTicks) {
        if (statsIntervalTicks < 1) {
            throw new IllegalArgumentException("Statistics interval must be at least one tick");
        }
        this.publishers = List.copyOf(publishers);
        this.statsIntervalTicks = statsIntervalTicks;
        for (SkipReason reason : SkipReason.values()) {
            skips.put(reason, new AtomicLong());
        }
    }

    public void recordAccepted() {
        totalReports.incrementAndGet();
    }

    public void recordFakeReport() {
        fakeReports.incrementAndGet();
    }

    public void recordRealIncident() {
        realIncidents.incrementAndGet();
    }

    public void recordSkip(SkipReason reason) {
        skips.get(reason).incrementAndGet();
    }

    /** Counts the outcome and appends the report to the report log. */
    public void recordValidation(IncidentReport report, boolean flaggedFake) {
        if (flaggedFake) {
            detectedFakes.incrementAndGet();
            if (!report.isFake()) {
                falsePositives.incrementAndGet();
            }
        }
        ReportRecord record = ReportRecord.of(report);
        reportLog.add(record);
        publish(record);
    }

    /** Logs a report that never reached a node, without a node and unvalidated. */
    public void recordDropped(IncidentReport report) {
        ReportRecord record = ReportRecord.of(report);
        reportLog.add(record);
        publish(record);
    }

    public void recordDispatch(DispatchEvent event) {
        emergencyDispatches.incrementAndGet();
        dispatchLog.add(event);
        publish(event);
    }

    /** Emits a statistics row on every {@code statsIntervalTicks}-th tick. */
    public boolean maybeEmitStatistics(long tick, double time, int activeVehicles) {
        if (tick % statsIntervalTicks != 0) {
            return false;
        }
        emitStatistics(time, activeVehicles);
        return true;
    }

    public StatisticsRow emitStatistics(double time, int activeVehicles) {
        StatisticsRow row = new StatisticsRow(
                time,
                activeVehicles,
                totalReports.get(),
                fakeReports.get(),
                realIncidents.get(),
                detectedFakes.get(),
                falsePositives.get(),
                emergencyDispatches.get(),
                droppedReports(),
                detectionAccuracy());
        statisticsLog.add(row);
        publish(row);
        log.info("[STATS @ {}s] vehicles={}, reports={}, fake={}, detected={}, dispatches={}, accuracy={}",
                String.format("%.0f", time), activeVehicles, row.getTotalReports(), row.getFakeReports(),
                row.getDetectedFakes(), row.getEmergencyDispatches(), String.format("%.2f", row.getDetectionAccuracy()));
        return row;
    }

    /** {@code detected_fakes / fake_reports}, 0 while no fake report exists. */
    public double detectionAccuracy() {
        long fakes = fakeReports.get();
        return fakes == 0 ? 0.0 : (double) detectedFakes.get() / fakes;
    }

    public long totalReports() { return totalReports.get(); }
    public long fakeReports() { return fakeReports.get(); }
    public long realIncidents() { return realIncidents.get(); }
    public long detectedFakes() { return detectedFakes.get(); }
    public long falsePositives() { return falsePositives.get(); }
    public long emergencyDispatches() { return emergencyDispatches.get(); }
    public long droppedReports() { return skips.get(SkipReason.OUT_OF_COVERAGE).get(); }

    public long skipCount(SkipReason reason) {
        return skips.get(reason).get();
    }

    public Map<String, Object> counters() {
        Map<String, Object> counters = new LinkedHashMap<>();
        counters.put("totalReports", totalReports.get());
        counters.put("fakeReports", fakeReports.get());
        counters.put("realIncidents", realIncidents.get());
        counters.put("detectedFakes", detectedFakes.get());
        counters.put("falsePositives", falsePositives.get());
        counters.put("emergencyDispatches", emergencyDispatches.get());
        counters.put("droppedReports", droppedReports());
        counters.put("detectionAccuracy", detectionAccuracy());
        Map<String, Long> skipped = new LinkedHashMap<>();
        skips.forEach((reason, count) -> skipped.put(reason.name(), count.get()));
        counters.put("skipped", skipped);
        return counters;
    }

    public List<ReportRecord> reports() {
        synchronized (reportLog) {
            return List.copyOf(reportLog);
        }
    }

    public List<StatisticsRow> statistics() {
        synchronized (statisticsLog) {
            return List.copyOf(statisticsLog);
        }
    }

    public List<DispatchEvent> dispatches() {
        synchronized (dispatchLog) {
            return List.copyOf(dispatchLog);
        }
    }

    public void close() {
        if (closed.compareAndSet(false, true)) {
            publishers.forEach(TelemetryPublisher::close);
        }
    }

    private void publish(TelemetryRecord record) {
        if (closed.get()) {
            return;
        }
        for (TelemetryPublisher publisher : publishers) {
            publisher.publish(record);
        }
    }
}
