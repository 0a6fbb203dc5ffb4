package com.ivirs.backend.service;

import com.ivirs.backend.model.IncidentReport;
import com.ivirs.backend.model.VehicleRole;
import com.ivirs.backend.telemetry.DispatchEvent;
import com.ivirs.backend.telemetry.TelemetrySink;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fires at most one emergency response per report identity for the lifetime of the run.
 *
 * <p>Witness reports carry the witness as reporter, so they are distinct identities and
 * dispatch on their own.
 */
@Slf4j
public class DispatchDeduplicator {

    /** Validated reports scoring at least this are dispatch-eligible. */
    public static final double DISPATCH_THRESHOLD = 0.7;

    private final DispatchKeyPolicy keyPolicy;
    private final VehicleRegistry registry;
    private final TelemetrySink telemetry;
    private final Set<DispatchKey> ledger = ConcurrentHashMap.newKeySet();

    public DispatchDeduplicator(DispatchKeyPolicy keyPolicy, VehicleRegistry registry, TelemetrySink telemetry) {
        this.keyPolicy = keyPolicy;
        this.registry = registry;
        this.telemetry = telemetry;
    }

    public static boolean isEligible(IncidentReport report) {
        return report.isValidated() && report.getTrustScore() >= DISPATCH_THRESHOLD;
    }

    /**
     * @return true iff this call issued a new dispatch
     */
    public boolean maybeDispatch(IncidentReport report) {
        if (!isEligible(report)) {
            return false;
        }
        if (!ledger.add(keyOf(report))) {
            return false;
        }
        String responder = registry.nearestWithRole(VehicleRole.EMERGENCY, report.getLocation()).orElse(null);
        DispatchEvent event = new DispatchEvent(
                report.getReporterId(), report.getTimestamp(), report.getLocation().toList(), responder);
        telemetry.recordDispatch(event);
        log.info("Emergency dispatched to {} for {} report of {}{}",
                report.getLocation(), report.getType().wireName(), report.getReporterId(),
                responder == null ? "" : " (responder " + responder + ")");
        return true;
    }

    public boolean alreadyDispatched(IncidentReport report) {
        return ledger.contains(keyOf(report));
    }

    public int ledgerSize() {
        return ledger.size();
    }

    private DispatchKey keyOf(IncidentReport report) {
        Double timestamp = keyPolicy == DispatchKeyPolicy.REPORTER_AND_TIMESTAMP ? report.getTimestamp() : null;
        return new DispatchKey(report.getReporterId(), timestamp);
    }

    @Value
    private static class DispatchKey {
        String reporterId;
        Double timestamp;
    }
}
