package com.ivirs.backend.service;

import com.ivirs.backend.model.IncidentReport;
import com.ivirs.backend.model.Position;
import com.ivirs.backend.model.RoadsideNode;
import com.ivirs.backend.model.SkipReason;
import com.ivirs.backend.telemetry.TelemetrySink;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Scores queued reports and applies the reputation consequence.
 *
 * <p>The score depends only on the reporter's reputation, the witness count and how far the
 * reporter currently is from the declared location. The ground-truth flag of the report is
 * never read here.
 */
@Slf4j
public class ValidationEngine {

    static final double BASELINE = 0.5;
    static final double REPUTATION_WEIGHT = 0.3;
    static final double MULTI_WITNESS_BONUS = 0.4;
    static final double SINGLE_WITNESS_BONUS = 0.2;
    static final double NO_WITNESS_PENALTY = 0.2;
    static final double NEAR_DISTANCE = 100.0;
    static final double FAR_DISTANCE = 500.0;
    static final double NEAR_BONUS = 0.2;
    static final double FAR_PENALTY = 0.3;

    /** Scores below this are flagged fake. */
    public static final double FAKE_THRESHOLD = 0.3;

    private final ReputationStore reputation;
    private final VehicleRegistry registry;
    private final TelemetrySink telemetry;
    private final Executor executor;

    public ValidationEngine(ReputationStore reputation, VehicleRegistry registry, TelemetrySink telemetry) {
        this(reputation, registry, telemetry, Runnable::run);
    }

    /**
     * @param executor runs one drain task per node; a direct executor keeps validation sequential
     */
    public ValidationEngine(ReputationStore reputation, VehicleRegistry registry, TelemetrySink telemetry,
                            Executor executor) {
        this.reputation = reputation;
        this.registry = registry;
        this.telemetry = telemetry;
        this.executor = executor;
    }

    public double score(IncidentReport report) {
        double score = BASELINE;
        score += REPUTATION_WEIGHT * (reputation.get(report.getReporterId()) - BASELINE);

        int witnesses = report.witnessCount();
        if (witnesses >= 2) {
            score += MULTI_WITNESS_BONUS;
        } else if (witnesses == 1) {
            score += SINGLE_WITNESS_BONUS;
        } else {
            score -= NO_WITNESS_PENALTY;
        }

        Optional<Position> reporterPosition = registry.positionOf(report.getReporterId());
        if (reporterPosition.isPresent()) {
            double distance = reporterPosition.get().distanceTo(report.getLocation());
            if (distance < NEAR_DISTANCE) {
                score += NEAR_BONUS;
            } else if (distance > FAR_DISTANCE) {
                score -= FAR_PENALTY;
            }
        }
        return ReputationStore.clamp(score);
    }

    /**
     * Validates {@code report} once. A report that is already validated is left untouched and
     * yields an empty result.
     */
    public Optional<ValidationOutcome> validate(IncidentReport report) {
        if (report.isValidated()) {
            return duplicate(report);
        }
        double score = score(report);
        if (!report.completeValidation(score)) {
            return duplicate(report);
        }

        if (registry.positionOf(report.getReporterId()).isEmpty()) {
            // scored without the distance term
            telemetry.recordSkip(SkipReason.ENTITY_UNAVAILABLE);
            log.debug("Reporter {} has no current position, distance check skipped", report.getReporterId());
        }

        boolean flaggedFake = score < FAKE_THRESHOLD;
        double reputationAfter = flaggedFake
                ? reputation.penalize(report.getReporterId())
                : reputation.reward(report.getReporterId());
        telemetry.recordValidation(report, flaggedFake);

        if (flaggedFake) {
            log.info("Fake report detected: {} scored {} (reputation now {})",
                    report, String.format("%.2f", score), String.format("%.2f", reputationAfter));
        } else {
            log.debug("Accepted {} with score {}", report, String.format("%.2f", score));
        }
        return Optional.of(new ValidationOutcome(report, score, flaggedFake, reputationAfter));
    }

    /** Empties the node queue, validating each entry in arrival order. */
    public List<ValidationOutcome> drain(RoadsideNode node) {
        List<ValidationOutcome> outcomes = new ArrayList<>();
        for (IncidentReport report : node.drain()) {
            validate(report).ifPresent(outcomes::add);
        }
        return outcomes;
    }

    /** Drains every node. Results are grouped by node id whatever the executor. */
    public List<ValidationOutcome> drainAll(Collection<RoadsideNode> nodes) {
        List<RoadsideNode> ordered = nodes.stream()
                .sorted(Comparator.comparingInt(RoadsideNode::getId))
                .collect(Collectors.toList());
        List<CompletableFuture<List<ValidationOutcome>>> tasks = new ArrayList<>();
        for (RoadsideNode node : ordered) {
            tasks.add(CompletableFuture.supplyAsync(() -> drain(node), executor));
        }
        List<ValidationOutcome> outcomes = new ArrayList<>();
        for (CompletableFuture<List<ValidationOutcome>> task : tasks) {
            outcomes.addAll(task.join());
        }
        return outcomes;
    }

    private Optional<ValidationOutcome> duplicate(IncidentReport report) {
        telemetry.recordSkip(SkipReason.DUPLICATE_VALIDATION);
        log.debug("Ignoring repeated validation of {}", report);
        return Optional.empty();
    }
}
