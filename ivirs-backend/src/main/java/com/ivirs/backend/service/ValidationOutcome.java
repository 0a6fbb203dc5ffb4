package com.ivirs.backend.service;

import com.ivirs.backend.model.IncidentReport;
import lombok.Value;

/**
 * Result of validating one report. {@code reputationAfter} is the reporter's trust score right
 * after this outcome was applied.
 */
@Value
public class ValidationOutcome {
    IncidentReport report;
    double score;
    boolean flaggedFake;
    double reputationAfter;

    public boolean isAccepted() {
        return !flaggedFake;
    }
}
