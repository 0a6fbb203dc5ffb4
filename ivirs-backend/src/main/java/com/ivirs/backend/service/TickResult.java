package com.ivirs.backend.service;

import com.ivirs.backend.model.IncidentReport;
import lombok.Value;

import java.util.List;

/**
 * What one tick produced.
 */
@Value
public class TickResult {
    long tick;
    double time;
    List<IncidentReport> createdReports;
    List<ValidationOutcome> outcomes;
    int dispatches;
}
