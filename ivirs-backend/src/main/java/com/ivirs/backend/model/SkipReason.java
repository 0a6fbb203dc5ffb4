package com.ivirs.backend.model;

/**
 * Conditions that skip one operation of a tick. None of them stop the run.
 */
public enum SkipReason {
    /** A referenced vehicle has no position this tick. */
    ENTITY_UNAVAILABLE,
    /** The declared location is outside the nearest node's radius. The report is dropped. */
    OUT_OF_COVERAGE,
    /** A report reached the validation engine again after it was validated. */
    DUPLICATE_VALIDATION,
    /** An event-timer field was missing or unparseable; the event is not due yet. */
    MALFORMED_EVENT_TIMER
}
