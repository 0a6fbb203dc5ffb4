package com.ivirs.backend.service;

/**
 * Identity under which dispatches are deduplicated.
 */
public enum DispatchKeyPolicy {
    /** One dispatch per (reporter, report timestamp). */
    REPORTER_AND_TIMESTAMP,
    /** One dispatch per reporter for the whole run. */
    REPORTER_ONLY
}
