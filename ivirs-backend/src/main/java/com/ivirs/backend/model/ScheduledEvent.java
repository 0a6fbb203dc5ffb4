package com.ivirs.backend.model;

import lombok.Value;

/**
 * A report-worthy event announced by the feed, due once the clock reaches {@code time}.
 */
@Value
public class ScheduledEvent {

    double time;
    long sequence;
    String vehicleId;
    Kind kind;
    ReportType reportType;

    public enum Kind {
        BREAKDOWN,
        CRASH,
        FAKE_REPORT;

        public boolean isGenuine() {
            return this != FAKE_REPORT;
        }
    }
}
