package com.ivirs.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Optional;

public enum ReportType {
    @JsonProperty("accident") ACCIDENT,
    @JsonProperty("breakdown") BREAKDOWN,
    @JsonProperty("hazard") HAZARD;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ReportType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (ReportType type : values()) {
            if (type.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
