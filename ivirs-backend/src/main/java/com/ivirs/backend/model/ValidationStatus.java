package com.ivirs.backend.model;

public enum ValidationStatus {
    PENDING,
    VALIDATED
}
