package com.ivirs.backend.model;

import java.util.Map;

public enum VehicleRole {
    HONEST,
    MALICIOUS,
    EMERGENCY,
    UNCLASSIFIED;

    public static final String MALICIOUS_FLAG = "is_malicious";
    public static final String HONEST_FLAG = "is_honest_reporter";
    public static final String EMERGENCY_FLAG = "is_emergency";

    /**
     * Resolves the role from the attribute flags a mobility feed attaches to a vehicle.
     * A malicious flag wins over every other flag.
     */
    public static VehicleRole fromAttributes(Map<String, String> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return UNCLASSIFIED;
        }
        if (isSet(attributes, MALICIOUS_FLAG)) return MALICIOUS;
        if (isSet(attributes, EMERGENCY_FLAG)) return EMERGENCY;
        if (isSet(attributes, HONEST_FLAG)) return HONEST;
        return UNCLASSIFIED;
    }

    private static boolean isSet(Map<String, String> attributes, String flag) {
        return "true".equalsIgnoreCase(attributes.get(flag));
    }
}
