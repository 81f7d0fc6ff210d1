package com.familygraph.model;

public enum MarriageStatus {
    CURRENT,
    DIVORCED,
    WIDOWED,
    SEPARATED,
    ANNULLED;

    public String canonicalValue() {
        return name().toLowerCase();
    }

    public static MarriageStatus fromCanonical(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (MarriageStatus status : values()) {
            if (status.canonicalValue().equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return null;
    }
}
