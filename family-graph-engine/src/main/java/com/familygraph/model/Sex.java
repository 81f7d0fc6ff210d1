package com.familygraph.model;

/**
 * Canonical sex values, GEDCOM style. {@link #U} covers both "unknown" and "not recorded".
 */
public enum Sex {
    M,
    F,
    X,
    U;

    public static Sex fromCanonical(String value) {
        if (value == null || value.isBlank()) {
            return U;
        }
        for (Sex sex : values()) {
            if (sex.name().equalsIgnoreCase(value.trim())) {
                return sex;
            }
        }
        return U;
    }
}
