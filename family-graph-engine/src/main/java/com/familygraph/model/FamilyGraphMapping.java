package com.familygraph.model;

import java.util.Optional;

/**
 * Structural slot a relationship type feeds when it is shown on family trees.
 */
public enum FamilyGraphMapping {
    PARENT("parent"),
    FATHER("father"),
    MOTHER("mother"),
    STEPPARENT("stepparent"),
    ADOPTIVE_PARENT("adoptive_parent"),
    FOSTER_PARENT("foster_parent"),
    GUARDIAN("guardian"),
    SPOUSE("spouse"),
    CHILD("child");

    private final String value;

    FamilyGraphMapping(String value) {
        this.value = value;
    }

    /** Unknown values map to empty rather than failing. */
    public static Optional<FamilyGraphMapping> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        for (FamilyGraphMapping mapping : values()) {
            if (mapping.value.equals(normalized)) {
                return Optional.of(mapping);
            }
        }
        return Optional.empty();
    }
}
