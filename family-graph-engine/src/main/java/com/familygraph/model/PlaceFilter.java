package com.familygraph.model;

/**
 * Keeps only people associated with a place. Each association kind can be
 * switched on or off independently.
 */
public record PlaceFilter(
    String placeName,
    boolean birth,
    boolean death,
    boolean marriage,
    boolean burial
) {
    public boolean matches(PersonNode person) {
        if (placeName == null || placeName.isBlank()) {
            return true;
        }
        if (birth && samePlace(person.birthPlace())) return true;
        if (death && samePlace(person.deathPlace())) return true;
        if (burial && samePlace(person.burialPlace())) return true;
        if (marriage) {
            for (SpouseRelation spouse : person.spouses()) {
                if (samePlace(spouse.location())) return true;
            }
        }
        return false;
    }

    private boolean samePlace(String value) {
        if (value == null) {
            return false;
        }
        return strip(value).equalsIgnoreCase(strip(placeName));
    }

    // "[[Places/Leeds|Leeds]]" and "Leeds" name the same place
    private static String strip(String value) {
        String s = value.trim();
        if (s.startsWith("[[") && s.endsWith("]]")) {
            s = s.substring(2, s.length() - 2);
            int pipe = s.indexOf('|');
            if (pipe >= 0) {
                s = s.substring(pipe + 1);
            } else {
                s = s.substring(s.lastIndexOf('/') + 1);
            }
        }
        return s.trim();
    }
}
