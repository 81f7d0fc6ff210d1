package com.familygraph.service;

import java.util.List;
import java.util.Map;

/**
 * Small enumerations whose values users may spell their own way.
 */
public enum ValueAliasField {

    SEX(
        List.of("M", "F", "X", "U"),
        Map.ofEntries(
            Map.entry("male", "M"),
            Map.entry("female", "F"),
            Map.entry("man", "M"),
            Map.entry("woman", "F"),
            Map.entry("boy", "M"),
            Map.entry("girl", "F"),
            Map.entry("nonbinary", "X"),
            Map.entry("non-binary", "X"),
            Map.entry("nb", "X"),
            Map.entry("enby", "X"),
            Map.entry("intersex", "X"),
            Map.entry("other", "X"),
            Map.entry("unknown", "U"),
            Map.entry("?", "U"),
            Map.entry("unk", "U")
        )
    ),

    NOTE_TYPE(
        List.of("person", "place", "event", "source", "organization", "map", "schema", "timeline",
            "universe", "proof_summary"),
        Map.ofEntries(
            Map.entry("org", "organization"),
            Map.entry("company", "organization"),
            Map.entry("group", "organization"),
            Map.entry("faction", "organization"),
            Map.entry("guild", "organization"),
            Map.entry("house", "organization"),
            Map.entry("character", "person"),
            Map.entry("individual", "person"),
            Map.entry("location", "place"),
            Map.entry("locale", "place"),
            Map.entry("reference", "source"),
            Map.entry("citation", "source"),
            Map.entry("document", "source")
        )
    ),

    MARRIAGE_STATUS(
        List.of("current", "divorced", "widowed", "separated", "annulled"),
        Map.ofEntries(
            Map.entry("married", "current"),
            Map.entry("active", "current"),
            Map.entry("divorce", "divorced"),
            Map.entry("widow", "widowed"),
            Map.entry("widower", "widowed"),
            Map.entry("separation", "separated"),
            Map.entry("annulment", "annulled")
        )
    );

    private final List<String> canonicalValues;
    private final Map<String, String> builtInSynonyms;

    ValueAliasField(List<String> canonicalValues, Map<String, String> builtInSynonyms) {
        this.canonicalValues = canonicalValues;
        this.builtInSynonyms = builtInSynonyms;
    }

    public List<String> canonicalValues() {
        return canonicalValues;
    }

    public Map<String, String> builtInSynonyms() {
        return builtInSynonyms;
    }
}
