package com.familygraph.service;

import com.familygraph.config.GraphEngineProperties;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps user spellings of enumerated values onto canonical ones.
 * Order: canonical (case-insensitive), user synonym, built-in synonym, raw value.
 */
@Service
public class ValueAliasResolver {

    private final Map<ValueAliasField, Map<String, String>> canonicalByLowerCase = new EnumMap<>(ValueAliasField.class);
    private final Map<ValueAliasField, Map<String, String>> userSynonyms = new EnumMap<>(ValueAliasField.class);

    public ValueAliasResolver(GraphEngineProperties properties) {
        for (ValueAliasField field : ValueAliasField.values()) {
            Map<String, String> canonical = new HashMap<>();
            field.canonicalValues().forEach(v -> canonical.put(v.toLowerCase(), v));
            canonicalByLowerCase.put(field, canonical);

            Map<String, String> synonyms = new HashMap<>();
            properties.getValueAliases().getOrDefault(field, Map.of())
                .forEach((userValue, canonicalValue) -> synonyms.put(userValue.trim().toLowerCase(), canonicalValue));
            userSynonyms.put(field, synonyms);
        }
    }

    /**
     * Resolve a raw value to its canonical form. Never fails: unknown values pass through unchanged.
     */
    public String resolve(ValueAliasField field, String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return rawValue;
        }
        String normalized = rawValue.trim().toLowerCase();

        String canonical = canonicalByLowerCase.get(field).get(normalized);
        if (canonical != null) {
            return canonical;
        }
        String userValue = userSynonyms.get(field).get(normalized);
        if (userValue != null) {
            return userValue;
        }
        String builtIn = field.builtInSynonyms().get(normalized);
        if (builtIn != null) {
            return builtIn;
        }
        return rawValue;
    }

    public boolean isCanonical(ValueAliasField field, String value) {
        return value != null && canonicalByLowerCase.get(field).containsKey(value.trim().toLowerCase());
    }
}
