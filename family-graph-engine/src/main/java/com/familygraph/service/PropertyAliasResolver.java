package com.familygraph.service;

import com.familygraph.config.GraphEngineProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves canonical property names against records that use user-chosen
 * names (e.g. "birthdate" instead of "born").
 */
@Service
public class PropertyAliasResolver {

    // canonical -> user property names, in configuration order
    private final Map<String, List<String>> aliasesByCanonical;

    public PropertyAliasResolver(GraphEngineProperties properties) {
        Map<String, List<String>> byCanonical = new LinkedHashMap<>();
        properties.getPropertyAliases().forEach((userProperty, canonical) ->
            byCanonical.computeIfAbsent(canonical, k -> new ArrayList<>()).add(userProperty));
        this.aliasesByCanonical = byCanonical;
    }

    /**
     * Look up a property by canonical name. The canonical property wins when
     * present; otherwise the first configured alias present in the record is used.
     *
     * @param record            raw property map
     * @param canonicalProperty canonical property name, e.g. "born"
     * @return the value, or empty if neither the canonical name nor an alias is set
     */
    public Optional<Object> resolve(Map<String, Object> record, String canonicalProperty) {
        Object value = record.get(canonicalProperty);
        if (value != null) {
            return Optional.of(value);
        }
        for (String userProperty : aliasesByCanonical.getOrDefault(canonicalProperty, Collections.emptyList())) {
            Object aliased = record.get(userProperty);
            if (aliased != null) {
                return Optional.of(aliased);
            }
        }
        return Optional.empty();
    }

    /** First non-blank string among the canonical names, tried in order. */
    public Optional<String> resolveString(Map<String, Object> record, String... canonicalProperties) {
        for (String canonical : canonicalProperties) {
            Optional<String> value = resolve(record, canonical)
                .map(PropertyAliasResolver::asString)
                .filter(s -> !s.isBlank());
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /** Lists keep their first element; everything else goes through toString. */
    static String asString(Object value) {
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            return list.isEmpty() || list.get(0) == null ? "" : list.get(0).toString().trim();
        }
        return value.toString().trim();
    }
}
