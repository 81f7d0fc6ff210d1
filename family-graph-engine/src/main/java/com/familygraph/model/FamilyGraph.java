package com.familygraph.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable graph snapshot. A rebuild produces a new instance; nodes of
 * different snapshots are never mixed.
 */
public final class FamilyGraph {

    private final Map<String, PersonNode> nodesById;
    private final Instant builtAt;
    private final ExtractionStats stats;

    public FamilyGraph(Map<String, PersonNode> nodesById, Instant builtAt, ExtractionStats stats) {
        this.nodesById = Collections.unmodifiableMap(new LinkedHashMap<>(nodesById));
        this.builtAt = builtAt;
        this.stats = stats;
    }

    public static FamilyGraph empty() {
        return new FamilyGraph(Map.of(), Instant.EPOCH, ExtractionStats.empty());
    }

    public Optional<PersonNode> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(nodesById.get(id));
    }

    public boolean contains(String id) {
        return id != null && nodesById.containsKey(id);
    }

    public Collection<PersonNode> people() {
        return nodesById.values();
    }

    public Map<String, PersonNode> nodesById() {
        return nodesById;
    }

    public int size() {
        return nodesById.size();
    }

    public boolean isEmpty() {
        return nodesById.isEmpty();
    }

    public Instant builtAt() {
        return builtAt;
    }

    public ExtractionStats stats() {
        return stats;
    }
}
