package com.familygraph.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a traversal: the root, every reached person keyed by id, and the edges between them.
 */
public record FamilyTree(
    PersonNode root,
    Map<String, PersonNode> nodes,
    List<FamilyEdge> edges
) {
    public FamilyTree {
        nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        edges = List.copyOf(edges);
    }

    public boolean containsPerson(String id) {
        return nodes.containsKey(id);
    }
}
