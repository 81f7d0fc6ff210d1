package com.familygraph.model;

import java.util.List;

/**
 * Direct relationships that cross from one user collection into another.
 * The pair is unordered; {@code fromCollection} sorts first.
 */
public record CollectionConnection(
    String fromCollection,
    String toCollection,
    List<PersonNode> bridgePeople,
    int relationshipCount
) {
    public CollectionConnection {
        bridgePeople = List.copyOf(bridgePeople);
    }
}
