package com.familygraph.model;

/**
 * A directed edge emitted by traversal. Never stored on nodes.
 * {@code relationshipTypeId} and {@code label} are set for RELATIONSHIP edges,
 * and for PARENT or SPOUSE edges that came from a custom relationship type.
 */
public record FamilyEdge(
    String from,
    String to,
    EdgeType type,
    String relationshipTypeId,
    String label
) {
    public static FamilyEdge of(String from, String to, EdgeType type) {
        return new FamilyEdge(from, to, type, null, null);
    }

    public static FamilyEdge relationship(String from, String to, String relationshipTypeId, String label) {
        return new FamilyEdge(from, to, EdgeType.RELATIONSHIP, relationshipTypeId, label);
    }
}
