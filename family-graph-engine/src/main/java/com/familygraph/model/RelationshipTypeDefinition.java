package com.familygraph.model;

/**
 * A relationship kind, built in or user defined.
 *
 * @param inverse            id of the inverse type (mentor / disciple), may be null
 * @param familyGraphMapping null when the type never feeds a structural slot
 */
public record RelationshipTypeDefinition(
    String id,
    String name,
    String description,
    RelationshipCategory category,
    String color,
    LineStyle lineStyle,
    String inverse,
    boolean symmetric,
    boolean builtIn,
    boolean includeOnFamilyTree,
    FamilyGraphMapping familyGraphMapping
) {
    /** Both the inclusion flag and a mapping are required before a type reaches the graph. */
    public boolean isFamilyTreeEligible() {
        return includeOnFamilyTree && familyGraphMapping != null;
    }
}
