package com.familygraph.model;

import java.util.List;

/**
 * Aggregate statistics over one snapshot. Percentages are whole numbers of
 * the total person count; years are null when no date carries a four-digit year.
 */
public record AnalyticsReport(
    int totalPeople,
    int peopleWithBirthDate,
    int birthDatePercent,
    int peopleWithDeathDate,
    int deathDatePercent,
    int peopleWithSex,
    int sexPercent,
    int peopleWithParents,
    int peopleWithSpouses,
    int peopleWithChildren,
    int orphanedPeople,
    int livingPeople,
    Integer earliestYear,
    Integer latestYear,
    Integer dateSpanYears,
    int totalComponents,
    int totalUserCollections,
    double averageCollectionSize,
    CollectionSize largestCollection,
    CollectionSize smallestCollection,
    List<CollectionConnection> topConnections
) {
    public AnalyticsReport {
        topConnections = List.copyOf(topConnections);
    }

    public record CollectionSize(String name, int size) {}
}
