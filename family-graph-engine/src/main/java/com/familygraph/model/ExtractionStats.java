package com.familygraph.model;

/**
 * Counts gathered while a snapshot was built.
 */
public record ExtractionStats(
    int recordsScanned,
    int peopleExtracted,
    int nonPersonRecords,
    int missingIdRecords,
    int duplicateIds
) {
    public static ExtractionStats empty() {
        return new ExtractionStats(0, 0, 0, 0, 0);
    }
}
