package com.familygraph.service;

import com.familygraph.model.RawRecord;

/**
 * Decides what kind of record a raw record is. Only "person" records become graph nodes.
 */
public interface RecordKindClassifier {

    String PERSON = "person";
    String UNKNOWN = "unknown";

    /**
     * @return the canonical record kind ("person", "place", "source", ...), or {@link #UNKNOWN}
     */
    String classify(RawRecord record);

    default boolean isPerson(RawRecord record) {
        return PERSON.equals(classify(record));
    }
}
