package com.familygraph.repository;

import com.familygraph.model.RawRecord;

import java.util.List;

/**
 * Source of the raw records a graph snapshot is built from. The engine only reads.
 */
public interface RecordStore {

    /**
     * Every candidate record. Called again on each rebuild.
     *
     * @throws RecordStoreException when the store cannot be read
     */
    List<RawRecord> findAll();
}
