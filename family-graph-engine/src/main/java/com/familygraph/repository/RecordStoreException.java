package com.familygraph.repository;

/**
 * Exception thrown when records cannot be read from the record store.
 */
public class RecordStoreException extends RuntimeException {

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
