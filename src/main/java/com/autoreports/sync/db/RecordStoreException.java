package com.autoreports.sync.db;

/**
 * Failure of a batch read against the record store. Fatal for the run.
 */
public class RecordStoreException extends Exception {

    public RecordStoreException(String message) {
        super(message);
    }

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
