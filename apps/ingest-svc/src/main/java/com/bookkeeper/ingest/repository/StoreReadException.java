package com.bookkeeper.ingest.repository;

import com.bookkeeper.ingest.model.IngestException;

/**
 * A lookup against the store failed. Nothing was written by the failing call.
 */
public class StoreReadException extends IngestException {

    public StoreReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
