package com.bookkeeper.ingest.model;

/**
 * Base type for the recoverable failures raised while importing statements.
 */
public class IngestException extends RuntimeException {

    public IngestException(String message) {
        super(message);
    }

    public IngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
