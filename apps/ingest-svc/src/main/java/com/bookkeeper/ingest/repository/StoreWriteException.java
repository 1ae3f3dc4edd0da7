package com.bookkeeper.ingest.repository;

import com.bookkeeper.ingest.model.IngestException;

/**
 * A batch could not be committed and was rolled back as a whole.
 */
public class StoreWriteException extends IngestException {

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
