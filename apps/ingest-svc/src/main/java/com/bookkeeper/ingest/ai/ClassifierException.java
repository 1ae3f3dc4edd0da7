package com.bookkeeper.ingest.ai;

import com.bookkeeper.ingest.model.IngestException;

public class ClassifierException extends IngestException {

    public ClassifierException(String message) {
        super(message);
    }

    public ClassifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
