package com.bookkeeper.ingest.normalize;

import com.bookkeeper.ingest.model.IngestException;

/**
 * A single row could not be normalized; the row is skipped and the file continues.
 */
public class MalformedRowException extends IngestException {

    private final long lineNumber;

    public MalformedRowException(long lineNumber, String message) {
        super("line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public long lineNumber() {
        return lineNumber;
    }
}
