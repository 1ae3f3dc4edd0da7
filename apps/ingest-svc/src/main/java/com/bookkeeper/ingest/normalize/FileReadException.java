package com.bookkeeper.ingest.normalize;

import com.bookkeeper.ingest.model.IngestException;
import java.nio.file.Path;

/**
 * A whole statement file could not be opened or parsed. The run moves on to the next file.
 */
public class FileReadException extends IngestException {

    private final Path file;

    public FileReadException(Path file, String message) {
        super(file.getFileName() + ": " + message);
        this.file = file;
    }

    public FileReadException(Path file, String message, Throwable cause) {
        super(file.getFileName() + ": " + message, cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
