package com.bookkeeper.ingest.service;

import com.bookkeeper.ingest.model.RunCounts;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.List;
import java.util.Map;

/**
 * Per-file outcome. {@code failure} is {@code null} for a file that was imported, even when some of
 * its rows errored.
 */
public record FileImportResult(
        Path file,
        String source,
        RunCounts counts,
        int reviewCandidates,
        int filteredBySince,
        int inBatchCollisions,
        List<String> rowErrors,
        Failure failure,
        String failureMessage
) {
    public enum Failure {
        FILE_READ,
        STORE_READ,
        STORE_WRITE
    }

    public FileImportResult {
        rowErrors = List.copyOf(rowErrors);
    }

    static FileImportResult failed(Path file, String source, RunCounts counts, List<String> rowErrors, Failure failure, String message) {
        return new FileImportResult(file, source, counts, 0, 0, 0, rowErrors, failure, message);
    }

    public boolean failed() {
        return failure != null;
    }

    Map<String, Object> toDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("file", file.toString());
        details.put("source", source);
        details.put("processed", counts.processed());
        details.put("inserted", counts.inserted());
        details.put("updated", counts.updated());
        details.put("skipped", counts.skipped());
        details.put("errored", counts.errored());
        details.put("reviewCandidates", reviewCandidates);
        details.put("filteredBySince", filteredBySince);
        details.put("inBatchCollisions", inBatchCollisions);
        if (!rowErrors.isEmpty()) {
            details.put("rowErrors", rowErrors);
        }
        if (failed()) {
            details.put("failure", failure.name().toLowerCase(Locale.ROOT));
            details.put("failureMessage", failureMessage);
        }
        return details;
    }
}
