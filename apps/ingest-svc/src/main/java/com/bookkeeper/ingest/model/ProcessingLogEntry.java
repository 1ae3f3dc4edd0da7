package com.bookkeeper.ingest.model;

import java.time.Instant;
import java.util.Map;

public record ProcessingLogEntry(
        long id,
        String operationType,
        String sourceFile,
        RunCounts counts,
        RunStatus status,
        Map<String, Object> details,
        Instant startedAt,
        Instant completedAt
) {
    public boolean completed() {
        return completedAt != null;
    }
}
