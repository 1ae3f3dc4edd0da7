package com.bookkeeper.ingest.model;

import java.util.Locale;

public enum RunStatus {
    PENDING,
    COMPLETED,
    FAILED,
    PARTIAL;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RunStatus fromDbValue(String value) {
        return RunStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
