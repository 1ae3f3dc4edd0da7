package com.bookkeeper.ingest.model;

import java.util.Locale;

public enum ReviewAction {
    KEEP,
    MERGE,
    DELETE,
    IGNORE;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean removesMembers() {
        return this == MERGE || this == DELETE;
    }

    public static ReviewAction parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("review action must be provided");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("KEEP_BOTH".equals(normalized)) {
            return KEEP;
        }
        if ("DELETE_DUPLICATE".equals(normalized)) {
            return DELETE;
        }
        try {
            return ReviewAction.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown review action '" + value + "' (expected keep, merge, delete or ignore)");
        }
    }
}
