package com.bookkeeper.ingest.model;

public enum Disposition {
    NEW,
    EXACT_DUPLICATE,
    REVIEW_CANDIDATE;

    public boolean inserts() {
        return this != EXACT_DUPLICATE;
    }
}
