package com.bookkeeper.ingest.model;

/**
 * Pattern to category rule. {@code sequence} is the creation order and breaks priority ties.
 */
public record VendorMappingRule(
        long sequence,
        String pattern,
        String category,
        boolean regex,
        int priority
) {
    public VendorMappingRule {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("pattern must be provided");
        }
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category must be provided");
        }
    }
}
