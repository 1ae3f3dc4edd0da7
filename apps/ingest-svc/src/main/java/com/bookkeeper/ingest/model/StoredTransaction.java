package com.bookkeeper.ingest.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A transaction already owned by the record store.
 */
public record StoredTransaction(
        long id,
        LocalDate date,
        String description,
        BigDecimal amount,
        String rowHash,
        String possibleDupGroup,
        String category,
        String vendor
) {
    public boolean grouped() {
        return possibleDupGroup != null && !possibleDupGroup.isBlank();
    }

    public boolean categorized() {
        return category != null && !category.isBlank();
    }
}
