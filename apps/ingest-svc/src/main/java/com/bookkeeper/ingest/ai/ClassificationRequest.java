package com.bookkeeper.ingest.ai;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * The only transaction data that leaves the process for classification. {@code id} is local to one
 * classifier call, and the description is masked on construction.
 */
public record ClassificationRequest(int id, LocalDate date, String description, BigDecimal amount) {
    public ClassificationRequest {
        description = DescriptionMasker.mask(description);
    }
}
