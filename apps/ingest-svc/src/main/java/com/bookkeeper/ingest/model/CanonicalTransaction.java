package com.bookkeeper.ingest.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Normalized record shape shared by every bank format. Expenses are negative,
 * income is positive. Optional fields are {@code null} when the export does not carry them.
 */
public record CanonicalTransaction(
        LocalDate date,
        String description,
        BigDecimal amount,
        String source,
        String txnId,
        String reference,
        String account,
        BigDecimal balance,
        String timePart
) {
    public CanonicalTransaction {
        Objects.requireNonNull(date, "date must be provided");
        Objects.requireNonNull(amount, "amount must be provided");
        amount = amount.setScale(2, RoundingMode.HALF_UP);
        description = description == null ? "" : description.trim();
        source = blankToNull(source);
        txnId = blankToNull(txnId);
        reference = blankToNull(reference);
        account = blankToNull(account);
        timePart = blankToNull(timePart);
        if (balance != null) {
            balance = balance.setScale(2, RoundingMode.HALF_UP);
        }
    }

    public boolean hasTxnIdAndAccount() {
        return txnId != null && account != null;
    }

    public boolean hasReference() {
        return reference != null;
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
