package com.bookkeeper.ingest.normalize;

import java.util.List;

/**
 * Per-file mapping from column positions to canonical fields. Absent columns are {@code -1}.
 */
public record FormatProfile(
        int dateColumn,
        int descriptionColumn,
        int amountColumn,
        int debitColumn,
        int creditColumn,
        int typeColumn,
        int txnIdColumn,
        int referenceColumn,
        int timeColumn,
        int accountColumn,
        int balanceColumn,
        int sourceColumn,
        AmountConvention amountConvention,
        boolean invertSign,
        DateParser dateParser
) {
    public static final int ABSENT = -1;

    public FormatProfile {
        if (dateColumn < 0) {
            throw new IllegalArgumentException("date column must be mapped");
        }
        if (dateParser == null) {
            throw new IllegalArgumentException("dateParser must be provided");
        }
        switch (amountConvention) {
            case SIGNED_COLUMN, TYPE_COLUMN -> {
                if (amountColumn < 0) {
                    throw new IllegalArgumentException("amount column must be mapped for " + amountConvention);
                }
            }
            case DEBIT_CREDIT -> {
                if (debitColumn < 0 && creditColumn < 0) {
                    throw new IllegalArgumentException("debit or credit column must be mapped");
                }
            }
        }
    }

    public FormatProfile withInvertSign(boolean invert) {
        return new FormatProfile(dateColumn, descriptionColumn, amountColumn, debitColumn, creditColumn, typeColumn,
                txnIdColumn, referenceColumn, timeColumn, accountColumn, balanceColumn, sourceColumn,
                amountConvention, invert, dateParser);
    }

    public List<Integer> mappedColumns() {
        return List.of(dateColumn, descriptionColumn, amountColumn, debitColumn, creditColumn, typeColumn,
                txnIdColumn, referenceColumn, timeColumn, accountColumn, balanceColumn, sourceColumn);
    }
}
