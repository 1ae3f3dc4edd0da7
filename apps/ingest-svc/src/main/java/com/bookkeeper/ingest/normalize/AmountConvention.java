package com.bookkeeper.ingest.normalize;

/**
 * How a statement encodes the sign of an amount.
 */
public enum AmountConvention {
    /** One signed amount column. */
    SIGNED_COLUMN,
    /** Separate debit and credit columns; amount is credit minus debit. */
    DEBIT_CREDIT,
    /** Unsigned amount column whose sign comes from a transaction type column. */
    TYPE_COLUMN
}
