package com.bookkeeper.ingest.fingerprint;

import com.bookkeeper.ingest.model.CanonicalTransaction;

/**
 * A canonical row annotated with its dedup fingerprints.
 *
 * @param rowHash      exact-match key over date, normalized description and amount
 * @param originalHash lineage digest over every raw field of the imported line
 * @param nearDupKey   date and amount only; rows sharing it are possible duplicates
 */
public record FingerprintedTransaction(
        CanonicalTransaction transaction,
        long lineNumber,
        String rowHash,
        String originalHash,
        String nearDupKey
) {
}
