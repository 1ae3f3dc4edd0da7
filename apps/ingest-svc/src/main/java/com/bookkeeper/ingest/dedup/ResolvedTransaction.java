package com.bookkeeper.ingest.dedup;

import com.bookkeeper.ingest.fingerprint.FingerprintedTransaction;
import com.bookkeeper.ingest.model.Disposition;

/**
 * @param dupGroupId shared group id for review candidates, otherwise {@code null}
 * @param reason     which check decided the disposition, e.g. {@code row_hash}
 */
public record ResolvedTransaction(
        FingerprintedTransaction row,
        Disposition disposition,
        String dupGroupId,
        String reason
) {

    static ResolvedTransaction accepted(FingerprintedTransaction row) {
        return new ResolvedTransaction(row, Disposition.NEW, null, "new");
    }

    static ResolvedTransaction duplicate(FingerprintedTransaction row, String reason) {
        return new ResolvedTransaction(row, Disposition.EXACT_DUPLICATE, null, reason);
    }

    static ResolvedTransaction candidate(FingerprintedTransaction row, String groupId) {
        return new ResolvedTransaction(row, Disposition.REVIEW_CANDIDATE, groupId, "date_amount");
    }
}
