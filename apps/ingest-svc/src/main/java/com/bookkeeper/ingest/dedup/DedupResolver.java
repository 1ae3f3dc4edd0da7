package com.bookkeeper.ingest.dedup;

import com.bookkeeper.ingest.fingerprint.FingerprintedTransaction;
import com.bookkeeper.ingest.model.CanonicalTransaction;
import com.bookkeeper.ingest.model.Disposition;
import com.bookkeeper.ingest.model.StoredTransaction;
import com.bookkeeper.ingest.repository.RecordStore;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides, row by row, whether a fingerprinted transaction is new, an exact duplicate, or a
 * possible duplicate that needs a human decision.
 *
 * <p>Checks run in a fixed order against the store and against rows accepted earlier in the same
 * batch: bank transaction id with account, then reference with date and amount, then row hash.
 * A row that passes all three but shares date and amount with an active stored row or an earlier
 * accepted row joins a duplicate group with every row of that collision set.
 */
@Component
public class DedupResolver {

    private static final Logger log = LoggerFactory.getLogger(DedupResolver.class);

    public ResolutionResult resolve(List<FingerprintedTransaction> batch, RecordStore store) {
        BatchState state = new BatchState(store);
        for (FingerprintedTransaction row : batch) {
            state.resolve(row);
        }
        return new ResolutionResult(List.copyOf(state.results), Map.copyOf(state.assignments), Set.copyOf(state.touchedGroups));
    }

    private static final class BatchState {
        private final RecordStore store;
        private final Set<String> seenTxnIds = new HashSet<>();
        private final Set<String> seenReferences = new HashSet<>();
        private final Set<String> seenHashes = new HashSet<>();
        private final Map<String, Cluster> clusters = new HashMap<>();
        private final List<ResolvedTransaction> results = new ArrayList<>();
        private final Map<Long, String> assignments = new LinkedHashMap<>();
        private final Set<String> touchedGroups = new LinkedHashSet<>();

        BatchState(RecordStore store) {
            this.store = store;
        }

        void resolve(FingerprintedTransaction row) {
            CanonicalTransaction tx = row.transaction();
            String txnKey = tx.hasTxnIdAndAccount() ? tx.txnId() + "|" + tx.account() : null;
            if (txnKey != null && (seenTxnIds.contains(txnKey) || store.txnIdExists(tx.txnId(), tx.account()))) {
                results.add(ResolvedTransaction.duplicate(row, "txn_id"));
                return;
            }
            String referenceKey = tx.hasReference() ? tx.reference() + "|" + row.nearDupKey() : null;
            if (referenceKey != null && (seenReferences.contains(referenceKey) || store.referenceExists(tx.reference(), tx.date(), tx.amount()))) {
                results.add(ResolvedTransaction.duplicate(row, "reference"));
                return;
            }
            if (seenHashes.contains(row.rowHash()) || store.rowHashExists(row.rowHash())) {
                results.add(ResolvedTransaction.duplicate(row, "row_hash"));
                return;
            }

            if (txnKey != null) {
                seenTxnIds.add(txnKey);
            }
            if (referenceKey != null) {
                seenReferences.add(referenceKey);
            }
            seenHashes.add(row.rowHash());

            Cluster cluster = clusters.computeIfAbsent(row.nearDupKey(),
                    key -> new Cluster(store.findActiveByDateAndAmount(tx.date(), tx.amount())));
            int index = results.size();
            if (cluster.isEmpty()) {
                results.add(ResolvedTransaction.accepted(row));
            } else {
                String groupId = cluster.groupId(store);
                for (int earlier : cluster.batchIndexes) {
                    ResolvedTransaction previous = results.get(earlier);
                    if (previous.disposition() != Disposition.REVIEW_CANDIDATE) {
                        results.set(earlier, ResolvedTransaction.candidate(previous.row(), groupId));
                    }
                }
                for (StoredTransaction member : cluster.stored) {
                    if (!member.grouped()) {
                        assignments.putIfAbsent(member.id(), groupId);
                    }
                }
                results.add(ResolvedTransaction.candidate(row, groupId));
                touchedGroups.add(groupId);
                log.debug("Possible duplicate line={} key={} group={}", row.lineNumber(), row.nearDupKey(), groupId);
            }
            cluster.batchIndexes.add(index);
        }
    }

    private static final class Cluster {
        private final List<StoredTransaction> stored;
        private final List<Integer> batchIndexes = new ArrayList<>();
        private String groupId;

        Cluster(List<StoredTransaction> stored) {
            this.stored = stored;
            this.groupId = stored.stream()
                    .filter(StoredTransaction::grouped)
                    .map(StoredTransaction::possibleDupGroup)
                    .findFirst()
                    .orElse(null);
        }

        boolean isEmpty() {
            return stored.isEmpty() && batchIndexes.isEmpty();
        }

        String groupId(RecordStore store) {
            if (groupId == null) {
                groupId = store.allocateDupGroupId();
            }
            return groupId;
        }
    }
}
