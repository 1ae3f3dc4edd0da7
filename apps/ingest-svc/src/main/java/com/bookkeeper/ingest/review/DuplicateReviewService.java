package com.bookkeeper.ingest.review;

import com.bookkeeper.ingest.model.DuplicateGroup;
import com.bookkeeper.ingest.model.ReviewAction;
import com.bookkeeper.ingest.model.StoredTransaction;
import com.bookkeeper.ingest.repository.RecordStore;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies human decisions to duplicate groups. Group ids and member tags are never removed;
 * rows dropped by a decision are soft-deleted so their row hash keeps blocking re-imports.
 */
@Service
public class DuplicateReviewService {

    private static final Logger log = LoggerFactory.getLogger(DuplicateReviewService.class);

    public record ReviewOutcome(String groupId, ReviewAction action, Long keptTransactionId, List<Long> removedTransactionIds) {
    }

    private final RecordStore recordStore;
    private final Clock clock;

    public DuplicateReviewService(RecordStore recordStore, Clock clock) {
        this.recordStore = recordStore;
        this.clock = clock;
    }

    public List<DuplicateGroup> pendingGroups() {
        return recordStore.findPendingReviewGroups();
    }

    @Transactional
    public ReviewOutcome review(String groupId, ReviewAction action, Long keepTransactionId, String reviewer, String notes) {
        if (action == null) {
            throw new IllegalArgumentException("review action must be provided");
        }
        DuplicateGroup group = recordStore.findGroup(groupId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown duplicate group " + groupId));
        Instant now = clock.instant();

        List<Long> removed = List.of();
        if (action.removesMembers()) {
            if (keepTransactionId == null) {
                throw new IllegalArgumentException(action.dbValue() + " requires the id of the transaction to keep");
            }
            if (!group.contains(keepTransactionId)) {
                throw new IllegalArgumentException("Transaction " + keepTransactionId + " is not a member of " + groupId);
            }
            List<StoredTransaction> others = group.members().stream()
                    .filter(member -> member.id() != keepTransactionId)
                    .toList();
            if (action == ReviewAction.MERGE) {
                mergeInto(group, keepTransactionId, others);
            }
            removed = others.stream().map(StoredTransaction::id).toList();
            recordStore.softDelete(removed, now);
        }
        recordStore.resolveReview(groupId, action, keepTransactionId, reviewer, notes, now);
        log.info("dup_review group={} action={} keep={} removed={} reviewer={}",
                groupId, action.dbValue(), keepTransactionId, removed.size(), reviewer);
        return new ReviewOutcome(groupId, action, keepTransactionId, removed);
    }

    private void mergeInto(DuplicateGroup group, long keepId, List<StoredTransaction> others) {
        StoredTransaction kept = group.members().stream()
                .filter(member -> member.id() == keepId)
                .findFirst()
                .orElseThrow();
        String category = kept.category();
        String vendor = kept.vendor();
        for (StoredTransaction other : others) {
            if (isBlank(category) && !isBlank(other.category())) {
                category = other.category();
            }
            if (isBlank(vendor) && !isBlank(other.vendor())) {
                vendor = other.vendor();
            }
        }
        if (!Objects.equals(category, kept.category()) || !Objects.equals(vendor, kept.vendor())) {
            recordStore.updateCategory(keepId, category, vendor);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
