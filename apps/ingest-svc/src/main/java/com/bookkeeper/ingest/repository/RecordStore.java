package com.bookkeeper.ingest.repository;

import com.bookkeeper.ingest.model.CanonicalTransaction;
import com.bookkeeper.ingest.model.DuplicateGroup;
import com.bookkeeper.ingest.model.ProcessingLogEntry;
import com.bookkeeper.ingest.model.ReviewAction;
import com.bookkeeper.ingest.model.RunCounts;
import com.bookkeeper.ingest.model.RunStatus;
import com.bookkeeper.ingest.model.StoredTransaction;
import com.bookkeeper.ingest.model.VendorMappingRule;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Transactional store behind the import pipeline. Soft-deleted transactions still count for the
 * existence checks, so a re-import never resurrects a row removed during review.
 */
public interface RecordStore {

    record NewTransaction(
            CanonicalTransaction transaction,
            String rowHash,
            String originalHash,
            String possibleDupGroup,
            String category,
            String vendor,
            String sourceFile
    ) {}

    /**
     * Everything one file contributes: the rows to insert, group ids for already stored rows and the
     * groups whose members need a pending review entry.
     */
    record CommitBatch(List<NewTransaction> inserts, Map<Long, String> groupAssignments, Set<String> reviewGroups) {
        public CommitBatch {
            inserts = List.copyOf(inserts);
            groupAssignments = Map.copyOf(groupAssignments);
            reviewGroups = Set.copyOf(reviewGroups);
        }

        public boolean isEmpty() {
            return inserts.isEmpty() && groupAssignments.isEmpty() && reviewGroups.isEmpty();
        }
    }

    record BatchResult(List<Long> insertedIds, int groupAssignments) {
        public int inserted() {
            return insertedIds.size();
        }
    }

    boolean rowHashExists(String rowHash);

    boolean txnIdExists(String txnId, String account);

    boolean referenceExists(String reference, LocalDate date, BigDecimal amount);

    List<StoredTransaction> findActiveByDateAndAmount(LocalDate date, BigDecimal amount);

    /**
     * Allocates the next {@code DUP_nnnn} id. The counter advances in its own transaction, so an id
     * handed out here is never returned again even when the batch that asked for it rolls back.
     */
    String allocateDupGroupId();

    long currentDupGroupSequence();

    /**
     * Applies the batch atomically.
     *
     * @throws StoreWriteException when the batch could not be written; nothing of it is kept
     */
    BatchResult commitBatch(CommitBatch batch);

    List<VendorMappingRule> findActiveVendorRules();

    VendorMappingRule addVendorRule(String pattern, String category, boolean regex, int priority);

    List<StoredTransaction> findUncategorized(int limit);

    void updateCategory(long transactionId, String category, String vendor);

    long startRun(String operationType, String sourceFile, Instant startedAt);

    /**
     * Finalizes a run. A completed entry is immutable.
     *
     * @throws IllegalStateException when the run was already completed
     */
    ProcessingLogEntry completeRun(long runId, RunCounts counts, RunStatus status, Map<String, Object> details, Instant completedAt);

    Optional<ProcessingLogEntry> findRun(long runId);

    List<DuplicateGroup> findPendingReviewGroups();

    Optional<DuplicateGroup> findGroup(String groupId);

    void resolveReview(String groupId, ReviewAction action, Long keepTransactionId, String reviewer, String notes, Instant reviewedAt);

    void softDelete(Collection<Long> transactionIds, Instant deletedAt);

    static String formatGroupId(long sequence) {
        return String.format("DUP_%04d", sequence);
    }
}
