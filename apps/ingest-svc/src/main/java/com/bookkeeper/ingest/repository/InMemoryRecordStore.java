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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

/**
 * Heap-backed store for tests and local runs. Batches are applied to a staged copy and swapped in
 * only when every write succeeded.
 */
@Repository
public class InMemoryRecordStore implements RecordStore {

    private TreeMap<Long, Row> transactions = new TreeMap<>();
    private List<Review> reviews = new ArrayList<>();
    private final List<VendorMappingRule> vendorRules = new ArrayList<>();
    private final Map<Long, ProcessingLogEntry> runs = new LinkedHashMap<>();
    private long nextTransactionId = 1;
    private long nextRuleSequence = 1;
    private long nextRunId = 1;
    private long dupSequence;

    @Override
    public synchronized boolean rowHashExists(String rowHash) {
        return transactions.values().stream().anyMatch(row -> row.rowHash().equals(rowHash));
    }

    @Override
    public synchronized boolean txnIdExists(String txnId, String account) {
        return transactions.values().stream()
                .anyMatch(row -> Objects.equals(row.transaction().txnId(), txnId)
                        && Objects.equals(row.transaction().account(), account));
    }

    @Override
    public synchronized boolean referenceExists(String reference, LocalDate date, BigDecimal amount) {
        return transactions.values().stream()
                .map(Row::transaction)
                .anyMatch(tx -> Objects.equals(tx.reference(), reference)
                        && tx.date().equals(date)
                        && tx.amount().compareTo(amount) == 0);
    }

    @Override
    public synchronized List<StoredTransaction> findActiveByDateAndAmount(LocalDate date, BigDecimal amount) {
        return transactions.values().stream()
                .filter(Row::active)
                .filter(row -> row.transaction().date().equals(date) && row.transaction().amount().compareTo(amount) == 0)
                .map(Row::toStored)
                .toList();
    }

    @Override
    public synchronized String allocateDupGroupId() {
        dupSequence += 1;
        return RecordStore.formatGroupId(dupSequence);
    }

    @Override
    public synchronized long currentDupGroupSequence() {
        return dupSequence;
    }

    @Override
    public synchronized BatchResult commitBatch(CommitBatch batch) {
        TreeMap<Long, Row> staged = new TreeMap<>(transactions);
        List<Review> stagedReviews = new ArrayList<>(reviews);
        long stagedNextId = nextTransactionId;
        List<Long> insertedIds = new ArrayList<>();

        for (NewTransaction insert : batch.inserts()) {
            boolean clash = staged.values().stream().anyMatch(row -> row.rowHash().equals(insert.rowHash()));
            if (clash) {
                throw new StoreWriteException("row hash " + insert.rowHash() + " already stored", null);
            }
            long id = stagedNextId++;
            staged.put(id, new Row(id, insert.transaction(), insert.rowHash(), insert.originalHash(),
                    insert.possibleDupGroup(), insert.category(), insert.vendor(), insert.sourceFile(), null));
            insertedIds.add(id);
        }
        for (Map.Entry<Long, String> assignment : batch.groupAssignments().entrySet()) {
            Row row = staged.get(assignment.getKey());
            if (row == null) {
                throw new StoreWriteException("transaction " + assignment.getKey() + " does not exist", null);
            }
            if (row.possibleDupGroup() == null) {
                staged.put(row.id(), row.withGroup(assignment.getValue()));
            }
        }
        for (String groupId : batch.reviewGroups()) {
            staged.values().stream()
                    .filter(Row::active)
                    .filter(row -> groupId.equals(row.possibleDupGroup()))
                    .filter(row -> stagedReviews.stream().noneMatch(review -> review.matches(groupId, row.id())))
                    .forEach(row -> stagedReviews.add(Review.pending(groupId, row.id())));
        }

        transactions = staged;
        reviews = stagedReviews;
        nextTransactionId = stagedNextId;
        return new BatchResult(List.copyOf(insertedIds), batch.groupAssignments().size());
    }

    @Override
    public synchronized List<VendorMappingRule> findActiveVendorRules() {
        return vendorRules.stream()
                .sorted(Comparator.comparingInt(VendorMappingRule::priority).reversed()
                        .thenComparingLong(VendorMappingRule::sequence))
                .toList();
    }

    @Override
    public synchronized VendorMappingRule addVendorRule(String pattern, String category, boolean regex, int priority) {
        VendorMappingRule rule = new VendorMappingRule(nextRuleSequence++, pattern, category, regex, priority);
        vendorRules.add(rule);
        return rule;
    }

    @Override
    public synchronized List<StoredTransaction> findUncategorized(int limit) {
        return transactions.values().stream()
                .filter(Row::active)
                .filter(row -> row.category() == null || row.category().isBlank())
                .sorted(Comparator.comparing((Row row) -> row.transaction().date()).reversed()
                        .thenComparingLong(Row::id))
                .limit(limit)
                .map(Row::toStored)
                .toList();
    }

    @Override
    public synchronized void updateCategory(long transactionId, String category, String vendor) {
        Row row = transactions.get(transactionId);
        if (row == null) {
            throw new IllegalArgumentException("Unknown transaction " + transactionId);
        }
        transactions.put(transactionId, row.withCategory(category, vendor));
    }

    @Override
    public synchronized long startRun(String operationType, String sourceFile, Instant startedAt) {
        long id = nextRunId++;
        runs.put(id, new ProcessingLogEntry(id, operationType, sourceFile, RunCounts.ZERO, RunStatus.PENDING, Map.of(), startedAt, null));
        return id;
    }

    @Override
    public synchronized ProcessingLogEntry completeRun(long runId, RunCounts counts, RunStatus status, Map<String, Object> details, Instant completedAt) {
        ProcessingLogEntry current = runs.get(runId);
        if (current == null) {
            throw new IllegalArgumentException("Unknown run " + runId);
        }
        if (current.completed()) {
            throw new IllegalStateException("Run " + runId + " is already completed");
        }
        ProcessingLogEntry completed = new ProcessingLogEntry(runId, current.operationType(), current.sourceFile(),
                counts, status, Map.copyOf(details), current.startedAt(), completedAt);
        runs.put(runId, completed);
        return completed;
    }

    @Override
    public synchronized Optional<ProcessingLogEntry> findRun(long runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public synchronized List<DuplicateGroup> findPendingReviewGroups() {
        return reviews.stream()
                .filter(Review::pending)
                .map(Review::groupId)
                .collect(Collectors.toCollection(TreeSet::new))
                .stream()
                .map(this::findGroup)
                .flatMap(Optional::stream)
                .toList();
    }

    @Override
    public synchronized Optional<DuplicateGroup> findGroup(String groupId) {
        List<StoredTransaction> members = transactions.values().stream()
                .filter(Row::active)
                .filter(row -> groupId.equals(row.possibleDupGroup()))
                .map(Row::toStored)
                .toList();
        return members.isEmpty() ? Optional.empty() : Optional.of(new DuplicateGroup(groupId, members));
    }

    @Override
    public synchronized void resolveReview(String groupId, ReviewAction action, Long keepTransactionId, String reviewer, String notes, Instant reviewedAt) {
        reviews = reviews.stream()
                .map(review -> review.pending() && review.groupId().equals(groupId)
                        ? review.reviewed(action.dbValue(), keepTransactionId, reviewer, notes, reviewedAt)
                        : review)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public synchronized void softDelete(Collection<Long> transactionIds, Instant deletedAt) {
        for (Long id : transactionIds) {
            Row row = transactions.get(id);
            if (row != null && row.active()) {
                transactions.put(id, row.withDeletedAt(deletedAt));
            }
        }
    }

    public synchronized int size() {
        return transactions.size();
    }

    public synchronized List<StoredTransaction> findAll() {
        return transactions.values().stream().map(Row::toStored).toList();
    }

    public synchronized boolean isDeleted(long transactionId) {
        Row row = transactions.get(transactionId);
        return row != null && !row.active();
    }

    public synchronized Optional<String> sourceFileOf(long transactionId) {
        return Optional.ofNullable(transactions.get(transactionId)).map(Row::sourceFile);
    }

    private record Row(
            long id,
            CanonicalTransaction transaction,
            String rowHash,
            String originalHash,
            String possibleDupGroup,
            String category,
            String vendor,
            String sourceFile,
            Instant deletedAt
    ) {
        boolean active() {
            return deletedAt == null;
        }

        Row withGroup(String groupId) {
            return new Row(id, transaction, rowHash, originalHash, groupId, category, vendor, sourceFile, deletedAt);
        }

        Row withCategory(String newCategory, String newVendor) {
            return new Row(id, transaction, rowHash, originalHash, possibleDupGroup, newCategory, newVendor, sourceFile, deletedAt);
        }

        Row withDeletedAt(Instant at) {
            return new Row(id, transaction, rowHash, originalHash, possibleDupGroup, category, vendor, sourceFile, at);
        }

        StoredTransaction toStored() {
            return new StoredTransaction(id, transaction.date(), transaction.description(), transaction.amount(),
                    rowHash, possibleDupGroup, category, vendor);
        }
    }

    private record Review(
            String groupId,
            long transactionId,
            boolean pending,
            String action,
            Long keepTransactionId,
            String reviewer,
            String notes,
            Instant reviewedAt
    ) {
        static Review pending(String groupId, long transactionId) {
            return new Review(groupId, transactionId, true, null, null, null, null, null);
        }

        boolean matches(String group, long txId) {
            return groupId.equals(group) && transactionId == txId;
        }

        Review reviewed(String newAction, Long keepId, String by, String text, Instant at) {
            return new Review(groupId, transactionId, false, newAction, keepId, by, text, at);
        }
    }
}
