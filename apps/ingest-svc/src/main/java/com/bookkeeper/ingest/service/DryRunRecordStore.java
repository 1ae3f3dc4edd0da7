package com.bookkeeper.ingest.service;

import com.bookkeeper.ingest.model.CanonicalTransaction;
import com.bookkeeper.ingest.model.DuplicateGroup;
import com.bookkeeper.ingest.model.ProcessingLogEntry;
import com.bookkeeper.ingest.model.ReviewAction;
import com.bookkeeper.ingest.model.RunCounts;
import com.bookkeeper.ingest.model.RunStatus;
import com.bookkeeper.ingest.model.StoredTransaction;
import com.bookkeeper.ingest.model.VendorMappingRule;
import com.bookkeeper.ingest.repository.RecordStore;
import com.bookkeeper.ingest.repository.StoreWriteException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Read-through overlay used for dry runs. Reads see the delegate plus everything written to the
 * overlay; writes never reach the delegate. Overlay rows get negative ids so they cannot collide
 * with stored ones.
 */
class DryRunRecordStore implements RecordStore {

    private final RecordStore delegate;
    private final Map<Long, NewTransaction> inserted = new LinkedHashMap<>();
    private final Map<Long, String> assignedGroups = new HashMap<>();
    private final Map<Long, ProcessingLogEntry> runs = new HashMap<>();
    private long nextOverlayId = -1;
    private long nextRunId = -1;
    private Long sequenceBase;
    private long allocated;

    DryRunRecordStore(RecordStore delegate) {
        this.delegate = delegate;
    }

    @Override
    public boolean rowHashExists(String rowHash) {
        return inserted.values().stream().anyMatch(row -> row.rowHash().equals(rowHash))
                || delegate.rowHashExists(rowHash);
    }

    @Override
    public boolean txnIdExists(String txnId, String account) {
        return inserted.values().stream()
                .map(NewTransaction::transaction)
                .anyMatch(tx -> Objects.equals(tx.txnId(), txnId) && Objects.equals(tx.account(), account))
                || delegate.txnIdExists(txnId, account);
    }

    @Override
    public boolean referenceExists(String reference, LocalDate date, BigDecimal amount) {
        return inserted.values().stream()
                .map(NewTransaction::transaction)
                .anyMatch(tx -> Objects.equals(tx.reference(), reference)
                        && tx.date().equals(date)
                        && tx.amount().compareTo(amount) == 0)
                || delegate.referenceExists(reference, date, amount);
    }

    @Override
    public List<StoredTransaction> findActiveByDateAndAmount(LocalDate date, BigDecimal amount) {
        Stream<StoredTransaction> stored = delegate.findActiveByDateAndAmount(date, amount).stream()
                .map(this::withOverlayGroup);
        Stream<StoredTransaction> overlay = inserted.entrySet().stream()
                .filter(entry -> entry.getValue().transaction().date().equals(date)
                        && entry.getValue().transaction().amount().compareTo(amount) == 0)
                .map(entry -> toStored(entry.getKey(), entry.getValue()));
        return Stream.concat(stored, overlay).toList();
    }

    @Override
    public String allocateDupGroupId() {
        allocated += 1;
        return RecordStore.formatGroupId(sequenceBase() + allocated);
    }

    @Override
    public long currentDupGroupSequence() {
        return sequenceBase() + allocated;
    }

    private long sequenceBase() {
        if (sequenceBase == null) {
            sequenceBase = delegate.currentDupGroupSequence();
        }
        return sequenceBase;
    }

    @Override
    public BatchResult commitBatch(CommitBatch batch) {
        for (NewTransaction insert : batch.inserts()) {
            if (rowHashExists(insert.rowHash())) {
                throw new StoreWriteException("row hash " + insert.rowHash() + " already stored", null);
            }
        }
        List<Long> ids = new ArrayList<>();
        for (NewTransaction insert : batch.inserts()) {
            long id = nextOverlayId--;
            inserted.put(id, insert);
            ids.add(id);
        }
        batch.groupAssignments().forEach(assignedGroups::putIfAbsent);
        return new BatchResult(List.copyOf(ids), batch.groupAssignments().size());
    }

    @Override
    public List<VendorMappingRule> findActiveVendorRules() {
        return delegate.findActiveVendorRules();
    }

    @Override
    public VendorMappingRule addVendorRule(String pattern, String category, boolean regex, int priority) {
        throw new UnsupportedOperationException("vendor rules cannot be added during a dry run");
    }

    @Override
    public List<StoredTransaction> findUncategorized(int limit) {
        return delegate.findUncategorized(limit);
    }

    @Override
    public void updateCategory(long transactionId, String category, String vendor) {
        throw new UnsupportedOperationException("categories cannot be updated during a dry run");
    }

    @Override
    public long startRun(String operationType, String sourceFile, Instant startedAt) {
        long id = nextRunId--;
        runs.put(id, new ProcessingLogEntry(id, operationType, sourceFile, RunCounts.ZERO, RunStatus.PENDING, Map.of(), startedAt, null));
        return id;
    }

    @Override
    public ProcessingLogEntry completeRun(long runId, RunCounts counts, RunStatus status, Map<String, Object> details, Instant completedAt) {
        ProcessingLogEntry current = runs.get(runId);
        if (current == null) {
            throw new IllegalArgumentException("Unknown dry-run " + runId);
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
    public Optional<ProcessingLogEntry> findRun(long runId) {
        ProcessingLogEntry local = runs.get(runId);
        return local != null ? Optional.of(local) : delegate.findRun(runId);
    }

    @Override
    public List<DuplicateGroup> findPendingReviewGroups() {
        return delegate.findPendingReviewGroups();
    }

    @Override
    public Optional<DuplicateGroup> findGroup(String groupId) {
        return delegate.findGroup(groupId);
    }

    @Override
    public void resolveReview(String groupId, ReviewAction action, Long keepTransactionId, String reviewer, String notes, Instant reviewedAt) {
        throw new UnsupportedOperationException("duplicate reviews cannot be resolved during a dry run");
    }

    @Override
    public void softDelete(Collection<Long> transactionIds, Instant deletedAt) {
        throw new UnsupportedOperationException("transactions cannot be deleted during a dry run");
    }

    private StoredTransaction withOverlayGroup(StoredTransaction stored) {
        String group = assignedGroups.get(stored.id());
        if (group == null || stored.grouped()) {
            return stored;
        }
        return new StoredTransaction(stored.id(), stored.date(), stored.description(), stored.amount(),
                stored.rowHash(), group, stored.category(), stored.vendor());
    }

    private StoredTransaction toStored(long id, NewTransaction insert) {
        CanonicalTransaction tx = insert.transaction();
        String group = insert.possibleDupGroup() != null ? insert.possibleDupGroup() : assignedGroups.get(id);
        return new StoredTransaction(id, tx.date(), tx.description(), tx.amount(), insert.rowHash(),
                group, insert.category(), insert.vendor());
    }
}
