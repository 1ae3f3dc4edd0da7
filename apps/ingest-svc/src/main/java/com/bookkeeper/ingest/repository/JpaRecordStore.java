package com.bookkeeper.ingest.repository;

import com.bookkeeper.ingest.entity.DupGroupSequenceEntity;
import com.bookkeeper.ingest.entity.DuplicateReviewEntity;
import com.bookkeeper.ingest.entity.ProcessingLogEntity;
import com.bookkeeper.ingest.entity.TransactionEntity;
import com.bookkeeper.ingest.entity.VendorMappingEntity;
import com.bookkeeper.ingest.model.CanonicalTransaction;
import com.bookkeeper.ingest.model.DuplicateGroup;
import com.bookkeeper.ingest.model.ProcessingLogEntry;
import com.bookkeeper.ingest.model.ReviewAction;
import com.bookkeeper.ingest.model.RunCounts;
import com.bookkeeper.ingest.model.RunStatus;
import com.bookkeeper.ingest.model.StoredTransaction;
import com.bookkeeper.ingest.model.VendorMappingRule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

@Repository
@Primary
public class JpaRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(JpaRecordStore.class);
    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {};

    private final JpaTransactionRepository transactionRepository;
    private final JpaVendorMappingRepository vendorMappingRepository;
    private final JpaProcessingLogRepository processingLogRepository;
    private final JpaDuplicateReviewRepository duplicateReviewRepository;
    private final JpaDupGroupSequenceRepository sequenceRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate sequenceTemplate;

    public JpaRecordStore(JpaTransactionRepository transactionRepository,
                          JpaVendorMappingRepository vendorMappingRepository,
                          JpaProcessingLogRepository processingLogRepository,
                          JpaDuplicateReviewRepository duplicateReviewRepository,
                          JpaDupGroupSequenceRepository sequenceRepository,
                          ObjectMapper objectMapper,
                          PlatformTransactionManager transactionManager) {
        this.transactionRepository = transactionRepository;
        this.vendorMappingRepository = vendorMappingRepository;
        this.processingLogRepository = processingLogRepository;
        this.duplicateReviewRepository = duplicateReviewRepository;
        this.sequenceRepository = sequenceRepository;
        this.objectMapper = objectMapper;
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.sequenceTemplate = new TransactionTemplate(transactionManager);
        this.sequenceTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public boolean rowHashExists(String rowHash) {
        return read("check row hash " + rowHash, () -> transactionRepository.existsByRowHash(rowHash));
    }

    @Override
    public boolean txnIdExists(String txnId, String account) {
        return read("check transaction id " + txnId, () -> transactionRepository.existsByTxnIdAndAccount(txnId, account));
    }

    @Override
    public boolean referenceExists(String reference, LocalDate date, BigDecimal amount) {
        return read("check reference " + reference,
                () -> transactionRepository.existsByReferenceAndPostedOnAndAmount(reference, date, amount));
    }

    @Override
    public List<StoredTransaction> findActiveByDateAndAmount(LocalDate date, BigDecimal amount) {
        return read("load transactions on " + date + " for " + amount,
                () -> transactionRepository.findActiveByPostedOnAndAmount(date, amount).stream()
                        .map(this::toModel)
                        .toList());
    }

    @Override
    public String allocateDupGroupId() {
        try {
            Long next = sequenceTemplate.execute(status -> {
                DupGroupSequenceEntity sequence = sequenceRepository.findForUpdate(DupGroupSequenceEntity.SINGLETON_ID)
                        .orElseGet(() -> sequenceRepository.save(new DupGroupSequenceEntity(DupGroupSequenceEntity.SINGLETON_ID, 0L)));
                long value = sequence.next();
                sequenceRepository.save(sequence);
                return value;
            });
            return RecordStore.formatGroupId(next);
        } catch (DataAccessException | TransactionException ex) {
            throw new StoreWriteException("Failed to allocate duplicate group id", ex);
        }
    }

    @Override
    public long currentDupGroupSequence() {
        return read("read duplicate group counter", () -> sequenceRepository.findById(DupGroupSequenceEntity.SINGLETON_ID)
                .map(DupGroupSequenceEntity::getCurrentSeq)
                .orElse(0L));
    }

    @Override
    public BatchResult commitBatch(CommitBatch batch) {
        return write("commit batch of " + batch.inserts().size() + " rows", status -> applyBatch(batch));
    }

    private BatchResult applyBatch(CommitBatch batch) {
        List<TransactionEntity> entities = batch.inserts().stream().map(this::toEntity).toList();
        List<TransactionEntity> saved = transactionRepository.saveAllAndFlush(entities);
        List<Long> insertedIds = saved.stream().map(TransactionEntity::getId).toList();

        for (Map.Entry<Long, String> assignment : batch.groupAssignments().entrySet()) {
            TransactionEntity entity = transactionRepository.findById(assignment.getKey())
                    .orElseThrow(() -> new StoreWriteException("transaction " + assignment.getKey() + " does not exist", null));
            if (entity.getPossibleDupGroup() == null) {
                entity.setPossibleDupGroup(assignment.getValue());
            }
        }
        transactionRepository.flush();

        int reviewRows = 0;
        for (String groupId : batch.reviewGroups()) {
            for (TransactionEntity member : transactionRepository.findActiveByDupGroup(groupId)) {
                if (!duplicateReviewRepository.existsByDupGroupAndTransactionId(groupId, member.getId())) {
                    duplicateReviewRepository.save(new DuplicateReviewEntity(groupId, member.getId()));
                    reviewRows++;
                }
            }
        }
        duplicateReviewRepository.flush();
        log.debug("Committed batch inserted={} groupAssignments={} reviewRows={}",
                insertedIds.size(), batch.groupAssignments().size(), reviewRows);
        return new BatchResult(insertedIds, batch.groupAssignments().size());
    }

    @Override
    public List<VendorMappingRule> findActiveVendorRules() {
        return read("load vendor rules", () -> vendorMappingRepository.findByActiveTrueOrderByPriorityDescIdAsc().stream()
                .map(entity -> new VendorMappingRule(entity.getId(), entity.getPattern(), entity.getCategory(),
                        entity.isRegex(), entity.getPriority()))
                .toList());
    }

    @Override
    public VendorMappingRule addVendorRule(String pattern, String category, boolean regex, int priority) {
        VendorMappingEntity saved = write("add vendor rule '" + pattern + "'",
                status -> vendorMappingRepository.save(new VendorMappingEntity(pattern, category, regex, priority)));
        return new VendorMappingRule(saved.getId(), saved.getPattern(), saved.getCategory(), saved.isRegex(), saved.getPriority());
    }

    @Override
    public List<StoredTransaction> findUncategorized(int limit) {
        return read("load uncategorized transactions", () -> transactionRepository.findUncategorized(PageRequest.of(0, limit)).stream()
                .map(this::toModel)
                .toList());
    }

    @Override
    public void updateCategory(long transactionId, String category, String vendor) {
        write("update category of transaction " + transactionId, status -> {
            TransactionEntity entity = transactionRepository.findById(transactionId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown transaction " + transactionId));
            entity.setCategory(category);
            entity.setVendor(vendor);
            return entity;
        });
    }

    @Override
    public long startRun(String operationType, String sourceFile, Instant startedAt) {
        ProcessingLogEntity entity = new ProcessingLogEntity(operationType, sourceFile, RunStatus.PENDING.dbValue(), startedAt);
        return write("start " + operationType + " run", status -> processingLogRepository.save(entity)).getId();
    }

    @Override
    public ProcessingLogEntry completeRun(long runId, RunCounts counts, RunStatus status, Map<String, Object> details, Instant completedAt) {
        ProcessingLogEntity completed = write("complete run " + runId, tx -> {
            ProcessingLogEntity entity = processingLogRepository.findById(runId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown run " + runId));
            if (entity.getCompletedAt() != null) {
                throw new IllegalStateException("Run " + runId + " is already completed");
            }
            entity.setRecordsProcessed(counts.processed());
            entity.setRecordsInserted(counts.inserted());
            entity.setRecordsUpdated(counts.updated());
            entity.setRecordsSkipped(counts.skipped());
            entity.setRecordsErrored(counts.errored());
            entity.setStatus(status.dbValue());
            entity.setDetails(writeDetails(details));
            entity.setCompletedAt(completedAt);
            return entity;
        });
        return toModel(completed);
    }

    @Override
    public Optional<ProcessingLogEntry> findRun(long runId) {
        return read("load run " + runId, () -> processingLogRepository.findById(runId).map(this::toModel));
    }

    @Override
    public List<DuplicateGroup> findPendingReviewGroups() {
        List<DuplicateGroup> groups = new ArrayList<>();
        List<String> pending = read("load pending review groups",
                () -> duplicateReviewRepository.findGroupIdsByStatus(DuplicateReviewEntity.STATUS_PENDING));
        for (String groupId : pending) {
            findGroup(groupId).ifPresent(groups::add);
        }
        return groups;
    }

    @Override
    public Optional<DuplicateGroup> findGroup(String groupId) {
        List<StoredTransaction> members = read("load group " + groupId, () -> transactionRepository.findActiveByDupGroup(groupId).stream()
                .map(this::toModel)
                .toList());
        return members.isEmpty() ? Optional.empty() : Optional.of(new DuplicateGroup(groupId, members));
    }

    @Override
    public void resolveReview(String groupId, ReviewAction action, Long keepTransactionId, String reviewer, String notes, Instant reviewedAt) {
        write("resolve review of " + groupId, status -> {
            List<DuplicateReviewEntity> reviews = duplicateReviewRepository.findByDupGroupAndStatus(groupId, DuplicateReviewEntity.STATUS_PENDING);
            reviews.forEach(review -> review.markReviewed(action.dbValue(), keepTransactionId, reviewer, notes, reviewedAt));
            return reviews.size();
        });
    }

    @Override
    public void softDelete(Collection<Long> transactionIds, Instant deletedAt) {
        if (transactionIds.isEmpty()) {
            return;
        }
        write("soft-delete " + transactionIds.size() + " transactions", status -> transactionRepository.softDelete(transactionIds, deletedAt));
    }

    private <T> T read(String what, Supplier<T> lookup) {
        try {
            return lookup.get();
        } catch (DataAccessException ex) {
            throw new StoreReadException("Failed to " + what, ex);
        }
    }

    private <T> T write(String what, TransactionCallback<T> action) {
        try {
            return writeTemplate.execute(action);
        } catch (DataAccessException | TransactionException ex) {
            throw new StoreWriteException("Failed to " + what, ex);
        }
    }

    private TransactionEntity toEntity(NewTransaction insert) {
        CanonicalTransaction tx = insert.transaction();
        TransactionEntity entity = new TransactionEntity(tx.date(), tx.description(), tx.amount(), insert.rowHash(), insert.originalHash());
        entity.setSource(tx.source());
        entity.setSourceFile(insert.sourceFile());
        entity.setTxnId(tx.txnId());
        entity.setReference(tx.reference());
        entity.setAccount(tx.account());
        entity.setBalance(tx.balance());
        entity.setTimePart(tx.timePart());
        entity.setPossibleDupGroup(insert.possibleDupGroup());
        entity.setCategory(insert.category());
        entity.setVendor(insert.vendor());
        return entity;
    }

    private StoredTransaction toModel(TransactionEntity entity) {
        return new StoredTransaction(
                entity.getId(),
                entity.getPostedOn(),
                entity.getDescription(),
                entity.getAmount(),
                entity.getRowHash(),
                entity.getPossibleDupGroup(),
                entity.getCategory(),
                entity.getVendor()
        );
    }

    private ProcessingLogEntry toModel(ProcessingLogEntity entity) {
        RunCounts counts = new RunCounts(
                entity.getRecordsProcessed(),
                entity.getRecordsInserted(),
                entity.getRecordsUpdated(),
                entity.getRecordsSkipped(),
                entity.getRecordsErrored()
        );
        return new ProcessingLogEntry(
                entity.getId(),
                entity.getOperationType(),
                entity.getSourceFile(),
                counts,
                RunStatus.fromDbValue(entity.getStatus()),
                readDetails(entity.getDetails()),
                entity.getStartedAt(),
                entity.getCompletedAt()
        );
    }

    private String writeDetails(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize run details", ex);
        }
    }

    private Map<String, Object> readDetails(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, DETAILS_TYPE);
        } catch (JsonProcessingException ex) {
            log.warn("Unreadable processing_log details: {}", ex.getMessage());
            return Map.of("raw", json);
        }
    }
}
