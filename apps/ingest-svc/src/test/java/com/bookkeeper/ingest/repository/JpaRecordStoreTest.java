package com.bookkeeper.ingest.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bookkeeper.ingest.config.BookkeepingProperties;
import com.bookkeeper.ingest.model.CanonicalTransaction;
import com.bookkeeper.ingest.model.DuplicateGroup;
import com.bookkeeper.ingest.model.ProcessingLogEntry;
import com.bookkeeper.ingest.model.ReviewAction;
import com.bookkeeper.ingest.model.RunCounts;
import com.bookkeeper.ingest.model.RunStatus;
import com.bookkeeper.ingest.model.StoredTransaction;
import com.bookkeeper.ingest.model.VendorMappingRule;
import com.bookkeeper.ingest.normalize.FormatDetector;
import com.bookkeeper.ingest.normalize.FormatProfile;
import com.bookkeeper.ingest.normalize.RawRow;
import com.bookkeeper.ingest.normalize.RowNormalizer;
import com.bookkeeper.ingest.repository.RecordStore.BatchResult;
import com.bookkeeper.ingest.repository.RecordStore.CommitBatch;
import com.bookkeeper.ingest.repository.RecordStore.NewTransaction;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@DataJpaTest(properties = "spring.jpa.hibernate.ddl-auto=create-drop")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaRecordStoreTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 15);
    private static final Instant NOW = Instant.parse("2024-02-01T08:00:00Z");

    @Autowired
    private JpaTransactionRepository transactionRepository;
    @Autowired
    private JpaVendorMappingRepository vendorMappingRepository;
    @Autowired
    private JpaProcessingLogRepository processingLogRepository;
    @Autowired
    private JpaDuplicateReviewRepository duplicateReviewRepository;
    @Autowired
    private JpaDupGroupSequenceRepository sequenceRepository;
    @Autowired
    private PlatformTransactionManager transactionManager;

    private JpaRecordStore store;

    @BeforeEach
    void setUp() {
        duplicateReviewRepository.deleteAll();
        transactionRepository.deleteAll();
        vendorMappingRepository.deleteAll();
        processingLogRepository.deleteAll();
        sequenceRepository.deleteAll();
        store = new JpaRecordStore(transactionRepository, vendorMappingRepository, processingLogRepository,
                duplicateReviewRepository, sequenceRepository, new ObjectMapper(), transactionManager);
    }

    private static NewTransaction insert(String description, String hash, String group) {
        CanonicalTransaction tx = new CanonicalTransaction(DAY, description, new BigDecimal("-4.50"),
                "chase", "T-" + hash, "R-" + hash, "1234", null, null);
        return new NewTransaction(tx, hash, "orig-" + hash, group, null, null, "chase.csv");
    }

    @Test
    void commitsRowsAndQueuesReviewForTheirGroup() {
        BatchResult first = store.commitBatch(new CommitBatch(List.of(insert("STARBUCKS #123", "h1", null)), Map.of(), Set.of()));
        long storedId = first.insertedIds().get(0);
        String group = store.allocateDupGroupId();

        BatchResult second = store.commitBatch(new CommitBatch(
                List.of(insert("STARBUCKS #456", "h2", group)), Map.of(storedId, group), Set.of(group)));

        assertThat(second.inserted()).isEqualTo(1);
        assertThat(second.groupAssignments()).isEqualTo(1);
        assertThat(store.rowHashExists("h2")).isTrue();
        assertThat(store.txnIdExists("T-h1", "1234")).isTrue();
        assertThat(store.referenceExists("R-h2", DAY, new BigDecimal("-4.50"))).isTrue();
        List<DuplicateGroup> pending = store.findPendingReviewGroups();
        assertThat(pending).hasSize(1);
        assertThat(pending.get(0).groupId()).isEqualTo("DUP_0001");
        assertThat(pending.get(0).contains(storedId)).isTrue();
        assertThat(pending.get(0).size()).isEqualTo(2);
        assertThat(duplicateReviewRepository.count()).isEqualTo(2);
    }

    @Test
    void clashingRowHashRollsBackTheWholeBatch() {
        store.commitBatch(new CommitBatch(List.of(insert("STARBUCKS #123", "h1", null)), Map.of(), Set.of()));

        assertThatThrownBy(() -> store.commitBatch(new CommitBatch(
                List.of(insert("PAYROLL", "h2", null), insert("STARBUCKS #123", "h1", null)), Map.of(), Set.of())))
                .isInstanceOf(StoreWriteException.class);

        assertThat(transactionRepository.count()).isEqualTo(1);
        assertThat(store.rowHashExists("h2")).isFalse();
    }

    @Test
    void groupCounterIsCreatedOnDemandAndKeepsAdvancing() {
        assertThat(store.currentDupGroupSequence()).isZero();

        assertThat(store.allocateDupGroupId()).isEqualTo("DUP_0001");
        assertThat(store.allocateDupGroupId()).isEqualTo("DUP_0002");
        assertThat(store.currentDupGroupSequence()).isEqualTo(2);
    }

    @Test
    void reviewResolutionAndSoftDeleteClearTheQueue() {
        String group = store.allocateDupGroupId();
        BatchResult batch = store.commitBatch(new CommitBatch(
                List.of(insert("STARBUCKS #123", "h1", group), insert("STARBUCKS #456", "h2", group)), Map.of(), Set.of(group)));
        long dropped = batch.insertedIds().get(1);

        store.softDelete(List.of(dropped), NOW);
        store.resolveReview(group, ReviewAction.DELETE, batch.insertedIds().get(0), "alice", "same purchase", NOW);

        assertThat(store.findPendingReviewGroups()).isEmpty();
        assertThat(store.findGroup(group)).get().extracting(DuplicateGroup::size).isEqualTo(1);
        assertThat(store.findActiveByDateAndAmount(DAY, new BigDecimal("-4.50"))).hasSize(1);
        assertThat(store.rowHashExists("h2")).isTrue();
    }

    @Test
    void categoryUpdatesRemoveRowsFromTheUncategorizedQueue() {
        BatchResult batch = store.commitBatch(new CommitBatch(
                List.of(insert("STARBUCKS #123", "h1", null), insert("PAYROLL", "h2", null)), Map.of(), Set.of()));

        store.updateCategory(batch.insertedIds().get(0), "Dining", "Starbucks");

        assertThat(store.findUncategorized(10)).extracting(StoredTransaction::description).containsExactly("PAYROLL");
        assertThat(store.findUncategorized(1)).hasSize(1);
    }

    @Test
    void activeRulesAreOrderedByPriorityThenInsertion() {
        store.addVendorRule("COSTCO", "Groceries", false, 0);
        store.addVendorRule("STARBUCKS", "Dining", false, 10);
        store.addVendorRule("^UBER", "Transport", true, 0);

        assertThat(store.findActiveVendorRules()).extracting(VendorMappingRule::pattern)
                .containsExactly("STARBUCKS", "COSTCO", "^UBER");
    }

    @Test
    void runDetailsSurviveTheRoundTripAndCompletionIsFinal() {
        long runId = store.startRun("csv_import", "/data/in", NOW);
        assertThat(store.findRun(runId)).get().extracting(ProcessingLogEntry::completed).isEqualTo(false);

        ProcessingLogEntry entry = store.completeRun(runId, new RunCounts(3, 2, 1, 1, 0), RunStatus.PARTIAL,
                Map.of("files", 1, "dryRun", false), NOW);

        assertThat(entry.status()).isEqualTo(RunStatus.PARTIAL);
        assertThat(entry.counts()).isEqualTo(new RunCounts(3, 2, 1, 1, 0));
        assertThat(store.findRun(runId)).get().extracting(ProcessingLogEntry::details)
                .isEqualTo(Map.of("files", 1, "dryRun", false));
        assertThatThrownBy(() -> store.completeRun(runId, RunCounts.ZERO, RunStatus.FAILED, Map.of(), NOW))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void normalizedRowWithOversizedReferenceCommitsAlongsideItsBatch() {
        FormatDetector detector = new FormatDetector(new BookkeepingProperties(null, null, null));
        FormatProfile profile = detector.detect(Path.of("chase.csv"),
                List.of("Date", "Description", "Amount", "Account", "Transaction ID", "Reference"), null);
        CanonicalTransaction longRow = new RowNormalizer().normalize(new RawRow(3,
                List.of("2024-01-15", "WIRE TRANSFER", "-900.00", "1234", "T".repeat(110), "R".repeat(120))), profile, "chase");
        NewTransaction oversized = new NewTransaction(longRow, "h2", "orig-h2", null, null, null, "chase.csv");

        BatchResult result = store.commitBatch(new CommitBatch(List.of(insert("STARBUCKS #123", "h1", null), oversized), Map.of(), Set.of()));

        assertThat(result.inserted()).isEqualTo(2);
        assertThat(store.referenceExists("R".repeat(100), DAY, new BigDecimal("-900.00"))).isTrue();
        assertThat(store.txnIdExists("T".repeat(100), "1234")).isTrue();
    }
}
