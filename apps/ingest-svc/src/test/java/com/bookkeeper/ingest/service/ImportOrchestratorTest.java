package com.bookkeeper.ingest.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bookkeeper.ingest.config.BookkeepingProperties;
import com.bookkeeper.ingest.dedup.DedupResolver;
import com.bookkeeper.ingest.fingerprint.FingerprintEngine;
import com.bookkeeper.ingest.model.DuplicateGroup;
import com.bookkeeper.ingest.model.ProcessingLogEntry;
import com.bookkeeper.ingest.model.RunCounts;
import com.bookkeeper.ingest.model.ReviewAction;
import com.bookkeeper.ingest.model.RunStatus;
import com.bookkeeper.ingest.model.StoredTransaction;
import com.bookkeeper.ingest.normalize.CsvStatementReader;
import com.bookkeeper.ingest.normalize.FormatDetector;
import com.bookkeeper.ingest.normalize.RowNormalizer;
import com.bookkeeper.ingest.repository.InMemoryRecordStore;
import com.bookkeeper.ingest.repository.StoreWriteException;
import com.bookkeeper.ingest.review.DuplicateReviewService;
import com.bookkeeper.ingest.rules.VendorRuleEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessResourceFailureException;

class ImportOrchestratorTest {

    private static final String CHASE = "Date,Description,Amount\n"
            + "2024-01-15,STARBUCKS #123,-4.50\n"
            + "2024-01-16,PAYROLL,2500.00\n";

    @TempDir
    Path dir;

    private InMemoryRecordStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
    }

    private ImportOrchestrator orchestrator(InMemoryRecordStore recordStore, BookkeepingProperties properties) {
        return new ImportOrchestrator(
                recordStore,
                new CsvStatementReader(),
                new FormatDetector(properties),
                new RowNormalizer(),
                new FingerprintEngine(new ObjectMapper()),
                new DedupResolver(),
                new VendorRuleEngine(),
                new ImportAuditLogger(),
                properties,
                Clock.fixed(Instant.parse("2024-02-01T08:00:00Z"), ZoneOffset.UTC));
    }

    private ImportOrchestrator orchestrator() {
        return orchestrator(store, new BookkeepingProperties(null, null, null));
    }

    private Path write(String relative, String content) throws IOException {
        Path file = dir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    private static ImportOptions options(Path input) {
        return new ImportOptions(input, null, false, false, null, null);
    }

    @Test
    void importsNewRowsAndLogsTheRun() throws IOException {
        write("in/chase.csv", CHASE);

        ImportReport report = orchestrator().importDirectory(options(dir.resolve("in")));

        assertThat(report.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(report.totals()).isEqualTo(new RunCounts(2, 2, 0, 0, 0));
        assertThat(report.exitCode()).isZero();
        assertThat(store.findAll()).extracting(StoredTransaction::description).containsExactly("STARBUCKS #123", "PAYROLL");
        assertThat(store.sourceFileOf(1L)).contains("chase.csv");

        ProcessingLogEntry entry = store.findRun(report.runId()).orElseThrow();
        assertThat(entry.operationType()).isEqualTo(ImportOrchestrator.OPERATION_TYPE);
        assertThat(entry.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(entry.counts()).isEqualTo(report.totals());
        assertThat(entry.details()).containsKey("files");
    }

    @Test
    void reimportingTheSameFileChangesNothing() throws IOException {
        write("in/chase.csv", CHASE);
        ImportOrchestrator orchestrator = orchestrator();
        orchestrator.importDirectory(options(dir.resolve("in")));

        ImportReport second = orchestrator.importDirectory(options(dir.resolve("in")));

        assertThat(second.totals()).isEqualTo(new RunCounts(2, 0, 0, 2, 0));
        assertThat(store.size()).isEqualTo(2);
        assertThat(store.findPendingReviewGroups()).isEmpty();
    }

    @Test
    void sameDayAndAmountFromAnotherExportIsQueuedForReview() throws IOException {
        write("jan/chase.csv", CHASE);
        write("feb/amex.csv", "Date,Description,Amount\n2024-01-15,STARBUCKS #456,-4.50\n");
        ImportOrchestrator orchestrator = orchestrator();
        orchestrator.importDirectory(options(dir.resolve("jan")));

        ImportReport report = orchestrator.importDirectory(options(dir.resolve("feb")));

        assertThat(report.totals()).isEqualTo(new RunCounts(1, 1, 1, 0, 0));
        assertThat(report.files().get(0).reviewCandidates()).isEqualTo(1);
        List<DuplicateGroup> pending = store.findPendingReviewGroups();
        assertThat(pending).hasSize(1);
        assertThat(pending.get(0).groupId()).isEqualTo("DUP_0001");
        assertThat(pending.get(0).members()).extracting(StoredTransaction::description)
                .containsExactly("STARBUCKS #123", "STARBUCKS #456");
    }

    @Test
    void dryRunReportsRealCountsWithoutWriting() throws IOException {
        write("jan/chase.csv", CHASE);
        write("feb/amex.csv", "Date,Description,Amount\n"
                + "2024-01-15,STARBUCKS #456,-4.50\n"
                + "2024-01-16,PAYROLL,2500.00\n"
                + "2024-01-20,SHELL OIL,-40.00\n");
        ImportOrchestrator orchestrator = orchestrator();
        orchestrator.importDirectory(options(dir.resolve("jan")));

        ImportReport dry = orchestrator.importDirectory(new ImportOptions(dir.resolve("feb"), null, false, true, null, null));

        assertThat(dry.dryRun()).isTrue();
        assertThat(store.size()).isEqualTo(2);
        assertThat(store.findPendingReviewGroups()).isEmpty();
        assertThat(store.currentDupGroupSequence()).isZero();
        assertThat(store.findRun(dry.runId())).isEmpty();

        ImportReport real = orchestrator.importDirectory(options(dir.resolve("feb")));

        assertThat(dry.totals()).isEqualTo(real.totals());
        assertThat(real.totals()).isEqualTo(new RunCounts(3, 2, 1, 1, 0));
    }

    @Test
    void unreadableFileDoesNotStopTheRun() throws IOException {
        write("in/a_chase.csv", CHASE);
        write("in/b_broken.csv", "foo,bar\n1,2\n");

        ImportReport report = orchestrator().importDirectory(options(dir.resolve("in")));

        assertThat(report.status()).isEqualTo(RunStatus.PARTIAL);
        assertThat(report.exitCode()).isEqualTo(1);
        assertThat(report.files()).extracting(FileImportResult::failed).containsExactly(false, true);
        assertThat(report.files().get(1).failure()).isEqualTo(FileImportResult.Failure.FILE_READ);
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void everyFileFailingMarksTheRunFailed() throws IOException {
        write("in/broken.csv", "foo,bar\n1,2\n");

        ImportReport report = orchestrator().importDirectory(options(dir.resolve("in")));

        assertThat(report.status()).isEqualTo(RunStatus.FAILED);
    }

    @Test
    void malformedRowsAreCountedAndSkipped() throws IOException {
        write("in/chase.csv", "Date,Description,Amount\n"
                + "2024-01-15,STARBUCKS #123,-4.50\n"
                + "someday,BROKEN,-1.00\n"
                + "2024-01-16,NO AMOUNT,\n");

        ImportReport report = orchestrator().importDirectory(options(dir.resolve("in")));

        assertThat(report.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(report.totals()).isEqualTo(new RunCounts(3, 1, 0, 0, 2));
        assertThat(report.exitCode()).isEqualTo(1);
        assertThat(report.files().get(0).rowErrors()).hasSize(2).allMatch(error -> error.startsWith("line "));
    }

    @Test
    void failedCommitRollsBackOnlyThatFile() throws IOException {
        write("in/a_chase.csv", CHASE);
        write("in/b_amex.csv", "Date,Description,Amount\n2024-01-20,SHELL OIL,-40.00\n");
        InMemoryRecordStore failing = new InMemoryRecordStore() {
            @Override
            public synchronized BatchResult commitBatch(CommitBatch batch) {
                if (batch.inserts().stream().anyMatch(insert -> "b_amex.csv".equals(insert.sourceFile()))) {
                    throw new StoreWriteException("connection reset", null);
                }
                return super.commitBatch(batch);
            }
        };

        ImportReport report = orchestrator(failing, new BookkeepingProperties(null, null, null))
                .importDirectory(options(dir.resolve("in")));

        assertThat(report.status()).isEqualTo(RunStatus.PARTIAL);
        assertThat(report.files().get(1).failure()).isEqualTo(FileImportResult.Failure.STORE_WRITE);
        assertThat(report.files().get(1).counts().inserted()).isZero();
        assertThat(failing.findAll()).extracting(StoredTransaction::description).containsExactly("STARBUCKS #123", "PAYROLL");
    }

    @Test
    void failedStoreLookupFailsOnlyThatFileAndStillClosesTheRun() throws IOException {
        write("in/a.csv", CHASE);
        write("in/b.csv", "Date,Description,Amount\n2024-01-20,SHELL OIL,-40.00\n");
        InMemoryRecordStore flaky = new InMemoryRecordStore() {
            private boolean failed;

            @Override
            public synchronized boolean rowHashExists(String rowHash) {
                if (!failed) {
                    failed = true;
                    throw new DataAccessResourceFailureException("connection reset");
                }
                return super.rowHashExists(rowHash);
            }
        };

        ImportReport report = orchestrator(flaky, new BookkeepingProperties(null, null, null))
                .importDirectory(options(dir.resolve("in")));

        assertThat(report.status()).isEqualTo(RunStatus.PARTIAL);
        assertThat(report.exitCode()).isEqualTo(1);
        assertThat(report.files().get(0).failure()).isEqualTo(FileImportResult.Failure.STORE_READ);
        assertThat(report.files().get(0).failureMessage()).contains("connection reset");
        assertThat(report.files().get(1).failed()).isFalse();
        assertThat(flaky.findAll()).extracting(StoredTransaction::description).containsExactly("SHELL OIL");

        ProcessingLogEntry entry = flaky.findRun(report.runId()).orElseThrow();
        assertThat(entry.completed()).isTrue();
        assertThat(entry.status()).isEqualTo(RunStatus.PARTIAL);
    }

    @Test
    void unexpectedErrorStillCompletesTheRunAsFailed() throws IOException {
        write("in/a.csv", CHASE);
        write("in/b.csv", "Date,Description,Amount\n2024-01-20,SHELL OIL,-40.00\n");
        InMemoryRecordStore broken = new InMemoryRecordStore() {
            @Override
            public synchronized BatchResult commitBatch(CommitBatch batch) {
                if (batch.inserts().stream().anyMatch(insert -> "b.csv".equals(insert.sourceFile()))) {
                    throw new IllegalStateException("pool closed");
                }
                return super.commitBatch(batch);
            }
        };

        assertThatThrownBy(() -> orchestrator(broken, new BookkeepingProperties(null, null, null))
                .importDirectory(options(dir.resolve("in"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("pool closed");

        ProcessingLogEntry entry = broken.findRun(1L).orElseThrow();
        assertThat(entry.completed()).isTrue();
        assertThat(entry.status()).isEqualTo(RunStatus.FAILED);
        assertThat(entry.counts().inserted()).isEqualTo(2);
        assertThat(entry.details()).containsEntry("abortedAfterFiles", 1);
        assertThat((String) entry.details().get("abortMessage")).contains("pool closed");
    }

    @Test
    void resolvedGroupNumbersAreNeverHandedOutAgain() throws IOException {
        write("jan/chase.csv", CHASE);
        write("feb/amex.csv", "Date,Description,Amount\n2024-01-15,STARBUCKS #456,-4.50\n");
        write("mar/bank.csv", "Date,Description,Amount\n2024-01-16,PAYROLL DEPOSIT,2500.00\n");
        ImportOrchestrator orchestrator = orchestrator();
        orchestrator.importDirectory(options(dir.resolve("jan")));
        orchestrator.importDirectory(options(dir.resolve("feb")));
        assertThat(store.findPendingReviewGroups()).extracting(DuplicateGroup::groupId).containsExactly("DUP_0001");

        new DuplicateReviewService(store, Clock.fixed(Instant.parse("2024-02-02T08:00:00Z"), ZoneOffset.UTC))
                .review("DUP_0001", ReviewAction.DELETE, 1L, "alice", null);
        assertThat(store.findPendingReviewGroups()).isEmpty();

        orchestrator.importDirectory(options(dir.resolve("mar")));
        ImportReport again = orchestrator.importDirectory(options(dir.resolve("feb")));

        List<DuplicateGroup> pending = store.findPendingReviewGroups();
        assertThat(pending).extracting(DuplicateGroup::groupId).containsExactly("DUP_0002");
        assertThat(pending.get(0).members()).extracting(StoredTransaction::description)
                .containsExactly("PAYROLL", "PAYROLL DEPOSIT");
        assertThat(again.totals()).isEqualTo(new RunCounts(1, 0, 0, 1, 0));
        assertThat(store.currentDupGroupSequence()).isEqualTo(2);
    }

    @Test
    void sameDayAndAmountInsideOneFileIsReportedAsACollision() throws IOException {
        write("in/chase.csv", "Date,Description,Amount\n"
                + "2024-01-15,STARBUCKS #123,-4.50\n"
                + "2024-01-15,STARBUCKS #456,-4.50\n"
                + "2024-01-16,PAYROLL,2500.00\n");

        ImportReport report = orchestrator().importDirectory(options(dir.resolve("in")));

        assertThat(report.files().get(0).inBatchCollisions()).isEqualTo(1);
        assertThat(report.files().get(0).reviewCandidates()).isEqualTo(2);
        ProcessingLogEntry entry = store.findRun(report.runId()).orElseThrow();
        assertThat(entry.details()).containsEntry("inBatchCollisions", 1);
    }

    @Test
    void sinceFiltersOlderRowsWithoutCountingThem() throws IOException {
        write("in/chase.csv", CHASE);

        ImportReport report = orchestrator().importDirectory(
                new ImportOptions(dir.resolve("in"), LocalDate.of(2024, 1, 16), false, false, null, null));

        assertThat(report.totals()).isEqualTo(new RunCounts(1, 1, 0, 0, 0));
        assertThat(report.files().get(0).filteredBySince()).isEqualTo(1);
        assertThat(store.findAll()).extracting(StoredTransaction::description).containsExactly("PAYROLL");
    }

    @Test
    void invertedSourceFlipsSigns() throws IOException {
        write("in/amex.csv", "Date,Description,Amount\n2024-01-18,NETFLIX.COM,15.99\n");
        BookkeepingProperties properties = new BookkeepingProperties(
                new BookkeepingProperties.Ingest(null, null, null, null, List.of("AMEX"), null), null, null);

        orchestrator(store, properties).importDirectory(options(dir.resolve("in")));

        assertThat(store.findAll().get(0).amount()).isEqualByComparingTo("-15.99");
    }

    @Test
    void vendorRulesCategorizeOnImport() throws IOException {
        write("in/chase.csv", CHASE);
        store.addVendorRule("STARBUCKS", "Dining", false, 5);

        orchestrator().importDirectory(options(dir.resolve("in")));

        StoredTransaction starbucks = store.findAll().get(0);
        assertThat(starbucks.category()).isEqualTo("Dining");
        assertThat(starbucks.vendor()).isEqualTo("STARBUCKS");
        assertThat(store.findAll().get(1).categorized()).isFalse();
    }

    @Test
    void discoversCsvFilesInPathOrder() throws IOException {
        write("in/b.csv", CHASE);
        write("in/A.CSV", CHASE);
        write("in/notes.txt", "ignore me");
        write("in/nested/c.csv", CHASE);

        assertThat(ImportOrchestrator.discoverFiles(dir.resolve("in"), false))
                .extracting(path -> path.getFileName().toString())
                .containsExactly("A.CSV", "b.csv");
        assertThat(ImportOrchestrator.discoverFiles(dir.resolve("in"), true))
                .extracting(path -> path.getFileName().toString())
                .containsExactly("A.CSV", "b.csv", "c.csv");
    }

    @Test
    void emptyDirectoryCompletesWithZeroCounts() throws IOException {
        Files.createDirectories(dir.resolve("empty"));

        ImportReport report = orchestrator().importDirectory(options(dir.resolve("empty")));

        assertThat(report.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(report.totals()).isEqualTo(RunCounts.ZERO);
    }

    @Test
    void missingInputDirectoryIsRejected() {
        assertThatThrownBy(() -> orchestrator().importDirectory(options(dir.resolve("nope"))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
