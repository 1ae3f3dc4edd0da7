package com.bookkeeper.ingest.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.bookkeeper.ingest.ai.CategorizationService;
import com.bookkeeper.ingest.config.BookkeepingProperties;
import com.bookkeeper.ingest.model.DuplicateGroup;
import com.bookkeeper.ingest.model.ReviewAction;
import com.bookkeeper.ingest.model.RunCounts;
import com.bookkeeper.ingest.model.RunStatus;
import com.bookkeeper.ingest.model.StoredTransaction;
import com.bookkeeper.ingest.model.VendorMappingRule;
import com.bookkeeper.ingest.repository.StoreReadException;
import com.bookkeeper.ingest.review.DuplicateReviewService;
import com.bookkeeper.ingest.rules.VendorRuleService;
import com.bookkeeper.ingest.service.FileImportResult;
import com.bookkeeper.ingest.service.ImportOptions;
import com.bookkeeper.ingest.service.ImportOrchestrator;
import com.bookkeeper.ingest.service.ImportReport;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class IngestCommandRunnerTest {

    @Mock
    private ImportOrchestrator importOrchestrator;
    @Mock
    private CategorizationService categorizationService;
    @Mock
    private DuplicateReviewService reviewService;
    @Mock
    private VendorRuleService ruleService;

    private ByteArrayOutputStream buffer;
    private IngestCommandRunner runner;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        buffer = new ByteArrayOutputStream();
        runner = new IngestCommandRunner(importOrchestrator, categorizationService, reviewService, ruleService,
                new BookkeepingProperties(null, null, null), new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static FileImportResult imported(String name, RunCounts counts, List<String> rowErrors) {
        return new FileImportResult(Path.of("/data/in", name), "chase", counts, 0, 0, 0, rowErrors, null, null);
    }

    @Test
    void cleanImportExitsZero() {
        RunCounts counts = new RunCounts(3, 3, 0, 0, 0);
        when(importOrchestrator.importDirectory(any(ImportOptions.class)))
                .thenReturn(new ImportReport(7L, RunStatus.COMPLETED, counts, List.of(imported("chase.csv", counts, List.of())), false));

        int exit = runner.execute("--input", "/data/in");

        assertThat(exit).isEqualTo(IngestCommandRunner.EXIT_OK);
        assertThat(output()).contains("Import completed").contains("chase.csv: processed=3 inserted=3");
    }

    @Test
    void rowErrorsOrFailedFilesExitOne() {
        RunCounts counts = new RunCounts(3, 2, 0, 0, 1);
        FileImportResult withErrors = imported("chase.csv", counts, List.of("line 4: unparsable date '13/45/2024'"));
        FileImportResult broken = new FileImportResult(Path.of("/data/in/amex.csv"), "amex", RunCounts.ZERO, 0, 0, 0,
                List.of(), FileImportResult.Failure.FILE_READ, "amex.csv: file has no header row");
        when(importOrchestrator.importDirectory(any(ImportOptions.class)))
                .thenReturn(new ImportReport(8L, RunStatus.PARTIAL, counts, List.of(withErrors, broken), true));

        int exit = runner.execute("--input=/data/in", "--dry-run");

        assertThat(exit).isEqualTo(IngestCommandRunner.EXIT_FAILURES);
        assertThat(output())
                .contains("[dry-run] Import partial")
                .contains("line 4: unparsable date")
                .contains("amex.csv: FAILED (amex.csv: file has no header row)");
    }

    @Test
    void usageErrorsExitTwoWithoutTouchingServices() {
        int exit = runner.execute("--categorize", "--review-queue");

        assertThat(exit).isEqualTo(IngestCommandRunner.EXIT_USAGE);
        assertThat(output()).startsWith("error: Choose one of").contains("usage: ingest-svc");
        verifyNoInteractions(importOrchestrator, categorizationService, reviewService, ruleService);
    }

    @Test
    void missingInputDirectoryExitsTwo() {
        when(importOrchestrator.importDirectory(any(ImportOptions.class)))
                .thenThrow(new IllegalArgumentException("Input directory does not exist: /nope"));

        assertThat(runner.execute("--input", "/nope")).isEqualTo(IngestCommandRunner.EXIT_USAGE);
        assertThat(output()).contains("error: Input directory does not exist: /nope");
    }

    @Test
    void unavailableStoreExitsOne() {
        when(importOrchestrator.importDirectory(any(ImportOptions.class)))
                .thenThrow(new StoreReadException("Failed to load active vendor rules", new IllegalStateException("connection reset")));

        assertThat(runner.execute("--input", "/data/in")).isEqualTo(IngestCommandRunner.EXIT_FAILURES);
        assertThat(output()).contains("error: Failed to load active vendor rules");
    }

    @Test
    void failedCategorizationBatchExitsOne() {
        when(categorizationService.categorizePending(50, 1000))
                .thenReturn(new CategorizationService.CategorizationReport(3L, RunStatus.PARTIAL, 100, 40, 10, 50, 1));

        assertThat(runner.execute("--categorize")).isEqualTo(IngestCommandRunner.EXIT_FAILURES);
        assertThat(output()).contains("Categorization partial: processed=100 rules=40 ai=10 uncategorized=50 failedBatches=1");
    }

    @Test
    void reviewQueueListsMembers() {
        StoredTransaction first = new StoredTransaction(11L, LocalDate.of(2024, 1, 15), "STARBUCKS #123",
                new BigDecimal("-4.50"), "h1", "DUP_0001", null, null);
        StoredTransaction second = new StoredTransaction(12L, LocalDate.of(2024, 1, 15), "STARBUCKS #456",
                new BigDecimal("-4.50"), "h2", "DUP_0001", null, null);
        when(reviewService.pendingGroups()).thenReturn(List.of(new DuplicateGroup("DUP_0001", List.of(first, second))));

        assertThat(runner.execute("--review-queue")).isZero();
        assertThat(output()).contains("DUP_0001 (2 transactions)").contains("#12 2024-01-15 -4.50 STARBUCKS #456");
    }

    @Test
    void reviewDecisionIsForwarded() {
        when(reviewService.review("DUP_0001", ReviewAction.DELETE, 11L, "alice", null))
                .thenReturn(new DuplicateReviewService.ReviewOutcome("DUP_0001", ReviewAction.DELETE, 11L, List.of(12L)));

        assertThat(runner.execute("--review", "DUP_0001:delete:11", "--reviewer", "alice")).isZero();
        assertThat(output()).contains("DUP_0001 reviewed: delete, removed 1 transaction(s)");
    }

    @Test
    void addRuleReportsTheStoredRule() {
        when(ruleService.addRule(eq("STARBUCKS"), eq("Dining"), eq(false), eq(5)))
                .thenReturn(new VendorMappingRule(4L, "STARBUCKS", "Dining", false, 5));

        assertThat(runner.execute("--add-rule", "STARBUCKS=Dining;priority=5")).isZero();
        verify(ruleService).addRule("STARBUCKS", "Dining", false, 5);
        assertThat(output()).contains("Added rule #4: 'STARBUCKS' -> Dining (priority 5)");
    }
}
