package com.bookkeeper.ingest.cli;

import com.bookkeeper.ingest.ai.CategorizationService;
import com.bookkeeper.ingest.config.BookkeepingProperties;
import com.bookkeeper.ingest.model.DuplicateGroup;
import com.bookkeeper.ingest.model.IngestException;
import com.bookkeeper.ingest.model.RunCounts;
import com.bookkeeper.ingest.model.RunStatus;
import com.bookkeeper.ingest.model.StoredTransaction;
import com.bookkeeper.ingest.model.VendorMappingRule;
import com.bookkeeper.ingest.review.DuplicateReviewService;
import com.bookkeeper.ingest.rules.VendorRuleService;
import com.bookkeeper.ingest.service.FileImportResult;
import com.bookkeeper.ingest.service.ImportOrchestrator;
import com.bookkeeper.ingest.service.ImportReport;
import java.io.PrintStream;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point. Exit codes: 0 on success, 1 when a file failed, a row errored or the
 * store was unavailable, 2 for invalid arguments.
 */
@Component
public class IngestCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger log = LoggerFactory.getLogger(IngestCommandRunner.class);

    private final ImportOrchestrator importOrchestrator;
    private final CategorizationService categorizationService;
    private final DuplicateReviewService reviewService;
    private final VendorRuleService ruleService;
    private final BookkeepingProperties properties;
    private final PrintStream out;
    private int exitCode = EXIT_OK;

    @Autowired
    public IngestCommandRunner(ImportOrchestrator importOrchestrator,
                               CategorizationService categorizationService,
                               DuplicateReviewService reviewService,
                               VendorRuleService ruleService,
                               BookkeepingProperties properties) {
        this(importOrchestrator, categorizationService, reviewService, ruleService, properties, System.out);
    }

    IngestCommandRunner(ImportOrchestrator importOrchestrator,
                        CategorizationService categorizationService,
                        DuplicateReviewService reviewService,
                        VendorRuleService ruleService,
                        BookkeepingProperties properties,
                        PrintStream out) {
        this.importOrchestrator = importOrchestrator;
        this.categorizationService = categorizationService;
        this.reviewService = reviewService;
        this.ruleService = ruleService;
        this.properties = properties;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args.getSourceArgs());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(String... args) {
        IngestCommandLine command;
        try {
            command = IngestCommandLine.parse(args, properties);
        } catch (IllegalArgumentException ex) {
            out.println("error: " + ex.getMessage());
            out.println(IngestCommandLine.USAGE);
            return EXIT_USAGE;
        }
        try {
            return switch (command.mode()) {
                case HELP -> {
                    out.println(IngestCommandLine.USAGE);
                    yield EXIT_OK;
                }
                case IMPORT -> runImport(command);
                case CATEGORIZE -> runCategorize(command);
                case REVIEW_QUEUE -> printReviewQueue();
                case REVIEW -> runReview(command.review());
                case ADD_RULE -> addRule(command.rule());
            };
        } catch (IllegalArgumentException ex) {
            log.error("Invalid request: {}", ex.getMessage());
            out.println("error: " + ex.getMessage());
            return EXIT_USAGE;
        } catch (IngestException ex) {
            log.error("{} aborted: {}", command.mode(), ex.getMessage(), ex);
            out.println("error: " + ex.getMessage());
            return EXIT_FAILURES;
        }
    }

    private int runImport(IngestCommandLine command) {
        ImportReport report = importOrchestrator.importDirectory(command.importOptions());
        out.println((report.dryRun() ? "[dry-run] " : "") + "Import " + report.status().dbValue());
        for (FileImportResult file : report.files()) {
            if (file.failed()) {
                out.printf("  %s: FAILED (%s)%n", file.file().getFileName(), file.failureMessage());
            } else {
                out.printf("  %s: %s, review candidates=%d%n", file.file().getFileName(), describe(file.counts()), file.reviewCandidates());
            }
            file.rowErrors().forEach(error -> out.println("    " + error));
        }
        out.println("Total: " + describe(report.totals()));
        return report.exitCode() == 0 ? EXIT_OK : EXIT_FAILURES;
    }

    private int runCategorize(IngestCommandLine command) {
        CategorizationService.CategorizationReport report = categorizationService.categorizePending(command.batchSize(), command.limit());
        out.printf("Categorization %s: processed=%d rules=%d ai=%d uncategorized=%d failedBatches=%d%n",
                report.status().dbValue(), report.processed(), report.ruleMatched(), report.classified(),
                report.uncategorized(), report.failedBatches());
        return report.status() == RunStatus.COMPLETED ? EXIT_OK : EXIT_FAILURES;
    }

    private int printReviewQueue() {
        List<DuplicateGroup> groups = reviewService.pendingGroups();
        if (groups.isEmpty()) {
            out.println("No duplicate groups waiting for review");
            return EXIT_OK;
        }
        for (DuplicateGroup group : groups) {
            out.printf("%s (%d transactions)%n", group.groupId(), group.size());
            for (StoredTransaction member : group.members()) {
                out.printf("  #%d %s %s %s%n", member.id(), member.date(), member.amount().toPlainString(), member.description());
            }
        }
        return EXIT_OK;
    }

    private int runReview(IngestCommandLine.ReviewRequest request) {
        DuplicateReviewService.ReviewOutcome outcome = reviewService.review(
                request.groupId(), request.action(), request.keepTransactionId(), request.reviewer(), request.notes());
        out.printf("%s reviewed: %s, removed %d transaction(s)%n",
                outcome.groupId(), outcome.action().dbValue(), outcome.removedTransactionIds().size());
        return EXIT_OK;
    }

    private int addRule(IngestCommandLine.RuleRequest request) {
        VendorMappingRule rule = ruleService.addRule(request.pattern(), request.category(), request.regex(), request.priority());
        out.printf("Added rule #%d: '%s' -> %s (priority %d%s)%n",
                rule.sequence(), rule.pattern(), rule.category(), rule.priority(), rule.regex() ? ", regex" : "");
        return EXIT_OK;
    }

    private static String describe(RunCounts counts) {
        return String.format("processed=%d inserted=%d updated=%d skipped=%d errored=%d",
                counts.processed(), counts.inserted(), counts.updated(), counts.skipped(), counts.errored());
    }
}
