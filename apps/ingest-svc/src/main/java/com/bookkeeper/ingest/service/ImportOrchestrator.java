package com.bookkeeper.ingest.service;

import com.bookkeeper.ingest.config.BookkeepingProperties;
import com.bookkeeper.ingest.dedup.DedupResolver;
import com.bookkeeper.ingest.dedup.ResolutionResult;
import com.bookkeeper.ingest.dedup.ResolvedTransaction;
import com.bookkeeper.ingest.fingerprint.FingerprintEngine;
import com.bookkeeper.ingest.fingerprint.FingerprintedTransaction;
import com.bookkeeper.ingest.model.CanonicalTransaction;
import com.bookkeeper.ingest.model.Disposition;
import com.bookkeeper.ingest.model.RunCounts;
import com.bookkeeper.ingest.model.RunStatus;
import com.bookkeeper.ingest.normalize.CsvStatementReader;
import com.bookkeeper.ingest.normalize.FileReadException;
import com.bookkeeper.ingest.normalize.FormatDetector;
import com.bookkeeper.ingest.normalize.FormatProfile;
import com.bookkeeper.ingest.normalize.MalformedRowException;
import com.bookkeeper.ingest.normalize.ParsedStatement;
import com.bookkeeper.ingest.normalize.RawRow;
import com.bookkeeper.ingest.normalize.RowNormalizer;
import com.bookkeeper.ingest.repository.RecordStore;
import com.bookkeeper.ingest.repository.RecordStore.CommitBatch;
import com.bookkeeper.ingest.repository.RecordStore.NewTransaction;
import com.bookkeeper.ingest.repository.StoreReadException;
import com.bookkeeper.ingest.repository.StoreWriteException;
import com.bookkeeper.ingest.rules.RuleMatch;
import com.bookkeeper.ingest.rules.VendorRuleEngine;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Runs the import pipeline over a directory of statement exports, one file at a time:
 * read, normalize, fingerprint, dedup, categorize by rule, commit.
 *
 * <p>Row errors are counted and skipped. A file that cannot be read, or whose batch fails to
 * commit, or whose store lookups fail, is reported and the run moves on. The run entry is completed
 * even when the run aborts. A dry run pushes everything through an overlay of the
 * store, so its counts match a real run while nothing is written.
 */
@Service
public class ImportOrchestrator {

    public static final String OPERATION_TYPE = "csv_import";

    private static final Logger log = LoggerFactory.getLogger(ImportOrchestrator.class);

    private final RecordStore recordStore;
    private final CsvStatementReader reader;
    private final FormatDetector formatDetector;
    private final RowNormalizer normalizer;
    private final FingerprintEngine fingerprintEngine;
    private final DedupResolver dedupResolver;
    private final VendorRuleEngine ruleEngine;
    private final ImportAuditLogger auditLogger;
    private final Set<String> invertedSources;
    private final Clock clock;

    public ImportOrchestrator(RecordStore recordStore,
                              CsvStatementReader reader,
                              FormatDetector formatDetector,
                              RowNormalizer normalizer,
                              FingerprintEngine fingerprintEngine,
                              DedupResolver dedupResolver,
                              VendorRuleEngine ruleEngine,
                              ImportAuditLogger auditLogger,
                              BookkeepingProperties properties,
                              Clock clock) {
        this.recordStore = recordStore;
        this.reader = reader;
        this.formatDetector = formatDetector;
        this.normalizer = normalizer;
        this.fingerprintEngine = fingerprintEngine;
        this.dedupResolver = dedupResolver;
        this.ruleEngine = ruleEngine;
        this.auditLogger = auditLogger;
        this.invertedSources = properties.ingest().invertedSourceKeys();
        this.clock = clock;
    }

    public ImportReport importDirectory(ImportOptions options) {
        Path inputDir = options.inputDir();
        if (!Files.isDirectory(inputDir)) {
            throw new IllegalArgumentException("Input directory does not exist: " + inputDir);
        }
        List<Path> files = discoverFiles(inputDir, options.recursive());
        RecordStore store = options.dryRun() ? new DryRunRecordStore(recordStore) : recordStore;

        long runId = store.startRun(OPERATION_TYPE, inputDir.toString(), clock.instant());
        log.info("Import run={} started: {} file(s) in {} (recursive={}, since={}, dryRun={})",
                runId, files.size(), inputDir, options.recursive(), options.since(), options.dryRun());

        List<FileImportResult> results = new ArrayList<>();
        try {
            VendorRuleEngine.RuleSet rules = ruleEngine.prepare(store.findActiveVendorRules());
            for (Path file : files) {
                FileImportResult result = importFile(file, options, store, rules);
                results.add(result);
                if (result.failed()) {
                    auditLogger.fileFailed(result, options.dryRun());
                } else {
                    auditLogger.fileImported(result, options.dryRun());
                }
            }
        } catch (RuntimeException ex) {
            log.error("Import run={} aborted after {} of {} file(s)", runId, results.size(), files.size(), ex);
            try {
                finishRun(store, runId, options, results, files.size(), RunStatus.FAILED, ex.toString());
            } catch (RuntimeException finishFailure) {
                ex.addSuppressed(finishFailure);
            }
            throw ex;
        }

        RunStatus status = files.isEmpty() ? RunStatus.COMPLETED : ImportReport.statusFor(results);
        RunCounts totals = finishRun(store, runId, options, results, files.size(), status, null);
        return new ImportReport(runId, status, totals, results, options.dryRun());
    }

    private RunCounts finishRun(RecordStore store, long runId, ImportOptions options, List<FileImportResult> results,
                                int fileCount, RunStatus status, String abortMessage) {
        RunCounts totals = results.stream().map(FileImportResult::counts).reduce(RunCounts.ZERO, RunCounts::plus);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("inputDir", options.inputDir().toString());
        details.put("recursive", options.recursive());
        if (options.since() != null) {
            details.put("since", options.since().toString());
        }
        details.put("dryRun", options.dryRun());
        details.put("inBatchCollisions", results.stream().mapToInt(FileImportResult::inBatchCollisions).sum());
        details.put("files", results.stream().map(FileImportResult::toDetails).toList());
        if (abortMessage != null) {
            details.put("abortedAfterFiles", results.size());
            details.put("abortMessage", abortMessage);
        }
        store.completeRun(runId, totals, status, details, clock.instant());
        auditLogger.runCompleted(runId, status, totals, fileCount, options.dryRun());
        return totals;
    }

    FileImportResult importFile(Path file, ImportOptions options, RecordStore store, VendorRuleEngine.RuleSet rules) {
        String source = fileStem(file);
        List<String> rowErrors = new ArrayList<>();
        int processed = 0;
        int skipped = 0;
        try {
            ParsedStatement statement = reader.read(file, options.assumeEncoding());
            FormatProfile profile = formatDetector.detect(file, statement.headers(), options.sourceColumn());
            if (invertedSources.contains(source.toLowerCase(Locale.ROOT))) {
                profile = profile.withInvertSign(true);
            }

            List<FingerprintedTransaction> batch = new ArrayList<>();
            int filtered = 0;
            for (RawRow raw : statement.rows()) {
                CanonicalTransaction tx;
                try {
                    tx = normalizer.normalize(raw, profile, source);
                } catch (MalformedRowException ex) {
                    processed++;
                    rowErrors.add(ex.getMessage());
                    log.warn("Skipping malformed row in {}: {}", file.getFileName(), ex.getMessage());
                    continue;
                }
                if (options.since() != null && tx.date().isBefore(options.since())) {
                    filtered++;
                    continue;
                }
                processed++;
                batch.add(fingerprintEngine.fingerprint(tx, raw));
            }
            Set<String> collisions = fingerprintEngine.collidingKeys(batch);
            if (!collisions.isEmpty()) {
                log.info("{} date/amount key(s) collide inside {}: {}", collisions.size(), file.getFileName(), collisions);
            }

            ResolutionResult resolution = dedupResolver.resolve(batch, store);
            skipped = (int) resolution.count(Disposition.EXACT_DUPLICATE);
            List<NewTransaction> inserts = new ArrayList<>();
            for (ResolvedTransaction resolved : resolution.toInsert()) {
                inserts.add(toInsert(resolved, rules, file));
            }
            CommitBatch commit = new CommitBatch(inserts, resolution.existingGroupAssignments(), resolution.touchedGroups());
            RecordStore.BatchResult written = store.commitBatch(commit);

            RunCounts counts = new RunCounts(processed, written.inserted(), written.groupAssignments(), skipped, rowErrors.size());
            int reviewCandidates = (int) resolution.count(Disposition.REVIEW_CANDIDATE);
            return new FileImportResult(file, source, counts, reviewCandidates, filtered, collisions.size(), rowErrors, null, null);
        } catch (FileReadException ex) {
            log.error("Failed to read {}: {}", file, ex.getMessage());
            return FileImportResult.failed(file, source, RunCounts.ZERO, rowErrors, FileImportResult.Failure.FILE_READ, ex.getMessage());
        } catch (StoreReadException | DataAccessException ex) {
            log.error("Store lookup failed while importing {}: {}", file, ex.getMessage(), ex);
            RunCounts counts = new RunCounts(processed, 0, 0, 0, rowErrors.size());
            return FileImportResult.failed(file, source, counts, rowErrors, FileImportResult.Failure.STORE_READ, ex.getMessage());
        } catch (StoreWriteException ex) {
            log.error("Rolled back {}: {}", file, ex.getMessage(), ex);
            RunCounts counts = new RunCounts(processed, 0, 0, skipped, rowErrors.size());
            return FileImportResult.failed(file, source, counts, rowErrors, FileImportResult.Failure.STORE_WRITE, ex.getMessage());
        }
    }

    private NewTransaction toInsert(ResolvedTransaction resolved, VendorRuleEngine.RuleSet rules, Path file) {
        FingerprintedTransaction row = resolved.row();
        CanonicalTransaction tx = row.transaction();
        Optional<RuleMatch> match = rules.match(tx.description());
        return new NewTransaction(
                tx,
                row.rowHash(),
                row.originalHash(),
                resolved.dupGroupId(),
                match.map(RuleMatch::category).orElse(null),
                match.map(RuleMatch::vendor).orElse(null),
                file.getFileName().toString()
        );
    }

    static List<Path> discoverFiles(Path inputDir, boolean recursive) {
        try (Stream<Path> paths = recursive ? Files.walk(inputDir) : Files.list(inputDir)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"))
                    .sorted(Comparator.comparing(Path::toString))
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException ex) {
            throw new FileReadException(inputDir, "unable to list directory", ex);
        }
    }

    private static String fileStem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
