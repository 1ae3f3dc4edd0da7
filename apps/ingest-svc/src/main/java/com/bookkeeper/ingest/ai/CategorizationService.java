package com.bookkeeper.ingest.ai;

import com.bookkeeper.ingest.config.BookkeepingProperties;
import com.bookkeeper.ingest.model.ProcessingLogEntry;
import com.bookkeeper.ingest.model.RunCounts;
import com.bookkeeper.ingest.model.RunStatus;
import com.bookkeeper.ingest.model.StoredTransaction;
import com.bookkeeper.ingest.repository.RecordStore;
import com.bookkeeper.ingest.repository.StoreWriteException;
import com.bookkeeper.ingest.rules.RuleMatch;
import com.bookkeeper.ingest.rules.VendorNameCleaner;
import com.bookkeeper.ingest.rules.VendorRuleEngine;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Categorizes stored transactions that have no category yet: vendor rules first, then the
 * external classifier in batches.
 */
@Service
public class CategorizationService {

    public static final String OPERATION_TYPE = "ai_categorization";

    private static final Logger log = LoggerFactory.getLogger(CategorizationService.class);

    public record CategorizationReport(long runId, RunStatus status, int processed, int ruleMatched,
                                       int classified, int uncategorized, int failedBatches) {
    }

    private final RecordStore recordStore;
    private final VendorRuleEngine ruleEngine;
    private final TransactionClassifier classifier;
    private final BookkeepingProperties.Ai aiProperties;
    private final Clock clock;

    public CategorizationService(RecordStore recordStore,
                                 VendorRuleEngine ruleEngine,
                                 TransactionClassifier classifier,
                                 BookkeepingProperties properties,
                                 Clock clock) {
        this.recordStore = recordStore;
        this.ruleEngine = ruleEngine;
        this.classifier = classifier;
        this.aiProperties = properties.ai();
        this.clock = clock;
    }

    public CategorizationReport categorizePending(int batchSize, int limit) {
        if (batchSize <= 0 || limit <= 0) {
            throw new IllegalArgumentException("batch size and limit must be positive");
        }
        long runId = recordStore.startRun(OPERATION_TYPE, null, clock.instant());
        Progress progress = new Progress();
        try {
            run(batchSize, limit, progress);
        } catch (RuntimeException ex) {
            log.error("Categorization run={} aborted after {} update(s)", runId, progress.ruleMatched + progress.classified, ex);
            try {
                finishRun(runId, RunStatus.FAILED, progress, batchSize, limit);
            } catch (RuntimeException finishFailure) {
                ex.addSuppressed(finishFailure);
            }
            throw ex;
        }

        RunStatus status = progress.failedBatches > 0 || progress.failedUpdates > 0 ? RunStatus.PARTIAL : RunStatus.COMPLETED;
        ProcessingLogEntry entry = finishRun(runId, status, progress, batchSize, limit);
        log.info("Categorization run={} status={} processed={} ruleMatched={} classified={} uncategorized={}",
                runId, entry.status().dbValue(), progress.pending, progress.ruleMatched, progress.classified, progress.uncategorized());
        return new CategorizationReport(runId, status, progress.pending, progress.ruleMatched, progress.classified,
                progress.uncategorized(), progress.failedBatches);
    }

    private void run(int batchSize, int limit, Progress progress) {
        List<StoredTransaction> pending = recordStore.findUncategorized(limit);
        progress.pending = pending.size();
        VendorRuleEngine.RuleSet rules = ruleEngine.prepare(recordStore.findActiveVendorRules());

        List<StoredTransaction> remaining = new ArrayList<>();
        for (StoredTransaction tx : pending) {
            Optional<RuleMatch> match = rules.match(tx.description());
            if (match.isEmpty()) {
                remaining.add(tx);
            } else if (applyCategory(tx, match.get().category(), match.get().vendor(), progress)) {
                progress.ruleMatched++;
            }
        }

        progress.classifierEnabled = classifier.isEnabled();
        if (!progress.classifierEnabled) {
            if (!remaining.isEmpty()) {
                log.warn("AI classifier disabled; {} transactions stay uncategorized", remaining.size());
            }
            return;
        }
        for (int start = 0; start < remaining.size(); start += batchSize) {
            if (start > 0 && !pauseBetweenBatches()) {
                break;
            }
            List<StoredTransaction> batch = remaining.subList(start, Math.min(start + batchSize, remaining.size()));
            Map<Integer, String> answers;
            try {
                answers = classifyBatch(batch);
            } catch (ClassifierException ex) {
                progress.failedBatches++;
                progress.failedRows += batch.size();
                log.warn("Classifier batch starting at {} failed ({} rows left uncategorized): {}",
                        start, batch.size(), ex.getMessage());
                continue;
            }
            for (int i = 0; i < batch.size(); i++) {
                String category = answers.get(i + 1);
                StoredTransaction tx = batch.get(i);
                if (category != null
                        && applyCategory(tx, canonicalCategory(category), VendorNameCleaner.clean(tx.description()), progress)) {
                    progress.classified++;
                }
            }
        }
    }

    private Map<Integer, String> classifyBatch(List<StoredTransaction> batch) {
        List<ClassificationRequest> requests = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            StoredTransaction tx = batch.get(i);
            requests.add(new ClassificationRequest(i + 1, tx.date(), tx.description(), tx.amount()));
        }
        return classifier.classify(requests);
    }

    // a row whose update fails stays uncategorized and is picked up again by the next run
    private boolean applyCategory(StoredTransaction tx, String category, String vendor, Progress progress) {
        try {
            recordStore.updateCategory(tx.id(), category, vendor);
            return true;
        } catch (StoreWriteException ex) {
            progress.failedUpdates++;
            log.warn("Could not store category {} for transaction {}: {}", category, tx.id(), ex.getMessage());
            return false;
        }
    }

    private ProcessingLogEntry finishRun(long runId, RunStatus status, Progress progress, int batchSize, int limit) {
        int errored = progress.failedRows + progress.failedUpdates;
        RunCounts counts = new RunCounts(progress.pending, 0, progress.ruleMatched + progress.classified,
                Math.max(0, progress.uncategorized() - errored), errored);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("ruleMatched", progress.ruleMatched);
        details.put("classified", progress.classified);
        details.put("failedBatches", progress.failedBatches);
        details.put("failedUpdates", progress.failedUpdates);
        details.put("classifierEnabled", progress.classifierEnabled);
        details.put("batchSize", batchSize);
        details.put("limit", limit);
        return recordStore.completeRun(runId, counts, status, details, clock.instant());
    }

    private static final class Progress {
        int pending;
        int ruleMatched;
        int classified;
        int failedBatches;
        int failedRows;
        int failedUpdates;
        boolean classifierEnabled;

        int uncategorized() {
            return pending - ruleMatched - classified;
        }
    }

    /**
     * Maps a classifier answer onto the configured category list, case-insensitively; anything else
     * becomes the fallback category.
     */
    String canonicalCategory(String category) {
        String wanted = category.trim().toLowerCase(Locale.ROOT);
        return aiProperties.categories().stream()
                .filter(known -> known.toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst()
                .orElse(aiProperties.fallbackCategory());
    }

    private boolean pauseBetweenBatches() {
        long pause = aiProperties.pauseMillisOrDefault();
        if (pause <= 0) {
            return true;
        }
        try {
            Thread.sleep(pause);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Categorization interrupted; remaining batches skipped");
            return false;
        }
    }
}
