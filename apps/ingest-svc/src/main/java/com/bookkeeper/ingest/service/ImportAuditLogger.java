package com.bookkeeper.ingest.service;

import com.bookkeeper.ingest.model.RunCounts;
import com.bookkeeper.ingest.model.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ImportAuditLogger {

    private static final Logger log = LoggerFactory.getLogger(ImportAuditLogger.class);

    public void fileImported(FileImportResult result, boolean dryRun) {
        RunCounts counts = result.counts();
        log.info("import_audit file={} source={} processed={} inserted={} updated={} skipped={} errored={} reviewCandidates={} inBatchCollisions={} filtered={} dryRun={}",
                result.file().getFileName(), result.source(), counts.processed(), counts.inserted(), counts.updated(),
                counts.skipped(), counts.errored(), result.reviewCandidates(), result.inBatchCollisions(),
                result.filteredBySince(), dryRun);
    }

    public void fileFailed(FileImportResult result, boolean dryRun) {
        log.warn("import_audit file={} status=failed reason={} message=\"{}\" dryRun={}",
                result.file().getFileName(), result.failure(), result.failureMessage(), dryRun);
    }

    public void runCompleted(long runId, RunStatus status, RunCounts totals, int files, boolean dryRun) {
        log.info("import_audit run={} status={} files={} processed={} inserted={} updated={} skipped={} errored={} dryRun={}",
                runId, status.dbValue(), files, totals.processed(), totals.inserted(), totals.updated(),
                totals.skipped(), totals.errored(), dryRun);
    }
}
