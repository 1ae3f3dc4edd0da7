package com.bookkeeper.ingest.service;

import com.bookkeeper.ingest.model.RunCounts;
import com.bookkeeper.ingest.model.RunStatus;
import java.util.List;

/**
 * @param runId processing log id; for a dry run the id only existed in the overlay
 */
public record ImportReport(long runId, RunStatus status, RunCounts totals, List<FileImportResult> files, boolean dryRun) {

    public ImportReport {
        files = List.copyOf(files);
    }

    public boolean anyFileFailed() {
        return files.stream().anyMatch(FileImportResult::failed);
    }

    public int exitCode() {
        return anyFileFailed() || totals.errored() > 0 ? 1 : 0;
    }

    static RunStatus statusFor(List<FileImportResult> files) {
        long failed = files.stream().filter(FileImportResult::failed).count();
        if (failed == 0) {
            return RunStatus.COMPLETED;
        }
        return failed == files.size() ? RunStatus.FAILED : RunStatus.PARTIAL;
    }
}
