package com.bookkeeper.ingest.model;

/**
 * Row counters reported for a file and rolled up for a run.
 */
public record RunCounts(int processed, int inserted, int updated, int skipped, int errored) {

    public static final RunCounts ZERO = new RunCounts(0, 0, 0, 0, 0);

    public RunCounts plus(RunCounts other) {
        return new RunCounts(
                processed + other.processed,
                inserted + other.inserted,
                updated + other.updated,
                skipped + other.skipped,
                errored + other.errored
        );
    }
}
