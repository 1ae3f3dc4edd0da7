package com.bookkeeper.ingest.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "processing_log")
public class ProcessingLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "operation_type", nullable = false, length = 50)
    private String operationType;

    @Column(name = "source_file")
    private String sourceFile;

    @Column(name = "records_processed", nullable = false)
    private int recordsProcessed;

    @Column(name = "records_inserted", nullable = false)
    private int recordsInserted;

    @Column(name = "records_updated", nullable = false)
    private int recordsUpdated;

    @Column(name = "records_skipped", nullable = false)
    private int recordsSkipped;

    @Column(name = "records_errored", nullable = false)
    private int recordsErrored;

    @Column(name = "status", nullable = false, length = 20)
    private String status;

    @Column(name = "details", columnDefinition = "text")
    private String details;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    protected ProcessingLogEntity() {
    }

    public ProcessingLogEntity(String operationType, String sourceFile, String status, Instant startedAt) {
        this.operationType = operationType;
        this.sourceFile = sourceFile;
        this.status = status;
        this.startedAt = startedAt;
    }

    public Long getId() { return id; }

    public String getOperationType() { return operationType; }

    public String getSourceFile() { return sourceFile; }

    public int getRecordsProcessed() { return recordsProcessed; }
    public void setRecordsProcessed(int recordsProcessed) { this.recordsProcessed = recordsProcessed; }

    public int getRecordsInserted() { return recordsInserted; }
    public void setRecordsInserted(int recordsInserted) { this.recordsInserted = recordsInserted; }

    public int getRecordsUpdated() { return recordsUpdated; }
    public void setRecordsUpdated(int recordsUpdated) { this.recordsUpdated = recordsUpdated; }

    public int getRecordsSkipped() { return recordsSkipped; }
    public void setRecordsSkipped(int recordsSkipped) { this.recordsSkipped = recordsSkipped; }

    public int getRecordsErrored() { return recordsErrored; }
    public void setRecordsErrored(int recordsErrored) { this.recordsErrored = recordsErrored; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getDetails() { return details; }
    public void setDetails(String details) { this.details = details; }

    public Instant getStartedAt() { return startedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
}
