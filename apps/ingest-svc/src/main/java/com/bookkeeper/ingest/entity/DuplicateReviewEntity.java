package com.bookkeeper.ingest.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;

@Entity
@Table(
        name = "duplicate_review",
        uniqueConstraints = @UniqueConstraint(name = "duplicate_review_group_txn_unique", columnNames = {"dup_group", "transaction_id"})
)
public class DuplicateReviewEntity {

    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_REVIEWED = "reviewed";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "dup_group", nullable = false, length = 20)
    private String dupGroup;

    @Column(name = "transaction_id", nullable = false)
    private Long transactionId;

    @Column(name = "status", nullable = false, length = 20)
    private String status = STATUS_PENDING;

    @Column(name = "action", length = 20)
    private String action;

    @Column(name = "keep_transaction_id")
    private Long keepTransactionId;

    @Column(name = "reviewer", length = 100)
    private String reviewer;

    @Column(name = "notes", columnDefinition = "text")
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    protected DuplicateReviewEntity() {
    }

    public DuplicateReviewEntity(String dupGroup, Long transactionId) {
        this.dupGroup = dupGroup;
        this.transactionId = transactionId;
    }

    @PrePersist
    void prePersist() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public void markReviewed(String action, Long keepTransactionId, String reviewer, String notes, Instant reviewedAt) {
        this.status = STATUS_REVIEWED;
        this.action = action;
        this.keepTransactionId = keepTransactionId;
        this.reviewer = reviewer;
        this.notes = notes;
        this.reviewedAt = reviewedAt;
    }

    public Long getId() { return id; }

    public String getDupGroup() { return dupGroup; }

    public Long getTransactionId() { return transactionId; }

    public String getStatus() { return status; }

    public String getAction() { return action; }

    public Long getKeepTransactionId() { return keepTransactionId; }

    public String getReviewer() { return reviewer; }

    public String getNotes() { return notes; }

    public Instant getCreatedAt() { return createdAt; }

    public Instant getReviewedAt() { return reviewedAt; }
}
