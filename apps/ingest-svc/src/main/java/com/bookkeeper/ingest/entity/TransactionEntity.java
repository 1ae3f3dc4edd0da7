package com.bookkeeper.ingest.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(
        name = "transactions",
        uniqueConstraints = @UniqueConstraint(name = "transactions_row_hash_unique", columnNames = "row_hash"),
        indexes = {
                @Index(name = "transactions_posted_on_amount_idx", columnList = "posted_on, amount"),
                @Index(name = "transactions_dup_group_idx", columnList = "possible_dup_group")
        }
)
public class TransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "posted_on", nullable = false)
    private LocalDate postedOn;

    @Column(name = "description", nullable = false, columnDefinition = "text")
    private String description;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "source", length = 100)
    private String source;

    @Column(name = "source_file")
    private String sourceFile;

    @Column(name = "txn_id", length = 100)
    private String txnId;

    @Column(name = "reference", length = 100)
    private String reference;

    @Column(name = "account", length = 20)
    private String account;

    @Column(name = "balance", precision = 14, scale = 2)
    private BigDecimal balance;

    @Column(name = "time_part", length = 10)
    private String timePart;

    @Column(name = "row_hash", nullable = false, length = 32)
    private String rowHash;

    @Column(name = "original_hash", nullable = false, length = 32)
    private String originalHash;

    @Column(name = "possible_dup_group", length = 20)
    private String possibleDupGroup;

    @Column(name = "category", length = 100)
    private String category;

    @Column(name = "vendor", length = 100)
    private String vendor;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    protected TransactionEntity() {
    }

    public TransactionEntity(LocalDate postedOn, String description, BigDecimal amount, String rowHash, String originalHash) {
        this.postedOn = postedOn;
        this.description = description;
        this.amount = amount;
        this.rowHash = rowHash;
        this.originalHash = originalHash;
    }

    @PrePersist
    void prePersist() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public Long getId() { return id; }

    public LocalDate getPostedOn() { return postedOn; }

    public String getDescription() { return description; }

    public BigDecimal getAmount() { return amount; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public String getSourceFile() { return sourceFile; }
    public void setSourceFile(String sourceFile) { this.sourceFile = sourceFile; }

    public String getTxnId() { return txnId; }
    public void setTxnId(String txnId) { this.txnId = txnId; }

    public String getReference() { return reference; }
    public void setReference(String reference) { this.reference = reference; }

    public String getAccount() { return account; }
    public void setAccount(String account) { this.account = account; }

    public BigDecimal getBalance() { return balance; }
    public void setBalance(BigDecimal balance) { this.balance = balance; }

    public String getTimePart() { return timePart; }
    public void setTimePart(String timePart) { this.timePart = timePart; }

    public String getRowHash() { return rowHash; }

    public String getOriginalHash() { return originalHash; }

    public String getPossibleDupGroup() { return possibleDupGroup; }
    public void setPossibleDupGroup(String possibleDupGroup) { this.possibleDupGroup = possibleDupGroup; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public String getVendor() { return vendor; }
    public void setVendor(String vendor) { this.vendor = vendor; }

    public Instant getCreatedAt() { return createdAt; }

    public Instant getDeletedAt() { return deletedAt; }
    public void setDeletedAt(Instant deletedAt) { this.deletedAt = deletedAt; }
}
