package com.bookkeeper.ingest.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Single-row counter behind {@code DUP_nnnn} group ids.
 */
@Entity
@Table(name = "dup_group_sequence")
public class DupGroupSequenceEntity {

    public static final int SINGLETON_ID = 1;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Integer id;

    @Column(name = "current_seq", nullable = false)
    private long currentSeq;

    protected DupGroupSequenceEntity() {
    }

    public DupGroupSequenceEntity(Integer id, long currentSeq) {
        this.id = id;
        this.currentSeq = currentSeq;
    }

    public long next() {
        currentSeq += 1;
        return currentSeq;
    }

    public Integer getId() {
        return id;
    }

    public long getCurrentSeq() {
        return currentSeq;
    }
}
