package com.bookkeeper.ingest.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * Persisted vendor rule. The generated id doubles as the creation sequence used to break priority ties.
 */
@Entity
@Table(name = "vendor_mappings")
public class VendorMappingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "pattern", nullable = false)
    private String pattern;

    @Column(name = "category", nullable = false, length = 100)
    private String category;

    @Column(name = "is_regex", nullable = false)
    private boolean regex;

    @Column(name = "priority", nullable = false)
    private int priority;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected VendorMappingEntity() {
    }

    public VendorMappingEntity(String pattern, String category, boolean regex, int priority) {
        this.pattern = pattern;
        this.category = category;
        this.regex = regex;
        this.priority = priority;
    }

    @PrePersist
    void prePersist() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public Long getId() {
        return id;
    }

    public String getPattern() {
        return pattern;
    }

    public String getCategory() {
        return category;
    }

    public boolean isRegex() {
        return regex;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
