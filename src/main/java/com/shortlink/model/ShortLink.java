package com.shortlink.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Durable short link. Everything except {@code visitCount} is immutable after creation,
 * and {@code visitCount} only ever grows through an additive update.
 */
@Entity
@Table(name = "short_links")
public class ShortLink implements Persistable<String> {

    public static final int MAX_CODE_LENGTH = 32;
    public static final int MAX_TARGET_URL_LENGTH = 2048;
    public static final int MAX_OWNER_LENGTH = 255;

    @Id
    @Column(name = "code", nullable = false, updatable = false, length = MAX_CODE_LENGTH)
    private String code;

    @Column(name = "target_url", nullable = false, updatable = false, length = MAX_TARGET_URL_LENGTH)
    private String targetUrl;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "owner", updatable = false, length = MAX_OWNER_LENGTH)
    private String owner;

    @Column(name = "visit_count", nullable = false)
    private long visitCount;

    // Forces persist() instead of merge() so a duplicate code fails on the primary key
    @Transient
    private boolean newEntity;

    protected ShortLink() {
        // for JPA
    }

    public ShortLink(String code, String targetUrl, String owner, Instant createdAt) {
        this.code = code;
        this.targetUrl = targetUrl;
        this.owner = owner;
        this.createdAt = createdAt;
        this.visitCount = 0L;
        this.newEntity = true;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newEntity = false;
    }

    @Override
    public String getId() {
        return code;
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    public String getCode() {
        return code;
    }

    public String getTargetUrl() {
        return targetUrl;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getOwner() {
        return owner;
    }

    public long getVisitCount() {
        return visitCount;
    }

    @Override
    public String toString() {
        return "ShortLink{code='" + code + "', targetUrl='" + targetUrl + "', owner='" + owner
                + "', visitCount=" + visitCount + ", createdAt=" + createdAt + '}';
    }
}
