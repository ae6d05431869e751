package com.fiscalbook.ledger.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.time.Instant;

@Embeddable
public class AnnotationEmbeddable {
    @Column(name = "content", nullable = false, columnDefinition = "text")
    private String content;

    @Column(name = "created_by", nullable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public AnnotationEmbeddable() {}

    public AnnotationEmbeddable(String content, String createdBy, Instant createdAt) {
        this.content = content;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
    }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
