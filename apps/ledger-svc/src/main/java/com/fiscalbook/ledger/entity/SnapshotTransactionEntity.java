package com.fiscalbook.ledger.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "snapshot_transactions")
public class SnapshotTransactionEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "snapshot_id", nullable = false)
    private UUID snapshotId;

    @Column(name = "original_transaction_id")
    private UUID originalTransactionId;

    @Column(name = "transaction_date")
    private Instant transactionDate;

    @Column(name = "transaction_data", nullable = false, columnDefinition = "text")
    private String transactionData;

    @ElementCollection
    @CollectionTable(name = "snapshot_transaction_annotations", joinColumns = @JoinColumn(name = "snapshot_transaction_id"))
    @OrderColumn(name = "position")
    private List<AnnotationEmbeddable> annotations = new ArrayList<>();

    @Column(name = "copied_at", nullable = false)
    private Instant copiedAt;

    public SnapshotTransactionEntity() {}

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getSnapshotId() { return snapshotId; }
    public void setSnapshotId(UUID snapshotId) { this.snapshotId = snapshotId; }

    public UUID getOriginalTransactionId() { return originalTransactionId; }
    public void setOriginalTransactionId(UUID originalTransactionId) { this.originalTransactionId = originalTransactionId; }

    public Instant getTransactionDate() { return transactionDate; }
    public void setTransactionDate(Instant transactionDate) { this.transactionDate = transactionDate; }

    public String getTransactionData() { return transactionData; }
    public void setTransactionData(String transactionData) { this.transactionData = transactionData; }

    public List<AnnotationEmbeddable> getAnnotations() { return annotations; }
    public void setAnnotations(List<AnnotationEmbeddable> annotations) { this.annotations = annotations; }

    public Instant getCopiedAt() { return copiedAt; }
    public void setCopiedAt(Instant copiedAt) { this.copiedAt = copiedAt; }
}
