package com.fiscalbook.ledger.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "fiscal_book_snapshots")
public class SnapshotEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "original_fiscal_book_id", nullable = false)
    private UUID originalFiscalBookId;

    @Column(name = "snapshot_name", nullable = false)
    private String snapshotName;

    @Column(name = "snapshot_description", columnDefinition = "text")
    private String snapshotDescription;

    @Column(name = "creation_source", nullable = false, length = 32)
    private String creationSource;

    @Column(name = "is_protected", nullable = false)
    private boolean protectedSnapshot;

    @ElementCollection
    @CollectionTable(name = "fiscal_book_snapshot_tags", joinColumns = @JoinColumn(name = "snapshot_id"))
    @OrderColumn(name = "position")
    @Column(name = "tag", nullable = false)
    private List<String> tags = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "fiscal_book_snapshot_annotations", joinColumns = @JoinColumn(name = "snapshot_id"))
    @OrderColumn(name = "position")
    private List<AnnotationEmbeddable> annotations = new ArrayList<>();

    // JSON document of the book's descriptive fields at capture time
    @Column(name = "fiscal_book_data", nullable = false, columnDefinition = "text")
    private String fiscalBookData;

    @Column(name = "transaction_count", nullable = false)
    private int transactionCount;

    @Column(name = "total_income", nullable = false, precision = 16, scale = 2)
    private BigDecimal totalIncome;

    @Column(name = "total_expenses", nullable = false, precision = 16, scale = 2)
    private BigDecimal totalExpenses;

    @Column(name = "net_amount", nullable = false, precision = 16, scale = 2)
    private BigDecimal netAmount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public SnapshotEntity() {}

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getOriginalFiscalBookId() { return originalFiscalBookId; }
    public void setOriginalFiscalBookId(UUID originalFiscalBookId) { this.originalFiscalBookId = originalFiscalBookId; }

    public String getSnapshotName() { return snapshotName; }
    public void setSnapshotName(String snapshotName) { this.snapshotName = snapshotName; }

    public String getSnapshotDescription() { return snapshotDescription; }
    public void setSnapshotDescription(String snapshotDescription) { this.snapshotDescription = snapshotDescription; }

    public String getCreationSource() { return creationSource; }
    public void setCreationSource(String creationSource) { this.creationSource = creationSource; }

    public boolean isProtectedSnapshot() { return protectedSnapshot; }
    public void setProtectedSnapshot(boolean protectedSnapshot) { this.protectedSnapshot = protectedSnapshot; }

    public List<String> getTags() { return tags; }
    public void setTags(List<String> tags) { this.tags = tags; }

    public List<AnnotationEmbeddable> getAnnotations() { return annotations; }
    public void setAnnotations(List<AnnotationEmbeddable> annotations) { this.annotations = annotations; }

    public String getFiscalBookData() { return fiscalBookData; }
    public void setFiscalBookData(String fiscalBookData) { this.fiscalBookData = fiscalBookData; }

    public int getTransactionCount() { return transactionCount; }
    public void setTransactionCount(int transactionCount) { this.transactionCount = transactionCount; }

    public BigDecimal getTotalIncome() { return totalIncome; }
    public void setTotalIncome(BigDecimal totalIncome) { this.totalIncome = totalIncome; }

    public BigDecimal getTotalExpenses() { return totalExpenses; }
    public void setTotalExpenses(BigDecimal totalExpenses) { this.totalExpenses = totalExpenses; }

    public BigDecimal getNetAmount() { return netAmount; }
    public void setNetAmount(BigDecimal netAmount) { this.netAmount = netAmount; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
