package com.fiscalbook.ledger.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "fiscal_books")
public class FiscalBookEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "book_name", nullable = false)
    private String bookName;

    @Column(name = "book_type")
    private String bookType;

    @Column(name = "book_period")
    private String bookPeriod;

    @Column(name = "reference")
    private String reference;

    @Column(name = "status", nullable = false, length = 32)
    private String status;

    // JSON document of the fiscal sub-record
    @Column(name = "fiscal_data", columnDefinition = "text")
    private String fiscalData;

    @Column(name = "company_id")
    private UUID companyId;

    @Column(name = "notes", columnDefinition = "text")
    private String notes;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    public FiscalBookEntity() {}

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getBookName() { return bookName; }
    public void setBookName(String bookName) { this.bookName = bookName; }

    public String getBookType() { return bookType; }
    public void setBookType(String bookType) { this.bookType = bookType; }

    public String getBookPeriod() { return bookPeriod; }
    public void setBookPeriod(String bookPeriod) { this.bookPeriod = bookPeriod; }

    public String getReference() { return reference; }
    public void setReference(String reference) { this.reference = reference; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getFiscalData() { return fiscalData; }
    public void setFiscalData(String fiscalData) { this.fiscalData = fiscalData; }

    public UUID getCompanyId() { return companyId; }
    public void setCompanyId(UUID companyId) { this.companyId = companyId; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public Instant getClosedAt() { return closedAt; }
    public void setClosedAt(Instant closedAt) { this.closedAt = closedAt; }
}
