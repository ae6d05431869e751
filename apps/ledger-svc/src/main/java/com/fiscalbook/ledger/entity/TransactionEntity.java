package com.fiscalbook.ledger.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "transactions")
public class TransactionEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "fiscal_book_id", nullable = false)
    private UUID fiscalBookId;

    @Column(name = "transaction_date")
    private Instant transactionDate;

    // JSON document of the business fields
    @Column(name = "transaction_data", nullable = false, columnDefinition = "text")
    private String transactionData;

    public TransactionEntity() {}

    public TransactionEntity(UUID id, UUID fiscalBookId, Instant transactionDate, String transactionData) {
        this.id = id;
        this.fiscalBookId = fiscalBookId;
        this.transactionDate = transactionDate;
        this.transactionData = transactionData;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getFiscalBookId() { return fiscalBookId; }
    public void setFiscalBookId(UUID fiscalBookId) { this.fiscalBookId = fiscalBookId; }

    public Instant getTransactionDate() { return transactionDate; }
    public void setTransactionDate(Instant transactionDate) { this.transactionDate = transactionDate; }

    public String getTransactionData() { return transactionData; }
    public void setTransactionData(String transactionData) { this.transactionData = transactionData; }
}
