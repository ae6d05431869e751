package com.fiscalbook.ledger.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Business fields of a ledger transaction. Live transactions and snapshot copies share this shape.
 */
public record TransactionData(
        Instant transactionDate,
        String transactionPeriod,
        String transactionSource,
        String transactionValue,
        String transactionName,
        String transactionDescription,
        String transactionFiscalNote,
        String transactionId,
        String transactionStatus,
        String transactionLocation,
        String transactionType,
        String transactionInstallments,
        String transactionCategory,
        String freightValue,
        String paymentMethod,
        String companyName,
        String companySellerName,
        String companyCnpj,
        UUID companyId
) {
    public static final String CREDIT = "credit";

    public boolean isCredit() {
        return CREDIT.equals(transactionType);
    }

    public TransactionData withTransactionValue(String newValue) {
        return new TransactionData(
                transactionDate,
                transactionPeriod,
                transactionSource,
                newValue,
                transactionName,
                transactionDescription,
                transactionFiscalNote,
                transactionId,
                transactionStatus,
                transactionLocation,
                transactionType,
                transactionInstallments,
                transactionCategory,
                freightValue,
                paymentMethod,
                companyName,
                companySellerName,
                companyCnpj,
                companyId
        );
    }
}
