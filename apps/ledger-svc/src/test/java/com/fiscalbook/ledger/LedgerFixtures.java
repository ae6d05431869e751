package com.fiscalbook.ledger;

import com.fiscalbook.ledger.model.FiscalBook;
import com.fiscalbook.ledger.model.FiscalBookStatus;
import com.fiscalbook.ledger.model.FiscalData;
import com.fiscalbook.ledger.model.Transaction;
import com.fiscalbook.ledger.model.TransactionData;
import java.time.Instant;
import java.util.UUID;

public final class LedgerFixtures {

    public static final Instant CREATED = Instant.parse("2024-01-10T09:00:00Z");

    private LedgerFixtures() {
    }

    public static FiscalBook book(UUID id, String name) {
        return new FiscalBook(
                id,
                name,
                "entrada",
                "2024-01",
                "REF-" + name,
                FiscalBookStatus.OPEN,
                new FiscalData("Receita Federal", 2024, "2024-01", "simples", null, null),
                UUID.fromString("00000000-0000-0000-0000-0000000000c1"),
                "notes for " + name,
                CREATED,
                CREATED,
                null
        );
    }

    public static Transaction credit(UUID bookId, String name, String value) {
        return new Transaction(UUID.randomUUID(), bookId, data(name, value, "credit", Instant.parse("2024-01-15T12:00:00Z")));
    }

    public static Transaction debit(UUID bookId, String name, String value) {
        return new Transaction(UUID.randomUUID(), bookId, data(name, value, "debit", Instant.parse("2024-01-16T12:00:00Z")));
    }

    public static TransactionData data(String name, String value, String type, Instant date) {
        return new TransactionData(
                date,
                "2024-01",
                "manual",
                value,
                name,
                name + " description",
                "NF-" + name,
                "EXT-" + name,
                "paid",
                "Sao Paulo",
                type,
                "1",
                "services",
                "0",
                "pix",
                "Acme",
                "Acme Seller",
                "12.345.678/0001-90",
                null
        );
    }
}
