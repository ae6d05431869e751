package com.fiscalbook.ledger.snapshot;

import com.fiscalbook.ledger.exception.ResourceNotFoundException;
import com.fiscalbook.ledger.model.FiscalBookSnapshot;
import com.fiscalbook.ledger.model.SnapshotStatistics;
import com.fiscalbook.ledger.model.SnapshotTransaction;
import com.fiscalbook.ledger.model.Transaction;
import com.fiscalbook.ledger.model.TransactionData;
import com.fiscalbook.ledger.repository.SnapshotStore;
import com.fiscalbook.ledger.repository.TransactionRepository;
import com.fiscalbook.ledger.repository.UnitOfWorkRunner;
import com.fiscalbook.ledger.snapshot.SnapshotComparison.Counts;
import com.fiscalbook.ledger.snapshot.SnapshotComparison.FieldChange;
import com.fiscalbook.ledger.snapshot.SnapshotComparison.ModifiedTransaction;
import com.fiscalbook.ledger.snapshot.SnapshotComparison.Summary;
import com.fiscalbook.ledger.snapshot.SnapshotComparison.TransactionEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

@Service
public class SnapshotComparator {

    /**
     * Business fields checked for modification, in reporting order.
     */
    static final Map<String, Function<TransactionData, Object>> COMPARED_FIELDS;

    static {
        Map<String, Function<TransactionData, Object>> fields = new LinkedHashMap<>();
        fields.put("transactionValue", TransactionData::transactionValue);
        fields.put("transactionName", TransactionData::transactionName);
        fields.put("transactionDescription", TransactionData::transactionDescription);
        fields.put("transactionStatus", TransactionData::transactionStatus);
        fields.put("transactionType", TransactionData::transactionType);
        fields.put("transactionCategory", TransactionData::transactionCategory);
        fields.put("paymentMethod", TransactionData::paymentMethod);
        COMPARED_FIELDS = Collections.unmodifiableMap(fields);
    }

    private final UnitOfWorkRunner unitOfWorkRunner;
    private final SnapshotStore snapshotStore;
    private final TransactionRepository transactionRepository;

    public SnapshotComparator(UnitOfWorkRunner unitOfWorkRunner,
                              SnapshotStore snapshotStore,
                              TransactionRepository transactionRepository) {
        this.unitOfWorkRunner = unitOfWorkRunner;
        this.snapshotStore = snapshotStore;
        this.transactionRepository = transactionRepository;
    }

    public SnapshotComparison compare(UUID snapshotId) {
        return unitOfWorkRunner.readOnly(uow -> {
            FiscalBookSnapshot snapshot = snapshotStore.findSnapshotById(uow, snapshotId)
                    .orElseThrow(() -> ResourceNotFoundException.snapshot(snapshotId));
            List<SnapshotTransaction> copies = snapshotStore.findSnapshotTransactions(uow, snapshotId);
            List<Transaction> current = transactionRepository.findByFiscalBookId(uow, snapshot.originalFiscalBookId());
            return compare(snapshot, copies, current);
        });
    }

    static SnapshotComparison compare(FiscalBookSnapshot snapshot, List<SnapshotTransaction> copies, List<Transaction> current) {
        Map<UUID, SnapshotTransaction> recorded = new HashMap<>();
        for (SnapshotTransaction copy : copies) {
            if (copy.originalTransactionId() != null) {
                recorded.put(copy.originalTransactionId(), copy);
            }
        }
        Set<UUID> liveIds = current.stream().map(Transaction::id).collect(Collectors.toSet());

        List<TransactionEntry> added = new ArrayList<>();
        List<ModifiedTransaction> modified = new ArrayList<>();
        List<TransactionEntry> unchanged = new ArrayList<>();
        for (Transaction live : current) {
            SnapshotTransaction copy = recorded.get(live.id());
            if (copy == null) {
                added.add(new TransactionEntry(live.id(), live.data()));
                continue;
            }
            List<FieldChange> changes = detectChanges(copy.transactionData(), live.data());
            if (changes.isEmpty()) {
                unchanged.add(new TransactionEntry(live.id(), live.data()));
            } else {
                modified.add(new ModifiedTransaction(live.id(), copy.transactionData(), live.data(), changes));
            }
        }

        List<TransactionEntry> removed = new ArrayList<>();
        for (SnapshotTransaction copy : copies) {
            if (copy.originalTransactionId() != null && !liveIds.contains(copy.originalTransactionId())) {
                removed.add(new TransactionEntry(copy.originalTransactionId(), copy.transactionData()));
            }
        }

        SnapshotStatistics currentStats = SnapshotStatistics.of(current);
        return new SnapshotComparison(
                snapshot.id(),
                snapshot.snapshotName(),
                snapshot.createdAt(),
                snapshot.originalFiscalBookId(),
                List.copyOf(added),
                List.copyOf(removed),
                List.copyOf(modified),
                List.copyOf(unchanged),
                new Counts(added.size(), removed.size(), modified.size(), unchanged.size()),
                new Summary(snapshot.statistics(), currentStats, snapshot.statistics().deltaTo(currentStats))
        );
    }

    static List<FieldChange> detectChanges(TransactionData recorded, TransactionData live) {
        List<FieldChange> changes = new ArrayList<>();
        COMPARED_FIELDS.forEach((field, accessor) -> {
            String oldValue = comparable(recorded == null ? null : accessor.apply(recorded));
            String newValue = comparable(live == null ? null : accessor.apply(live));
            if (!oldValue.equals(newValue)) {
                changes.add(new FieldChange(field, oldValue, newValue));
            }
        });
        return changes;
    }

    private static String comparable(Object value) {
        return value == null ? "" : value.toString().trim();
    }
}
