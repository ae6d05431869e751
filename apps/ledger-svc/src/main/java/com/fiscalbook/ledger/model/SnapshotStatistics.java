package com.fiscalbook.ledger.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

public record SnapshotStatistics(
        int transactionCount,
        BigDecimal totalIncome,
        BigDecimal totalExpenses,
        BigDecimal netAmount
) {

    public static SnapshotStatistics empty() {
        BigDecimal zero = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        return new SnapshotStatistics(0, zero, zero, zero);
    }

    /**
     * Credits accumulate into income; every other type adds its absolute value to expenses.
     */
    public static SnapshotStatistics of(List<Transaction> transactions) {
        BigDecimal income = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        BigDecimal expenses = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        for (Transaction transaction : transactions) {
            BigDecimal value = MonetaryValues.parse(transaction.data().transactionValue());
            if (transaction.data().isCredit()) {
                income = income.add(value);
            } else {
                expenses = expenses.add(value.abs());
            }
        }
        return new SnapshotStatistics(transactions.size(), income, expenses, income.subtract(expenses));
    }

    public StatisticsDelta deltaTo(SnapshotStatistics current) {
        return new StatisticsDelta(
                current.transactionCount - transactionCount,
                current.totalIncome.subtract(totalIncome),
                current.totalExpenses.subtract(totalExpenses),
                current.netAmount.subtract(netAmount)
        );
    }

    public record StatisticsDelta(
            int transactionCountDiff,
            BigDecimal totalIncomeDiff,
            BigDecimal totalExpensesDiff,
            BigDecimal netAmountDiff
    ) {
    }
}
