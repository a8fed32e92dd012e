package com.atmledger.ledger;

import com.atmledger.common.Money;
import lombok.Value;

/**
 * Immutable entry in an account's transaction history.
 *
 * Records are append-only; the history keeps them in the order they happened.
 */
@Value
public class TransactionRecord {
    TransactionType type;
    Money amount;
    Money updatedBalance;

    public static TransactionRecord deposit(Money amount, Money updatedBalance) {
        return new TransactionRecord(TransactionType.DEPOSIT, amount, updatedBalance);
    }

    public static TransactionRecord withdrawal(Money amount, Money updatedBalance) {
        return new TransactionRecord(TransactionType.WITHDRAWAL, amount, updatedBalance);
    }

    /**
     * Human-readable ledger line, e.g.
     * {@code Deposit - Amount: $40000.00, Updated Balance: $40099.90}.
     */
    public String getDescription() {
        return String.format("%s - Amount: %s, Updated Balance: %s",
            type.getLabel(), amount.format(), updatedBalance.format());
    }
}
