package com.atmledger.ledger;

/**
 * Kinds of cash movement recorded in an account's transaction history.
 */
public enum TransactionType {
    /**
     * Cash paid into the account.
     */
    DEPOSIT("Deposit"),

    /**
     * Cash taken out of the account.
     */
    WITHDRAWAL("Withdrawal");

    private final String label;

    TransactionType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
