package com.atmledger.common;

import lombok.Value;

/**
 * Composite lookup key for an account: card number plus PIN.
 *
 * Both parts are unsigned integers and must match exactly on lookup.
 */
@Value
public class AccountKey {
    long cardNumber;
    long pin;

    private AccountKey(long cardNumber, long pin) {
        this.cardNumber = cardNumber;
        this.pin = pin;
    }

    public static AccountKey of(long cardNumber, long pin) {
        if (cardNumber < 0) {
            throw new IllegalArgumentException("Card number cannot be negative: " + cardNumber);
        }
        if (pin < 0) {
            throw new IllegalArgumentException("PIN cannot be negative");
        }
        return new AccountKey(cardNumber, pin);
    }

    @Override
    public String toString() {
        // PIN stays out of log lines and exception messages
        return "AccountKey(cardNumber=" + cardNumber + ")";
    }
}
