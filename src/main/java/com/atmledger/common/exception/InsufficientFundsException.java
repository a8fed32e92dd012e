package com.atmledger.common.exception;

import com.atmledger.common.Money;

/**
 * Thrown when a withdrawal exceeds the account balance.
 */
public class InsufficientFundsException extends AtmException {

    public InsufficientFundsException(long cardNumber, Money required, Money available) {
        super(ErrorKind.INSUFFICIENT_FUNDS,
            String.format("Insufficient funds for card %d. Required: %s, Available: %s",
                cardNumber, required.format(), available.format()));
    }
}
