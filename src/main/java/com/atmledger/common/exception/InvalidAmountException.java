package com.atmledger.common.exception;

import com.atmledger.common.Money;

/**
 * Thrown when a deposit or withdrawal amount is negative.
 */
public class InvalidAmountException extends AtmException {

    public InvalidAmountException(String operation, Money amount) {
        super(ErrorKind.INVALID_ARGUMENT,
            String.format("%s amount cannot be negative: %s", operation, amount.getAmount().toPlainString()));
    }
}
