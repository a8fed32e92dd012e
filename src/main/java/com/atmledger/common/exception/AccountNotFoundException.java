package com.atmledger.common.exception;

/**
 * Thrown when no account is registered under a card number and PIN.
 */
public class AccountNotFoundException extends AtmException {

    public AccountNotFoundException(long cardNumber) {
        super(ErrorKind.INVALID_ARGUMENT, "Account not found for card " + cardNumber);
    }
}
