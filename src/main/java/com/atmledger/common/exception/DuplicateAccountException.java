package com.atmledger.common.exception;

/**
 * Thrown when registering a card number and PIN that already have an account.
 */
public class DuplicateAccountException extends AtmException {

    public DuplicateAccountException(long cardNumber) {
        super(ErrorKind.INVALID_ARGUMENT, "Account already exists for card " + cardNumber);
    }
}
