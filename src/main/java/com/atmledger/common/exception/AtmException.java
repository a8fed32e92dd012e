package com.atmledger.common.exception;

/**
 * Base exception for all teller service failures.
 */
public class AtmException extends RuntimeException {

    private final ErrorKind errorKind;

    public AtmException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public AtmException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
