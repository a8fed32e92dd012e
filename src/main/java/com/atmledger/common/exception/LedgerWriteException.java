package com.atmledger.common.exception;

/**
 * Thrown when a ledger document cannot be written.
 */
public class LedgerWriteException extends AtmException {

    public LedgerWriteException(String destination, Throwable cause) {
        super(ErrorKind.LEDGER_IO, "Failed to write ledger to " + destination, cause);
    }
}
