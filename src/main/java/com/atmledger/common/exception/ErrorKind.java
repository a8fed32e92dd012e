package com.atmledger.common.exception;

/**
 * Closed set of failure categories surfaced by the teller service.
 */
public enum ErrorKind {
    /**
     * The request itself is wrong: duplicate registration, unknown card/PIN pair,
     * or a negative cash amount.
     */
    INVALID_ARGUMENT,

    /**
     * The request is well-formed but the account state cannot satisfy it.
     */
    INSUFFICIENT_FUNDS,

    /**
     * The ledger document could not be written to its destination.
     */
    LEDGER_IO
}
