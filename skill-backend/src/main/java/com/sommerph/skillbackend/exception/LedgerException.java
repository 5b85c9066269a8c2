package com.sommerph.skillbackend.exception;

/**
 * Base type for every rejection raised by the ledger. A rejected operation leaves
 * the ledger state exactly as it was before the call.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

}
