package com.sommerph.skillbackend.exception;

/**
 * The referenced entity is in the wrong lifecycle state for the operation.
 */
public class LedgerStateException extends LedgerException {

    public LedgerStateException(String message) {
        super(message);
    }

}
