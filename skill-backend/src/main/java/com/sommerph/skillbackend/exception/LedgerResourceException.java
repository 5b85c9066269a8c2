package com.sommerph.skillbackend.exception;

/**
 * Insufficient funding or escrow balance.
 */
public class LedgerResourceException extends LedgerException {

    public LedgerResourceException(String message) {
        super(message);
    }

}
