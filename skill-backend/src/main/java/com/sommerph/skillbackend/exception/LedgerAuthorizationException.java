package com.sommerph.skillbackend.exception;

/**
 * The caller is not allowed to act on the referenced entity.
 */
public class LedgerAuthorizationException extends LedgerException {

    public LedgerAuthorizationException(String message) {
        super(message);
    }

}
