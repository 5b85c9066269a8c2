package com.sommerph.skillbackend.exception;

/**
 * Bad input parameters such as difficulty, time limit or score.
 */
public class LedgerValidationException extends LedgerException {

    public LedgerValidationException(String message) {
        super(message);
    }

}
