package com.sommerph.skillbackend.exception;

public class LedgerStorageException extends RuntimeException {

    public LedgerStorageException(String message, Throwable cause) {
        super(message, cause);
    }

}
