package com.sommerph.skillbackend.controller;

import com.sommerph.skillbackend.exception.LedgerAuthorizationException;
import com.sommerph.skillbackend.exception.LedgerException;
import com.sommerph.skillbackend.exception.LedgerResourceException;
import com.sommerph.skillbackend.exception.LedgerStateException;
import com.sommerph.skillbackend.exception.LedgerValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * Maps ledger rejections onto HTTP responses.
 */
final class LedgerResponses {

    private LedgerResponses() {
    }

    static ResponseEntity<?> rejected(LedgerException e) {
        HttpStatus status;
        if (e instanceof LedgerValidationException) {
            status = HttpStatus.BAD_REQUEST;
        } else if (e instanceof LedgerAuthorizationException) {
            status = HttpStatus.FORBIDDEN;
        } else if (e instanceof LedgerStateException) {
            status = HttpStatus.CONFLICT;
        } else if (e instanceof LedgerResourceException) {
            status = HttpStatus.UNPROCESSABLE_ENTITY;
        } else {
            status = HttpStatus.BAD_REQUEST;
        }
        return ResponseEntity.status(status).body(Map.of(
                "error", e.getClass().getSimpleName(),
                "message", e.getMessage()));
    }

}
