package com.sommerph.skillbackend.service.verifier;

import lombok.extern.slf4j.Slf4j;

/**
 * Accepts any token that is not blank and not an all-zero value (an optional {@code 0x} prefix
 * is ignored). Stand-in for a real proof system.
 */
@Slf4j
public class NonEmptyTokenVerifier implements ProofVerifier {

    @Override
    public boolean verify(String externalProofToken) {
        if (externalProofToken == null || externalProofToken.isBlank()) {
            return false;
        }
        String body = externalProofToken.trim();
        if (body.startsWith("0x") || body.startsWith("0X")) {
            body = body.substring(2);
        }
        boolean valid = !body.isEmpty() && !body.chars().allMatch(c -> c == '0');
        log.debug("Token verdict: {}", valid);
        return valid;
    }

}
