package com.sommerph.skillbackend.service.verifier;

/**
 * External proof oracle. The ledger only consumes the verdict; it never inspects the token.
 * Implementations must not mutate ledger state and may block.
 */
public interface ProofVerifier {

    boolean verify(String externalProofToken);

}
