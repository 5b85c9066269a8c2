package com.sommerph.skillbackend.repository.ledger;

/**
 * Tables with their own id sequence. Ids start at 1; 0 means "none".
 */
public enum LedgerTable {
    CHALLENGE,
    PROOF,
    CREDENTIAL,
    SOLUTION_DIGEST
}
