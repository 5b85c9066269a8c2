package com.sommerph.skillbackend.model.account;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Informational account identifier derived for a credential. It depends on the derivation time,
 * so two derivations for the same token give different accounts. Nothing is persisted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BoundAccount {

    private long tokenId;
    private String ownerId;
    private String account;
    private Instant derivedAt;

}
