package com.sommerph.skillbackend.event;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigInteger;

@Data
@AllArgsConstructor
public class ProofVerifiedEvent {

    private long proofId;
    private long challengeId;
    private String solverId;
    private long tokenId;
    private BigInteger payoutAmount;

}
