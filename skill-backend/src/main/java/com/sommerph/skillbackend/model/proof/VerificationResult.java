package com.sommerph.skillbackend.model.proof;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Outcome of a single verification attempt. A rejected attempt carries only the proof id;
 * an accepted one also reports the credential it produced and the reward paid.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VerificationResult {

    private long proofId;
    private boolean verified;
    private long tokenId;
    private boolean minted;
    private int proficiencyLevel;
    private int verificationCount;
    private BigInteger payoutAmount;

    public static VerificationResult rejected(long proofId) {
        return new VerificationResult(proofId, false, 0L, false, 0, 0, BigInteger.ZERO);
    }

}
