package com.sommerph.skillbackend.model.escrow;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EscrowAccount {

    private long challengeId;

    private BigInteger heldBalance;

    private BigInteger totalPaidOut;

    private int payoutCount;

    public EscrowAccount copy() {
        return new EscrowAccount(challengeId, heldBalance, totalPaidOut, payoutCount);
    }

}
