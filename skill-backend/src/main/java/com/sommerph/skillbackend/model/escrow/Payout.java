package com.sommerph.skillbackend.model.escrow;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Payout {

    private long challengeId;
    private String recipientId;
    private BigInteger amount;
    private Instant paidAt;

    public static Payout none(long challengeId, String recipientId, Instant at) {
        return new Payout(challengeId, recipientId, BigInteger.ZERO, at);
    }

}
