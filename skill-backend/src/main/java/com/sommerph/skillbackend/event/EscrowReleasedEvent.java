package com.sommerph.skillbackend.event;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigInteger;

@Data
@AllArgsConstructor
public class EscrowReleasedEvent {

    private long challengeId;
    private String recipientId;
    private BigInteger amount;
    private BigInteger remainingBalance;

}
