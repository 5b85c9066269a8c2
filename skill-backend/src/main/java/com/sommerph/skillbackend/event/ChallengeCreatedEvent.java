package com.sommerph.skillbackend.event;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigInteger;

@Data
@AllArgsConstructor
public class ChallengeCreatedEvent {

    private long challengeId;
    private String creatorId;
    private String challengeType;
    private BigInteger rewardAmount;
    private BigInteger escrowedAmount;

}
