package com.sommerph.skillbackend.model.challenge;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Challenge {

    private long id;

    // Normalized skill tag, becomes the credential skill type
    private String challengeType;

    private int difficulty;

    // Seconds
    private long timeLimit;

    private BigInteger rewardAmount;

    private boolean active;

    private String creatorId;

    // Opaque digest of the generated challenge content
    private String contentDigest;

    private Instant createdAt;

    public Challenge copy() {
        return new Challenge(id, challengeType, difficulty, timeLimit, rewardAmount, active,
                creatorId, contentDigest, createdAt);
    }

}
