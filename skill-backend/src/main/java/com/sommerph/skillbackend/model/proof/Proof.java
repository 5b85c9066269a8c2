package com.sommerph.skillbackend.model.proof;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Proof {

    private long id;
    private long challengeId;
    private String solverId;

    // Seconds taken by the solver
    private long completionTime;
    private int score;

    private String solutionDigest;

    // Handed to the verifier oracle as is
    private String externalProofToken;

    private boolean verified;

    private Instant submittedAt;
    private Instant verifiedAt;

    public Proof copy() {
        return new Proof(id, challengeId, solverId, completionTime, score, solutionDigest,
                externalProofToken, verified, submittedAt, verifiedAt);
    }

}
