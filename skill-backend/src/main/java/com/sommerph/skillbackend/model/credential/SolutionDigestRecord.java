package com.sommerph.skillbackend.model.credential;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit entry written once per verified proof applied to a credential. Proof and
 * challenge ids are 0 when the proof was applied directly rather than through verification.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SolutionDigestRecord {

    private long id;
    private long tokenId;
    private long proofId;
    private long challengeId;
    private String solverId;
    private String solutionDigest;
    private int score;
    private Instant recordedAt;

}
