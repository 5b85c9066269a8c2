package com.sommerph.skillbackend.event;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ProofSubmittedEvent {

    private long proofId;
    private long challengeId;
    private String solverId;
    private int score;

}
