package com.sommerph.skillbackend.event;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ProofRejectedEvent {

    private long proofId;
    private long challengeId;
    private String solverId;

}
