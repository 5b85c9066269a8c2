package com.sommerph.skillbackend.event;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ChallengeDeactivatedEvent {

    private long challengeId;
    private String creatorId;

}
