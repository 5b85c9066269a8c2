package com.sommerph.skillbackend.event;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CredentialUpdatedEvent {

    private long tokenId;
    private String ownerId;
    private String skillType;
    private int previousLevel;
    private int proficiencyLevel;
    private int verificationCount;

}
