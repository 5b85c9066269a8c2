package com.sommerph.skillbackend.event;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CredentialMintedEvent {

    private long tokenId;
    private String ownerId;
    private String skillType;
    private int proficiencyLevel;

}
