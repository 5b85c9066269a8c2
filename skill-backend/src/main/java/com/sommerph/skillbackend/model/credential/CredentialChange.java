package com.sommerph.skillbackend.model.credential;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CredentialChange {

    private Credential credential;

    // true when the credential was created by this change
    private boolean minted;

    // 0 on mint
    private int previousLevel;

}
