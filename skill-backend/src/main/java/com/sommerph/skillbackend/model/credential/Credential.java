package com.sommerph.skillbackend.model.credential;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Credential {

    private long tokenId;

    private String ownerId;

    private String skillType;

    // 1..10
    private int proficiencyLevel;

    private int verificationCount;

    private Instant createdAt;
    private Instant updatedAt;

    // Contributing solution digests in verification order
    private List<String> solutionDigests = new ArrayList<>();

    public void addSolutionDigest(String digest) {
        this.solutionDigests.add(digest);
    }

    public Credential copy() {
        return new Credential(tokenId, ownerId, skillType, proficiencyLevel, verificationCount,
                createdAt, updatedAt, new ArrayList<>(solutionDigests));
    }

}
