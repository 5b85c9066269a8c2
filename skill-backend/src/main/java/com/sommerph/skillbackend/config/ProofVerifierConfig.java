package com.sommerph.skillbackend.config;

import com.sommerph.skillbackend.service.verifier.HexDigestTokenVerifier;
import com.sommerph.skillbackend.service.verifier.NonEmptyTokenVerifier;
import com.sommerph.skillbackend.service.verifier.ProofVerifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ProofVerifierConfig {

    private final LedgerProperties properties;

    public ProofVerifierConfig(LedgerProperties properties) {
        this.properties = properties;
    }

    @Bean
    public ProofVerifier proofVerifier() {
        String verifierType = properties.getVerifier().getType();
        return switch (verifierType.toLowerCase()) {
            case "non-empty" -> new NonEmptyTokenVerifier();
            case "hex-digest" -> new HexDigestTokenVerifier();
            default -> throw new IllegalArgumentException("Unsupported proof verifier type: " + verifierType);
        };
    }

}
