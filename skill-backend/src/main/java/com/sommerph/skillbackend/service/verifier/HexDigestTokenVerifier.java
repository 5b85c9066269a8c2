package com.sommerph.skillbackend.service.verifier;

import java.util.regex.Pattern;

/**
 * Accepts tokens shaped like the proof generator's output: a 64 character lower case hex digest.
 */
public class HexDigestTokenVerifier implements ProofVerifier {

    private static final Pattern HEX_DIGEST = Pattern.compile("[0-9a-f]{64}");

    @Override
    public boolean verify(String externalProofToken) {
        return externalProofToken != null && HEX_DIGEST.matcher(externalProofToken).matches();
    }

}
