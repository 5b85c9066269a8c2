package com.sommerph.skillbackend.util;

import org.bouncycastle.crypto.digests.KeccakDigest;
import org.bouncycastle.util.encoders.Hex;

import java.nio.ByteBuffer;

public class DigestUtils {

    private DigestUtils() {
    }

    public static byte[] keccak256(byte[] input) {
        KeccakDigest digest = new KeccakDigest(256);
        digest.update(input, 0, input.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }

    // Ethereum style: 0x followed by the low 20 bytes of the hash
    public static String toAddress(byte[] hash) {
        return "0x" + Hex.toHexString(hash, hash.length - 20, 20);
    }

    public static byte[] packLongs(long... values) {
        ByteBuffer buffer = ByteBuffer.allocate(Long.BYTES * values.length);
        for (long value : values) {
            buffer.putLong(value);
        }
        return buffer.array();
    }

}
