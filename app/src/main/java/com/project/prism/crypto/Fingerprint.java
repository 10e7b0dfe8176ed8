package com.project.prism.crypto;

import com.project.prism.io.ByteEncoding;

import java.security.MessageDigest;
import java.util.Arrays;

/**
 * BLAKE3-256 digest of a stored payload.
 * The ledger keeps it as lowercase hex without a prefix.
 */
public final class Fingerprint {

    public static final int LENGTH_BYTES = 32;

    private final byte[] digest;

    private Fingerprint(byte[] digest) {
        this.digest = digest;
    }

    public static Fingerprint of(byte[] digest) {
        if (digest == null || digest.length != LENGTH_BYTES) {
            throw new IllegalArgumentException("Fingerprint must be exactly " + LENGTH_BYTES + " bytes");
        }
        return new Fingerprint(digest.clone());
    }

    public static Fingerprint fromHex(String hex) {
        return of(ByteEncoding.fromHex(hex));
    }

    public byte[] bytes() {
        return digest.clone();
    }

    public String toHex() {
        return ByteEncoding.toHex(digest);
    }

    public String abbreviated() {
        return ByteEncoding.abbreviate(toHex(), 16);
    }

    /**
     * Constant-time comparison.
     */
    public boolean matches(Fingerprint other) {
        return other != null && MessageDigest.isEqual(digest, other.digest);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Fingerprint that && Arrays.equals(digest, that.digest);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(digest);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
