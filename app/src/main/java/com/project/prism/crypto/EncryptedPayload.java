package com.project.prism.crypto;

import java.util.Arrays;

/**
 * Stored blob layout: {@code nonce(12) || ciphertext || tag(16)}.
 * <p>
 * This is the exact byte sequence that goes to the blob store and gets fingerprinted.
 * Any reader treats the first 12 bytes as the nonce and the last 16 as the GCM tag.
 */
public final class EncryptedPayload {

    public static final int NONCE_BYTES = 12;
    public static final int TAG_BYTES = 16;
    public static final int MIN_LENGTH = NONCE_BYTES + TAG_BYTES;

    private final byte[] bytes;

    private EncryptedPayload(byte[] bytes) {
        this.bytes = bytes;
    }

    public static EncryptedPayload of(byte[] wireBytes) {
        if (wireBytes == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        if (wireBytes.length < MIN_LENGTH) {
            throw new IllegalArgumentException(String.format(
                    "payload too short: expected at least %d bytes, got %d", MIN_LENGTH, wireBytes.length));
        }
        return new EncryptedPayload(wireBytes.clone());
    }

    static EncryptedPayload assemble(byte[] nonce, byte[] ciphertextAndTag) {
        byte[] wire = new byte[nonce.length + ciphertextAndTag.length];
        System.arraycopy(nonce, 0, wire, 0, nonce.length);
        System.arraycopy(ciphertextAndTag, 0, wire, nonce.length, ciphertextAndTag.length);
        return new EncryptedPayload(wire);
    }

    public byte[] nonce() {
        return Arrays.copyOfRange(bytes, 0, NONCE_BYTES);
    }

    /**
     * Ciphertext with the tag still appended, the shape {@code AES/GCM} expects on decrypt.
     */
    byte[] ciphertextAndTag() {
        return Arrays.copyOfRange(bytes, NONCE_BYTES, bytes.length);
    }

    public byte[] tag() {
        return Arrays.copyOfRange(bytes, bytes.length - TAG_BYTES, bytes.length);
    }

    public int ciphertextLength() {
        return bytes.length - MIN_LENGTH;
    }

    public int length() {
        return bytes.length;
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof EncryptedPayload that && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "EncryptedPayload{length=" + bytes.length + "}";
    }
}
