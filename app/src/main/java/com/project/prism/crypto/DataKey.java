package com.project.prism.crypto;

import com.project.prism.io.ByteEncoding;

import javax.crypto.SecretKey;
import java.security.MessageDigest;
import java.util.Arrays;

/**
 * 256-bit AES data key for one owner's file.
 * <p>
 * Unlike {@link javax.crypto.spec.SecretKeySpec}, {@link #destroy()} zeroes the key bytes.
 * {@link #toString()} never prints key material.
 */
public final class DataKey implements SecretKey, AutoCloseable {

    public static final int LENGTH_BYTES = 32;

    private final byte[] keyBytes;
    private volatile boolean destroyed;

    private DataKey(byte[] keyBytes) {
        this.keyBytes = keyBytes;
    }

    public static DataKey of(byte[] key) {
        if (key == null || key.length != LENGTH_BYTES) {
            throw new IllegalArgumentException("Data key must be exactly " + LENGTH_BYTES + " bytes");
        }
        return new DataKey(key.clone());
    }

    public static DataKey fromHex(String hex) {
        byte[] raw = ByteEncoding.fromHex(hex);
        try {
            return of(raw);
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }

    public String toHex() {
        return ByteEncoding.toHex(keyBytes());
    }

    @Override
    public String getAlgorithm() {
        return "AES";
    }

    @Override
    public String getFormat() {
        return "RAW";
    }

    @Override
    public byte[] getEncoded() {
        return keyBytes().clone();
    }

    private byte[] keyBytes() {
        if (destroyed) {
            throw new IllegalStateException("Key has been destroyed");
        }
        return keyBytes;
    }

    @Override
    public void destroy() {
        Arrays.fill(keyBytes, (byte) 0);
        destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public void close() {
        destroy();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DataKey that) || destroyed || that.destroyed) {
            return false;
        }
        return MessageDigest.isEqual(this.keyBytes, that.keyBytes);
    }

    /**
     * Independent of the key bytes, so it neither leaks them nor changes on {@link #destroy()}.
     */
    @Override
    public int hashCode() {
        return LENGTH_BYTES;
    }

    @Override
    public String toString() {
        return "DataKey{destroyed=" + destroyed + ", bits=" + LENGTH_BYTES * 8 + "}";
    }
}
