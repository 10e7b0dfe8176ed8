package com.project.prism.keystore;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.project.prism.io.ByteEncoding;

import java.util.Objects;

/**
 * One owner's wrapped data key: PBKDF2 salt, GCM nonce and the wrapped key with its tag, all hex.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeystoreEntry(
        @JsonProperty("salt") String salt,
        @JsonProperty("nonce") String nonce,
        @JsonProperty("encrypted_key") String encryptedKey
) {
    @JsonCreator
    public KeystoreEntry {
        Objects.requireNonNull(salt, "salt must not be null");
        Objects.requireNonNull(nonce, "nonce must not be null");
        Objects.requireNonNull(encryptedKey, "encryptedKey must not be null");
    }

    static KeystoreEntry of(byte[] salt, byte[] nonce, byte[] encryptedKey) {
        return new KeystoreEntry(ByteEncoding.toHex(salt), ByteEncoding.toHex(nonce), ByteEncoding.toHex(encryptedKey));
    }

    byte[] saltBytes() {
        return ByteEncoding.fromHex(salt);
    }

    byte[] nonceBytes() {
        return ByteEncoding.fromHex(nonce);
    }

    byte[] encryptedKeyBytes() {
        return ByteEncoding.fromHex(encryptedKey);
    }
}
