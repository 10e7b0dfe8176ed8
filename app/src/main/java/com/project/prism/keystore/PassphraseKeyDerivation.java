package com.project.prism.keystore;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Objects;

/**
 * PBKDF2-HMAC-SHA256 wrapping-key derivation for keystore entries.
 * The iteration count is fixed; entries written with a different count could not be read back.
 */
public final class PassphraseKeyDerivation {

    public static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    public static final int ITERATIONS = 600_000;
    public static final int KEY_BITS = 256;
    public static final int SALT_BYTES = 16;

    private PassphraseKeyDerivation() {
    }

    public static SecretKeySpec derive(char[] passphrase, byte[] salt) {
        Objects.requireNonNull(passphrase, "passphrase must not be null");
        Objects.requireNonNull(salt, "salt must not be null");
        if (salt.length < SALT_BYTES) {
            throw new IllegalArgumentException("salt must be at least " + SALT_BYTES + " bytes");
        }
        PBEKeySpec spec = new PBEKeySpec(passphrase, salt, ITERATIONS, KEY_BITS);
        byte[] derived = null;
        try {
            derived = SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
            return new SecretKeySpec(derived, "AES");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " unavailable", e);
        } finally {
            spec.clearPassword();
            if (derived != null) {
                Arrays.fill(derived, (byte) 0);
            }
        }
    }
}
