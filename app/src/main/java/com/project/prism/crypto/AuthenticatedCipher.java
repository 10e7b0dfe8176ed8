package com.project.prism.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

/**
 * AES-256-GCM over whole buffers.
 * <p>
 * Every call to {@link #encrypt} draws a fresh 96-bit nonce from {@link SecureRandom};
 * callers can never supply one.
 */
public final class AuthenticatedCipher {
    private static final Logger LOG = LoggerFactory.getLogger(AuthenticatedCipher.class);

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_BITS = EncryptedPayload.TAG_BYTES * 8;

    private final SecureRandom random;

    public AuthenticatedCipher() {
        this(new SecureRandom());
    }

    public AuthenticatedCipher(SecureRandom random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public DataKey generateKey() {
        byte[] raw = new byte[DataKey.LENGTH_BYTES];
        random.nextBytes(raw);
        try {
            return DataKey.of(raw);
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }

    public EncryptedPayload encrypt(byte[] plaintext, DataKey key) {
        Objects.requireNonNull(plaintext, "plaintext must not be null");
        Objects.requireNonNull(key, "key must not be null");

        byte[] nonce = new byte[EncryptedPayload.NONCE_BYTES];
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, aesKey(key), new GCMParameterSpec(GCM_TAG_BITS, nonce));
            return EncryptedPayload.assemble(nonce, cipher.doFinal(plaintext));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption unavailable", e);
        }
    }

    /**
     * @throws AuthenticationFailedException if the tag does not verify; no plaintext is returned
     */
    public byte[] decrypt(EncryptedPayload payload, DataKey key) throws AuthenticationFailedException {
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(key, "key must not be null");
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, aesKey(key), new GCMParameterSpec(GCM_TAG_BITS, payload.nonce()));
            return cipher.doFinal(payload.ciphertextAndTag());
        } catch (AEADBadTagException e) {
            throw new AuthenticationFailedException(
                    "Authentication failed during decryption: wrong key or tampered ciphertext", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM decryption unavailable", e);
        }
    }

    /**
     * Encrypts {@code input} into {@code output} and returns the fingerprint of what was written.
     */
    public Fingerprint encryptFile(Path input, Path output, DataKey key, ContentFingerprinter fingerprinter)
            throws IOException {
        EncryptedPayload payload = encrypt(Files.readAllBytes(input), key);
        byte[] wire = payload.toBytes();
        Files.write(output, wire);
        Fingerprint fingerprint = fingerprinter.hash(wire);
        LOG.info("Encrypted {} -> {} ({} bytes, fingerprint {})",
                input.getFileName(), output.getFileName(), wire.length, fingerprint.abbreviated());
        return fingerprint;
    }

    /**
     * Decrypts {@code input} into {@code output}. The output file only appears once the tag verified.
     */
    public void decryptFile(Path input, Path output, DataKey key) throws IOException, AuthenticationFailedException {
        EncryptedPayload payload = EncryptedPayload.of(Files.readAllBytes(input));
        byte[] plaintext = decrypt(payload, key);
        Path parent = output.toAbsolutePath().getParent();
        Path temp = Files.createTempFile(parent, ".decrypt-", ".tmp");
        try {
            Files.write(temp, plaintext);
            Files.move(temp, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Arrays.fill(plaintext, (byte) 0);
            Files.deleteIfExists(temp);
        }
    }

    private static SecretKeySpec aesKey(DataKey key) {
        byte[] raw = key.getEncoded();
        try {
            return new SecretKeySpec(raw, "AES");
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }
}
