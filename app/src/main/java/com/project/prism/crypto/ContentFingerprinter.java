package com.project.prism.crypto;

import org.bouncycastle.crypto.digests.Blake3Digest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * BLAKE3 fingerprints over ciphertext.
 * <p>
 * The fingerprint lets anyone check a downloaded blob against the ledger before
 * decrypting; the GCM tag checked by {@link AuthenticatedCipher} is the backstop
 * that applies even if this check is skipped.
 */
public final class ContentFingerprinter {

    public static final int CHUNK_SIZE = 64 * 1024;

    public Fingerprint hash(byte[] data) {
        Objects.requireNonNull(data, "data must not be null");
        Blake3Digest digest = new Blake3Digest();
        digest.update(data, 0, data.length);
        return finish(digest);
    }

    public Fingerprint hash(EncryptedPayload payload) {
        return hash(payload.toBytes());
    }

    /**
     * Hashes the stream in {@value #CHUNK_SIZE}-byte chunks. The stream is read to the end
     * but not closed. The result equals {@link #hash(byte[])} over the same bytes.
     */
    public Fingerprint hashStream(InputStream source) throws IOException {
        Objects.requireNonNull(source, "source must not be null");
        Blake3Digest digest = new Blake3Digest();
        byte[] chunk = new byte[CHUNK_SIZE];
        int read;
        while ((read = source.read(chunk)) != -1) {
            digest.update(chunk, 0, read);
        }
        return finish(digest);
    }

    public Fingerprint hashFile(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return hashStream(in);
        }
    }

    public boolean verify(byte[] data, Fingerprint expected) {
        Objects.requireNonNull(expected, "expected must not be null");
        return hash(data).matches(expected);
    }

    private static Fingerprint finish(Blake3Digest digest) {
        byte[] out = new byte[Fingerprint.LENGTH_BYTES];
        digest.doFinal(out, 0);
        return Fingerprint.of(out);
    }
}
