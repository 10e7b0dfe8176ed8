package com.project.prism.core;

import com.project.prism.crypto.AuthenticatedCipher;
import com.project.prism.crypto.AuthenticationFailedException;
import com.project.prism.crypto.ContentFingerprinter;
import com.project.prism.crypto.DataKey;
import com.project.prism.crypto.EncryptedPayload;
import com.project.prism.crypto.Fingerprint;
import com.project.prism.crypto.IntegrityException;
import com.project.prism.crypto.TamperDetectedException;
import com.project.prism.ipfs.BlobStore;
import com.project.prism.ipfs.BlobStoreException;
import com.project.prism.ledger.AccessLedger;
import com.project.prism.ledger.GenomicRecordPointer;
import com.project.prism.ledger.LedgerUnavailableException;
import com.project.prism.ledger.OwnerId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Objects;

/**
 * Requester-side pipeline: read the pointer, fetch the blob, check its fingerprint, decrypt.
 * Each step fails closed; nothing is decrypted until the fingerprint matches.
 */
public class RetrieveService {
    private static final Logger LOG = LoggerFactory.getLogger(RetrieveService.class);

    private final AuthenticatedCipher cipher;
    private final ContentFingerprinter fingerprinter;
    private final BlobStore blobStore;
    private final AccessLedger ledger;

    public RetrieveService(AuthenticatedCipher cipher, ContentFingerprinter fingerprinter,
                           BlobStore blobStore, AccessLedger ledger) {
        this.cipher = Objects.requireNonNull(cipher, "cipher must not be null");
        this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter must not be null");
        this.blobStore = Objects.requireNonNull(blobStore, "blobStore must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
    }

    /**
     * @return the plaintext, only after both the fingerprint and the GCM tag verified
     * @throws TamperDetectedException         if the blob does not hash to the ledger fingerprint
     * @throws AuthenticationFailedException   if the key is wrong or the ciphertext was altered
     * @throws com.project.prism.ledger.NotAuthorizedException if {@code caller} may not read the pointer
     */
    public byte[] retrieve(OwnerId owner, OwnerId caller, DataKey key)
            throws LedgerUnavailableException, BlobStoreException, IntegrityException {
        Objects.requireNonNull(key, "key must not be null");
        GenomicRecordPointer pointer = ledger.readPointer(owner, caller);
        byte[] blob = blobStore.get(pointer.contentId());
        requireIntact(pointer, blob);

        EncryptedPayload payload;
        try {
            payload = EncryptedPayload.of(blob);
        } catch (IllegalArgumentException e) {
            throw new AuthenticationFailedException("Blob " + pointer.contentId() + " is not a valid payload", e);
        }
        byte[] plaintext = cipher.decrypt(payload, key);
        LOG.info("{} retrieved {} bytes of {}'s data (cid={})", caller, plaintext.length, owner, pointer.contentId());
        return plaintext;
    }

    /**
     * Downloads and checks the blob without a key.
     */
    public IntegrityReport verify(OwnerId owner, OwnerId caller) throws LedgerUnavailableException, BlobStoreException {
        GenomicRecordPointer pointer = ledger.readPointer(owner, caller);
        byte[] blob = blobStore.get(pointer.contentId());
        Fingerprint actual = fingerprinter.hash(blob);
        boolean verified = actual.matches(pointer.fingerprint());
        IntegrityReport report = new IntegrityReport(pointer.contentId(), verified, pointer.fingerprint(), actual, blob.length);
        if (verified) {
            LOG.info("Integrity verified for {}", pointer.contentId());
        } else {
            LOG.warn("Integrity failure for {}: expected {}, got {}",
                    pointer.contentId(), pointer.fingerprint().abbreviated(), actual.abbreviated());
        }
        return report;
    }

    /**
     * Retrieves into {@code output}. The file is only created once decryption succeeded.
     */
    public Path retrieveToFile(OwnerId owner, OwnerId caller, DataKey key, Path output)
            throws IOException, IntegrityException {
        byte[] plaintext = retrieve(owner, caller, key);
        Path parent = output.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, ".retrieve-", ".tmp");
        try {
            Files.write(temp, plaintext);
            try {
                Files.move(temp, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, output, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Arrays.fill(plaintext, (byte) 0);
            Files.deleteIfExists(temp);
        }
        return output;
    }

    private void requireIntact(GenomicRecordPointer pointer, byte[] blob) throws TamperDetectedException {
        Fingerprint actual = fingerprinter.hash(blob);
        if (!actual.matches(pointer.fingerprint())) {
            LOG.warn("Tamper detected on {}: expected {}, got {}",
                    pointer.contentId(), pointer.fingerprint().abbreviated(), actual.abbreviated());
            throw new TamperDetectedException(pointer.contentId(), pointer.fingerprint(), actual);
        }
    }
}
