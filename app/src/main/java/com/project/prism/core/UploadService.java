package com.project.prism.core;

import com.project.prism.crypto.AuthenticatedCipher;
import com.project.prism.crypto.ContentFingerprinter;
import com.project.prism.crypto.DataKey;
import com.project.prism.crypto.EncryptedPayload;
import com.project.prism.crypto.Fingerprint;
import com.project.prism.ipfs.BlobStore;
import com.project.prism.ipfs.BlobStoreException;
import com.project.prism.ledger.AccessLedger;
import com.project.prism.ledger.GenomicRecordPointer;
import com.project.prism.ledger.LedgerRejectedException;
import com.project.prism.ledger.LedgerUnavailableException;
import com.project.prism.ledger.OwnerId;
import com.project.prism.ledger.PointerRetention;
import com.project.prism.ledger.Signer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Owner-side pipeline: encrypt, fingerprint, store the blob, publish the pointer.
 * <p>
 * Only the final step touches the ledger. When it fails the stored blob is reported through
 * {@link PublishFailedException} and {@link #publish(Signer, UploadReceipt)} finishes the job
 * with the same content id and fingerprint.
 */
public class UploadService {
    private static final Logger LOG = LoggerFactory.getLogger(UploadService.class);

    static final String METADATA_TYPE = "encrypted_genomic_data";

    private final AuthenticatedCipher cipher;
    private final ContentFingerprinter fingerprinter;
    private final BlobStore blobStore;
    private final AccessLedger ledger;
    private final boolean unpinSuperseded;

    public UploadService(AuthenticatedCipher cipher, ContentFingerprinter fingerprinter,
                         BlobStore blobStore, AccessLedger ledger) {
        this(cipher, fingerprinter, blobStore, ledger, false);
    }

    /**
     * @param unpinSuperseded unpin the previous live blob after a new pointer commits; only honoured with
     *                        {@link PointerRetention#LATEST_ONLY}, where old pointers are no longer readable
     */
    public UploadService(AuthenticatedCipher cipher, ContentFingerprinter fingerprinter,
                         BlobStore blobStore, AccessLedger ledger, boolean unpinSuperseded) {
        this.cipher = Objects.requireNonNull(cipher, "cipher must not be null");
        this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter must not be null");
        this.blobStore = Objects.requireNonNull(blobStore, "blobStore must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.unpinSuperseded = unpinSuperseded;
    }

    public UploadReceipt upload(Signer signer, byte[] plaintext, DataKey key)
            throws BlobStoreException, PublishFailedException {
        Objects.requireNonNull(signer, "signer must not be null");
        Objects.requireNonNull(plaintext, "plaintext must not be null");
        Objects.requireNonNull(key, "key must not be null");
        OwnerId owner = signer.identity();

        EncryptedPayload payload = cipher.encrypt(plaintext, key);
        byte[] wire = payload.toBytes();
        Fingerprint fingerprint = fingerprinter.hash(payload);
        String name = blobName(owner);
        String contentId = blobStore.put(wire, name, Map.of(
                "type", METADATA_TYPE,
                "blake3_hash", fingerprint.toHex()));
        UploadReceipt receipt = new UploadReceipt(owner, contentId, fingerprint, wire.length, name);
        LOG.info("Stored encrypted blob for {}: cid={} size={} fingerprint={}",
                owner, contentId, wire.length, fingerprint.abbreviated());

        try {
            return publish(signer, receipt);
        } catch (LedgerUnavailableException | LedgerRejectedException e) {
            LOG.warn("Pointer publish failed for {} (cid={}): {}", owner, contentId, e.getMessage());
            throw new PublishFailedException(receipt, e);
        }
    }

    public UploadReceipt uploadFile(Signer signer, Path file, DataKey key)
            throws IOException, PublishFailedException {
        return upload(signer, Files.readAllBytes(file), key);
    }

    /**
     * Publishes the pointer for an already stored blob. Safe to repeat with the same receipt.
     */
    public UploadReceipt publish(Signer signer, UploadReceipt receipt) throws LedgerUnavailableException {
        if (!signer.identity().equals(receipt.owner())) {
            throw new IllegalArgumentException("Receipt belongs to " + receipt.owner() + ", not " + signer.identity());
        }
        Optional<String> superseded = supersededContentId(receipt);
        ledger.publishPointer(signer, receipt.contentId(), receipt.fingerprint());
        LOG.info("Published pointer for {}: cid={}", receipt.owner(), receipt.contentId());
        superseded.ifPresent(this::unpinQuietly);
        return receipt;
    }

    static String blobName(OwnerId owner) {
        return "patient_" + owner.value() + ".vcf.enc";
    }

    private Optional<String> supersededContentId(UploadReceipt receipt) throws LedgerUnavailableException {
        if (!unpinSuperseded || ledger.retention() != PointerRetention.LATEST_ONLY) {
            return Optional.empty();
        }
        try {
            GenomicRecordPointer previous = ledger.readPointer(receipt.owner(), receipt.owner());
            return previous.contentId().equals(receipt.contentId())
                    ? Optional.empty()
                    : Optional.of(previous.contentId());
        } catch (LedgerRejectedException e) {
            return Optional.empty();
        }
    }

    private void unpinQuietly(String contentId) {
        try {
            blobStore.unpin(contentId);
            LOG.info("Unpinned superseded blob {}", contentId);
        } catch (BlobStoreException e) {
            LOG.warn("Failed to unpin superseded blob {}: {}", contentId, e.getMessage());
        }
    }
}
