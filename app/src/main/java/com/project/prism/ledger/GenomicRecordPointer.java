package com.project.prism.ledger;

import com.project.prism.crypto.Fingerprint;

import java.time.Instant;
import java.util.Objects;

/**
 * What the ledger records about an owner's encrypted blob: where it lives and what it should hash to.
 *
 * @param owner       publishing owner
 * @param contentId   content id on the blob store, without {@code ipfs://}
 * @param fingerprint BLAKE3 of the encrypted blob
 * @param publishedAt ledger time of the publish, when known
 */
public record GenomicRecordPointer(OwnerId owner, String contentId, Fingerprint fingerprint, Instant publishedAt) {

    public GenomicRecordPointer {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(contentId, "contentId");
        Objects.requireNonNull(fingerprint, "fingerprint");
    }
}
