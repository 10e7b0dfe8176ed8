package com.project.prism.core;

import com.project.prism.crypto.Fingerprint;
import com.project.prism.ledger.OwnerId;

/**
 * Outcome of a successful blob upload. Enough to publish (or re-publish) the pointer without re-encrypting.
 *
 * @param owner       uploading owner
 * @param contentId   content id assigned by the blob store
 * @param fingerprint BLAKE3 of the encrypted blob
 * @param size        encrypted size in bytes
 * @param name        file name the blob was stored under
 */
public record UploadReceipt(OwnerId owner, String contentId, Fingerprint fingerprint, long size, String name) {
}
