package com.project.prism.core;

import com.project.prism.crypto.Fingerprint;

/**
 * Result of downloading a blob and checking it against its ledger fingerprint, without decrypting.
 */
public record IntegrityReport(
        String contentId,
        boolean verified,
        Fingerprint expected,
        Fingerprint actual,
        long size
) {
    public String status() {
        return verified ? "INTEGRITY_VERIFIED" : "TAMPERED";
    }

    public String describe() {
        return String.format("%s cid=%s size=%d expected=%s actual=%s",
                status(), contentId, size, expected.toHex(), actual.toHex());
    }
}
