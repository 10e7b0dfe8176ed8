package com.project.prism.crypto;

/**
 * Fetched bytes do not match the fingerprint recorded on the ledger.
 * Raised before any decryption is attempted.
 */
public class TamperDetectedException extends IntegrityException {

    private final Fingerprint expected;
    private final Fingerprint actual;

    public TamperDetectedException(String contentId, Fingerprint expected, Fingerprint actual) {
        super(String.format("Integrity check failed for %s: expected fingerprint %s, got %s",
                contentId, expected.abbreviated(), actual.abbreviated()));
        this.expected = expected;
        this.actual = actual;
    }

    public Fingerprint expected() {
        return expected;
    }

    public Fingerprint actual() {
        return actual;
    }
}
