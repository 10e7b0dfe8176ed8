package com.project.prism.ledger;

/**
 * Capability to act as one identity on the ledger. Mutating calls are attributed to
 * {@link #identity()}; key material, where there is any, stays inside the implementation.
 */
@FunctionalInterface
public interface Signer {

    OwnerId identity();

    /**
     * A signer that simply asserts an identity, for ledgers that trust the caller (in-memory, tests).
     */
    static Signer of(OwnerId identity) {
        return () -> identity;
    }

    static Signer of(String identity) {
        return of(OwnerId.of(identity));
    }
}
