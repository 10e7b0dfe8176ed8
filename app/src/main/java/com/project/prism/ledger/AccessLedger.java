package com.project.prism.ledger;

import com.project.prism.crypto.Fingerprint;

import java.util.List;

/**
 * Ordered, append-only store of ownership, data pointers and per-requester access grants.
 * <p>
 * Every call is atomic. Mutations are attributed to the {@link Signer} passed in; queries take plain ids.
 * Permission transitions per (owner, requester):
 * <pre>
 * NONE --request--> REQUESTED --approve--> APPROVED --revoke--> REVOKED --request--> REQUESTED
 * </pre>
 * State rejections surface as {@link LedgerRejectedException}; an unreachable ledger as
 * {@link LedgerUnavailableException}.
 */
public interface AccessLedger {

    /**
     * @throws LedgerRejectedException {@code ALREADY_REGISTERED}
     */
    void registerOwner(Signer signer) throws LedgerUnavailableException;

    /**
     * Replaces the signer's live pointer.
     *
     * @throws LedgerRejectedException {@code NOT_REGISTERED}
     */
    void publishPointer(Signer signer, String contentId, Fingerprint fingerprint) throws LedgerUnavailableException;

    /**
     * @throws LedgerRejectedException {@code NO_DATA} if the owner has published nothing,
     *                                 {@code INVALID_TRANSITION} if already approved or requesting one's own data
     */
    void requestAccess(Signer signer, OwnerId ownerId) throws LedgerUnavailableException;

    /**
     * @throws LedgerRejectedException {@code INVALID_TRANSITION} unless the requester is in {@code REQUESTED}
     */
    void approve(Signer signer, OwnerId requesterId) throws LedgerUnavailableException;

    /**
     * @throws LedgerRejectedException {@code INVALID_TRANSITION} unless the requester is in {@code APPROVED}
     */
    void revoke(Signer signer, OwnerId requesterId) throws LedgerUnavailableException;

    boolean isOwner(OwnerId id) throws LedgerUnavailableException;

    /** True iff the grant is {@code APPROVED}. */
    boolean checkAccess(OwnerId ownerId, OwnerId requesterId) throws LedgerUnavailableException;

    AccessStatus accessStatus(OwnerId ownerId, OwnerId requesterId) throws LedgerUnavailableException;

    /**
     * The owner's live pointer, readable by the owner and by approved requesters.
     *
     * @throws NotAuthorizedException  for anyone else
     * @throws LedgerRejectedException {@code NO_DATA} if an authorized caller finds nothing published
     */
    GenomicRecordPointer readPointer(OwnerId ownerId, OwnerId callerId) throws LedgerUnavailableException;

    /**
     * Retained pointers, oldest first, under the same authorization as {@link #readPointer}. With
     * {@link PointerRetention#LATEST_ONLY} this holds at most one entry.
     */
    List<GenomicRecordPointer> readPointerHistory(OwnerId ownerId, OwnerId callerId) throws LedgerUnavailableException;

    /** The audit stream in ledger order. */
    List<LedgerEvent> events() throws LedgerUnavailableException;

    PointerRetention retention();
}
