package com.project.prism.ledger;

import com.project.prism.crypto.Fingerprint;
import com.project.prism.ipfs.ContentIds;
import com.project.prism.ledger.LedgerEvent.AccessApproved;
import com.project.prism.ledger.LedgerEvent.AccessRequested;
import com.project.prism.ledger.LedgerEvent.AccessRevoked;
import com.project.prism.ledger.LedgerEvent.DataPublished;
import com.project.prism.ledger.LedgerEvent.OwnerRegistered;
import com.project.prism.ledger.LedgerRejectedException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.LongFunction;

/**
 * Event-sourced ledger kept in memory. Each mutation builds its event, validates it against the
 * current {@link LedgerState}, appends it and applies it. Calls are serialized on the instance.
 */
public class InMemoryAccessLedger implements AccessLedger {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryAccessLedger.class);

    private final Clock clock;
    private final LedgerState state;
    private final List<LedgerEvent> events = new ArrayList<>();

    public InMemoryAccessLedger() {
        this(PointerRetention.LATEST_ONLY, Clock.systemUTC());
    }

    public InMemoryAccessLedger(PointerRetention retention, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.state = new LedgerState(Objects.requireNonNull(retention, "retention"));
    }

    @Override
    public synchronized void registerOwner(Signer signer) {
        OwnerId owner = signer.identity();
        append(seq -> new OwnerRegistered(seq, owner, clock.instant()));
        LOG.info("Registered owner {}", owner);
    }

    @Override
    public synchronized void publishPointer(Signer signer, String contentId, Fingerprint fingerprint) {
        OwnerId owner = signer.identity();
        String cid = ContentIds.normalize(contentId);
        Objects.requireNonNull(fingerprint, "fingerprint");
        append(seq -> new DataPublished(seq, owner, cid, fingerprint, clock.instant()));
        LOG.info("Published pointer for {}: cid={} fingerprint={}", owner, cid, fingerprint.abbreviated());
    }

    @Override
    public synchronized void requestAccess(Signer signer, OwnerId ownerId) {
        OwnerId requester = signer.identity();
        append(seq -> new AccessRequested(seq, requester, ownerId, clock.instant()));
        LOG.info("{} requested access to {}", requester, ownerId);
    }

    @Override
    public synchronized void approve(Signer signer, OwnerId requesterId) {
        OwnerId owner = signer.identity();
        append(seq -> new AccessApproved(seq, owner, requesterId, clock.instant()));
        LOG.info("{} approved access for {}", owner, requesterId);
    }

    @Override
    public synchronized void revoke(Signer signer, OwnerId requesterId) {
        OwnerId owner = signer.identity();
        append(seq -> new AccessRevoked(seq, owner, requesterId, clock.instant()));
        LOG.info("{} revoked access for {}", owner, requesterId);
    }

    @Override
    public synchronized boolean isOwner(OwnerId id) {
        return state.isOwner(id);
    }

    @Override
    public synchronized boolean checkAccess(OwnerId ownerId, OwnerId requesterId) {
        return state.status(ownerId, requesterId) == AccessStatus.APPROVED;
    }

    @Override
    public synchronized AccessStatus accessStatus(OwnerId ownerId, OwnerId requesterId) {
        return state.status(ownerId, requesterId);
    }

    @Override
    public synchronized GenomicRecordPointer readPointer(OwnerId ownerId, OwnerId callerId) {
        authorizeRead(ownerId, callerId);
        return state.latestPointer(ownerId).orElseThrow(() ->
                new LedgerRejectedException(Reason.NO_DATA, "No data published by " + ownerId));
    }

    @Override
    public synchronized List<GenomicRecordPointer> readPointerHistory(OwnerId ownerId, OwnerId callerId) {
        authorizeRead(ownerId, callerId);
        return state.pointerHistory(ownerId);
    }

    @Override
    public synchronized List<LedgerEvent> events() {
        return List.copyOf(events);
    }

    @Override
    public PointerRetention retention() {
        return state.retention();
    }

    /** Grants on {@code ownerId}'s data. */
    public synchronized List<AccessGrant> grantsFor(OwnerId ownerId) {
        return state.grantsFor(ownerId);
    }

    private void authorizeRead(OwnerId ownerId, OwnerId callerId) {
        if (!state.canRead(ownerId, callerId)) {
            throw new NotAuthorizedException("Not authorized to view data of " + ownerId);
        }
    }

    private void append(LongFunction<LedgerEvent> factory) {
        LedgerEvent event = factory.apply(state.lastSequence() + 1);
        state.validate(event);
        events.add(event);
        state.apply(event);
    }
}
