package com.project.prism.ledger;

import com.project.prism.ledger.LedgerEvent.AccessApproved;
import com.project.prism.ledger.LedgerEvent.AccessRequested;
import com.project.prism.ledger.LedgerEvent.AccessRevoked;
import com.project.prism.ledger.LedgerEvent.DataPublished;
import com.project.prism.ledger.LedgerEvent.OwnerRegistered;
import com.project.prism.ledger.LedgerRejectedException.Reason;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Owners, pointers and grants as derived from a sequence of {@link LedgerEvent}s.
 * <p>
 * {@link #apply(LedgerEvent)} is the only way state changes, both for live mutations and for replay,
 * so a replayed stream always reproduces the state that produced it. Not thread-safe.
 */
public final class LedgerState {

    private final PointerRetention retention;
    private final Set<OwnerId> owners = new LinkedHashSet<>();
    private final Map<OwnerId, List<GenomicRecordPointer>> pointers = new HashMap<>();
    private final Map<GrantKey, AccessGrant> grants = new LinkedHashMap<>();
    private long lastSequence;

    public LedgerState(PointerRetention retention) {
        this.retention = retention;
    }

    public PointerRetention retention() {
        return retention;
    }

    public long lastSequence() {
        return lastSequence;
    }

    /**
     * @throws LedgerRejectedException if the event is not a legal next step from this state
     */
    public void validate(LedgerEvent event) {
        if (event.sequence() <= lastSequence) {
            throw new IllegalArgumentException("Event sequence " + event.sequence()
                    + " does not follow " + lastSequence);
        }
        if (event instanceof OwnerRegistered registered) {
            if (owners.contains(registered.owner())) {
                throw new LedgerRejectedException(Reason.ALREADY_REGISTERED,
                        "Patient already registered: " + registered.owner());
            }
        } else if (event instanceof DataPublished published) {
            requireRegistered(published.owner());
        } else if (event instanceof AccessRequested requested) {
            if (requested.owner().equals(requested.requester())) {
                throw new LedgerRejectedException(Reason.INVALID_TRANSITION,
                        "Owner cannot request access to its own data");
            }
            if (latestPointer(requested.owner()).isEmpty()) {
                throw new LedgerRejectedException(Reason.NO_DATA,
                        "No data published by " + requested.owner());
            }
            AccessStatus current = status(requested.owner(), requested.requester());
            if (!current.canRequest()) {
                throw new LedgerRejectedException(Reason.INVALID_TRANSITION,
                        "Access already approved for " + requested.requester());
            }
        } else if (event instanceof AccessApproved approved) {
            requireRegistered(approved.owner());
            requireStatus(approved.owner(), approved.requester(), AccessStatus.REQUESTED, "approve");
        } else if (event instanceof AccessRevoked revoked) {
            requireRegistered(revoked.owner());
            requireStatus(revoked.owner(), revoked.requester(), AccessStatus.APPROVED, "revoke");
        }
    }

    /**
     * Validates and applies one event.
     */
    public void apply(LedgerEvent event) {
        validate(event);
        if (event instanceof OwnerRegistered registered) {
            owners.add(registered.owner());
        } else if (event instanceof DataPublished published) {
            List<GenomicRecordPointer> history = pointers.computeIfAbsent(published.owner(), o -> new ArrayList<>());
            if (retention == PointerRetention.LATEST_ONLY) {
                history.clear();
            }
            history.add(published.pointer());
        } else if (event instanceof AccessRequested requested) {
            setStatus(requested.owner(), requested.requester(), AccessStatus.REQUESTED, event);
        } else if (event instanceof AccessApproved approved) {
            setStatus(approved.owner(), approved.requester(), AccessStatus.APPROVED, event);
        } else if (event instanceof AccessRevoked revoked) {
            setStatus(revoked.owner(), revoked.requester(), AccessStatus.REVOKED, event);
        }
        lastSequence = event.sequence();
    }

    public boolean isOwner(OwnerId id) {
        return owners.contains(id);
    }

    public Set<OwnerId> owners() {
        return Collections.unmodifiableSet(owners);
    }

    public AccessStatus status(OwnerId owner, OwnerId requester) {
        AccessGrant grant = grants.get(new GrantKey(owner, requester));
        return grant == null ? AccessStatus.NONE : grant.status();
    }

    /** Grants on {@code owner}'s data in the order they were first created. */
    public List<AccessGrant> grantsFor(OwnerId owner) {
        List<AccessGrant> result = new ArrayList<>();
        for (AccessGrant grant : grants.values()) {
            if (grant.owner().equals(owner)) {
                result.add(grant);
            }
        }
        return result;
    }

    public Optional<GenomicRecordPointer> latestPointer(OwnerId owner) {
        List<GenomicRecordPointer> history = pointers.get(owner);
        if (history == null || history.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(history.get(history.size() - 1));
    }

    /** Retained pointers, oldest first. */
    public List<GenomicRecordPointer> pointerHistory(OwnerId owner) {
        return List.copyOf(pointers.getOrDefault(owner, List.of()));
    }

    /**
     * Whether {@code caller} may read {@code owner}'s pointer: the owner itself or an approved requester.
     */
    public boolean canRead(OwnerId owner, OwnerId caller) {
        return owner.equals(caller) || status(owner, caller) == AccessStatus.APPROVED;
    }

    private void requireRegistered(OwnerId owner) {
        if (!owners.contains(owner)) {
            throw new LedgerRejectedException(Reason.NOT_REGISTERED, "Not a registered patient: " + owner);
        }
    }

    private void requireStatus(OwnerId owner, OwnerId requester, AccessStatus expected, String action) {
        AccessStatus current = status(owner, requester);
        if (current != expected) {
            throw new LedgerRejectedException(Reason.INVALID_TRANSITION, String.format(
                    "Cannot %s %s: status is %s, expected %s", action, requester, current, expected));
        }
    }

    private void setStatus(OwnerId owner, OwnerId requester, AccessStatus status, LedgerEvent cause) {
        grants.put(new GrantKey(owner, requester), new AccessGrant(owner, requester, status, cause.timestamp()));
    }

    private record GrantKey(OwnerId owner, OwnerId requester) {
    }
}
