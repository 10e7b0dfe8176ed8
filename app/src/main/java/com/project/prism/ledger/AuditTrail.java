package com.project.prism.ledger;

import com.project.prism.ledger.LedgerEvent.AccessApproved;
import com.project.prism.ledger.LedgerEvent.AccessRequested;
import com.project.prism.ledger.LedgerEvent.AccessRevoked;
import com.project.prism.ledger.LedgerEvent.DataPublished;
import com.project.prism.ledger.LedgerEvent.OwnerRegistered;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-side view over a ledger's event stream.
 */
public final class AuditTrail {

    private final List<LedgerEvent> events;

    private AuditTrail(List<LedgerEvent> events) {
        this.events = List.copyOf(events);
    }

    public static AuditTrail of(List<LedgerEvent> events) {
        return new AuditTrail(events);
    }

    public static AuditTrail of(AccessLedger ledger) throws LedgerUnavailableException {
        return new AuditTrail(ledger.events());
    }

    public List<LedgerEvent> events() {
        return events;
    }

    /**
     * Rebuilds owners, pointers and grants from the stream.
     *
     * @throws LedgerRejectedException if the stream contains a transition its prefix does not allow
     */
    public LedgerState replay(PointerRetention retention) {
        LedgerState state = new LedgerState(retention);
        for (LedgerEvent event : events) {
            state.apply(event);
        }
        return state;
    }

    /** Events in which {@code party} is the owner or the requester. */
    public List<LedgerEvent> involving(OwnerId party) {
        List<LedgerEvent> result = new ArrayList<>();
        for (LedgerEvent event : events) {
            if (event.involves(party)) {
                result.add(event);
            }
        }
        return result;
    }

    /**
     * One human-readable line, e.g. {@code #3 AccessRequested doctor=0x.. patient=0x..}.
     */
    public static String describe(LedgerEvent event) {
        String prefix = "#" + event.sequence() + " " + event.timestamp() + " " + event.name();
        if (event instanceof OwnerRegistered e) {
            return prefix + " patient=" + e.owner();
        } else if (event instanceof DataPublished e) {
            return prefix + " patient=" + e.owner() + " cid=" + e.contentId()
                    + " blake3=" + e.fingerprint().abbreviated();
        } else if (event instanceof AccessRequested e) {
            return prefix + " doctor=" + e.requester() + " patient=" + e.owner();
        } else if (event instanceof AccessApproved e) {
            return prefix + " patient=" + e.owner() + " doctor=" + e.requester();
        } else if (event instanceof AccessRevoked e) {
            return prefix + " patient=" + e.owner() + " doctor=" + e.requester();
        }
        return prefix;
    }
}
