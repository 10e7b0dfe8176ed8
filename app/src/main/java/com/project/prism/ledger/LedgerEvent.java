package com.project.prism.ledger;

import com.project.prism.crypto.Fingerprint;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One entry of the append-only audit stream. Entries are ordered by {@link #sequence()} and never amended.
 */
public sealed interface LedgerEvent {

    long sequence();

    Instant timestamp();

    /** Event name as emitted on chain, e.g. {@code DataUploaded}. */
    String name();

    List<OwnerId> parties();

    default boolean involves(OwnerId party) {
        return parties().contains(party);
    }

    record OwnerRegistered(long sequence, OwnerId owner, Instant timestamp) implements LedgerEvent {
        public OwnerRegistered {
            Objects.requireNonNull(owner, "owner");
        }

        @Override
        public String name() {
            return "PatientRegistered";
        }

        @Override
        public List<OwnerId> parties() {
            return List.of(owner);
        }
    }

    record DataPublished(long sequence, OwnerId owner, String contentId, Fingerprint fingerprint, Instant timestamp)
            implements LedgerEvent {
        public DataPublished {
            Objects.requireNonNull(owner, "owner");
            Objects.requireNonNull(contentId, "contentId");
            Objects.requireNonNull(fingerprint, "fingerprint");
        }

        @Override
        public String name() {
            return "DataUploaded";
        }

        @Override
        public List<OwnerId> parties() {
            return List.of(owner);
        }

        public GenomicRecordPointer pointer() {
            return new GenomicRecordPointer(owner, contentId, fingerprint, timestamp);
        }
    }

    record AccessRequested(long sequence, OwnerId requester, OwnerId owner, Instant timestamp) implements LedgerEvent {
        public AccessRequested {
            Objects.requireNonNull(requester, "requester");
            Objects.requireNonNull(owner, "owner");
        }

        @Override
        public String name() {
            return "AccessRequested";
        }

        @Override
        public List<OwnerId> parties() {
            return List.of(owner, requester);
        }
    }

    record AccessApproved(long sequence, OwnerId owner, OwnerId requester, Instant timestamp) implements LedgerEvent {
        public AccessApproved {
            Objects.requireNonNull(owner, "owner");
            Objects.requireNonNull(requester, "requester");
        }

        @Override
        public String name() {
            return "AccessApproved";
        }

        @Override
        public List<OwnerId> parties() {
            return List.of(owner, requester);
        }
    }

    record AccessRevoked(long sequence, OwnerId owner, OwnerId requester, Instant timestamp) implements LedgerEvent {
        public AccessRevoked {
            Objects.requireNonNull(owner, "owner");
            Objects.requireNonNull(requester, "requester");
        }

        @Override
        public String name() {
            return "AccessRevoked";
        }

        @Override
        public List<OwnerId> parties() {
            return List.of(owner, requester);
        }
    }
}
