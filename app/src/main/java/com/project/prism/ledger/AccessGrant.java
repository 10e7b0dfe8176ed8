package com.project.prism.ledger;

import java.time.Instant;
import java.util.Objects;

/**
 * Current permission of {@code requester} on {@code owner}'s data.
 */
public record AccessGrant(OwnerId owner, OwnerId requester, AccessStatus status, Instant updatedAt) {

    public AccessGrant {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(requester, "requester");
        Objects.requireNonNull(status, "status");
    }

    public boolean isActive() {
        return status == AccessStatus.APPROVED;
    }
}
