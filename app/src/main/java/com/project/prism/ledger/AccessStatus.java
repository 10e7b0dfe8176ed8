package com.project.prism.ledger;

/**
 * Permission state of one (owner, requester) pair. Codes match the on-chain enum order.
 */
public enum AccessStatus {
    NONE(0),
    REQUESTED(1),
    APPROVED(2),
    REVOKED(3);

    private final int code;

    AccessStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static AccessStatus fromCode(int code) {
        for (AccessStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown access status code: " + code);
    }

    /** Whether a requester in this state may file a new request. */
    public boolean canRequest() {
        return this != APPROVED;
    }
}
