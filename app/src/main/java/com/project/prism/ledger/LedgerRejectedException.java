package com.project.prism.ledger;

/**
 * The ledger refused an operation because of its current state. Not transient: callers branch on {@link #reason()}.
 */
public class LedgerRejectedException extends RuntimeException {

    public enum Reason {
        NOT_AUTHORIZED,
        ALREADY_REGISTERED,
        NOT_REGISTERED,
        NO_DATA,
        INVALID_TRANSITION
    }

    private final Reason reason;

    public LedgerRejectedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
