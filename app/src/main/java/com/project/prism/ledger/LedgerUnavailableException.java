package com.project.prism.ledger;

import java.io.IOException;

/**
 * The ledger could not be reached or did not confirm in time. The outcome of a write is unknown;
 * retry it only with the same arguments.
 */
public class LedgerUnavailableException extends IOException {

    public LedgerUnavailableException(String message) {
        super(message);
    }

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
