package com.project.prism.ledger;

public class NotAuthorizedException extends LedgerRejectedException {

    public NotAuthorizedException(String message) {
        super(Reason.NOT_AUTHORIZED, message);
    }
}
