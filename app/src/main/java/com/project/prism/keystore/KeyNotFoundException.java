package com.project.prism.keystore;

import com.project.prism.ledger.OwnerId;

public class KeyNotFoundException extends KeystoreException {

    public KeyNotFoundException(OwnerId ownerId) {
        super("No key found for owner " + ownerId);
    }
}
