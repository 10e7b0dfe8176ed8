package com.project.prism.keystore;

import java.security.GeneralSecurityException;

/**
 * The entry could not be unwrapped. Deliberately says nothing about whether the
 * passphrase was wrong or the entry corrupted.
 */
public class InvalidPassphraseException extends GeneralSecurityException {

    public InvalidPassphraseException(Throwable cause) {
        super("Wrong passphrase or corrupted keystore entry", cause);
    }
}
