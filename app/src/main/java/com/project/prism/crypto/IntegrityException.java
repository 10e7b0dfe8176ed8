package com.project.prism.crypto;

import java.security.GeneralSecurityException;

/**
 * Base of the integrity failures. These always fail closed and are never retried.
 */
public abstract class IntegrityException extends GeneralSecurityException {

    protected IntegrityException(String message) {
        super(message);
    }

    protected IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
