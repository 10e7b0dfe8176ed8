package com.project.prism.crypto;

/**
 * The GCM tag did not verify: wrong key, corrupted ciphertext or tampering.
 */
public class AuthenticationFailedException extends IntegrityException {

    public AuthenticationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
