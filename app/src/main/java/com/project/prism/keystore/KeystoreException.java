package com.project.prism.keystore;

import java.io.IOException;

public class KeystoreException extends IOException {

    public KeystoreException(String message) {
        super(message);
    }

    public KeystoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
