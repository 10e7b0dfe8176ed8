package com.project.prism.ipfs;

import java.io.IOException;

/**
 * Failure talking to a blob store. {@link #isRetryable()} tells callers whether trying
 * the same request again can help.
 */
public abstract class BlobStoreException extends IOException {

    protected BlobStoreException(String message) {
        super(message);
    }

    protected BlobStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
