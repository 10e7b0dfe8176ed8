package com.project.prism.ipfs;

/**
 * Network, server or authentication failure. Retryable unless the store rejected the credentials.
 */
public class StoreUnavailableException extends BlobStoreException {

    private final boolean retryable;

    public StoreUnavailableException(String message) {
        this(message, true);
    }

    public StoreUnavailableException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.retryable = true;
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }
}
