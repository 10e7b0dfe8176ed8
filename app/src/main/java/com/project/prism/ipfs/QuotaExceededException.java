package com.project.prism.ipfs;

/**
 * The account is over its storage or plan limit. Needs operator action.
 */
public class QuotaExceededException extends BlobStoreException {

    public QuotaExceededException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
