package com.project.prism.ipfs;

public class BlobNotFoundException extends BlobStoreException {

    private final String contentId;

    public BlobNotFoundException(String contentId) {
        super("Content not found or no longer pinned: " + contentId);
        this.contentId = contentId;
    }

    public String contentId() {
        return contentId;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
