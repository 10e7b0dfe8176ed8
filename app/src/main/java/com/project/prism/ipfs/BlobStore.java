package com.project.prism.ipfs;

import java.util.Map;
import java.util.Set;

/**
 * Opaque encrypted blobs on a content-addressable network.
 * <p>
 * Content ids may be passed with or without an {@code ipfs://} prefix.
 */
public interface BlobStore {

    /**
     * @return the content id the network assigned to {@code bytes}
     * @throws StoreUnavailableException on network or authentication failure
     * @throws QuotaExceededException    when the account cannot hold more data
     */
    String put(byte[] bytes, String name) throws BlobStoreException;

    /**
     * Same as {@link #put(byte[], String)}, attaching key/value metadata where the backend supports it.
     */
    default String put(byte[] bytes, String name, Map<String, String> metadata) throws BlobStoreException {
        return put(bytes, name);
    }

    /**
     * @throws BlobNotFoundException if the content is unpinned or expired
     */
    byte[] get(String contentId) throws BlobStoreException;

    void unpin(String contentId) throws BlobStoreException;

    Set<String> list() throws BlobStoreException;

    /**
     * Whether the configured credentials are accepted. Never throws.
     */
    boolean testAuth();
}
