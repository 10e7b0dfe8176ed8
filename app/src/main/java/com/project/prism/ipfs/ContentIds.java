package com.project.prism.ipfs;

import com.project.prism.io.ByteEncoding;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.regex.Pattern;

public final class ContentIds {

    public static final String URI_PREFIX = "ipfs://";
    public static final String LOCAL_PREFIX = "cid-sha256-";

    private static final int MIN_LENGTH = 10;
    private static final int MAX_LENGTH = 100;
    private static final Pattern ALLOWED = Pattern.compile("^[a-zA-Z0-9\\-_]+$");

    private ContentIds() {
    }

    /**
     * Strips an {@code ipfs://} prefix and checks the id is safe to put in a URL or file name.
     *
     * @throws IllegalArgumentException for empty, oversized or suspicious ids
     */
    public static String normalize(String pointer) {
        if (pointer == null) {
            throw new IllegalArgumentException("Content id must not be null");
        }
        String cid = pointer.trim();
        if (cid.startsWith(URI_PREFIX)) {
            cid = cid.substring(URI_PREFIX.length());
        }
        if (cid.length() < MIN_LENGTH || cid.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(String.format(
                    "Content id has invalid length: %d. Expected %d-%d characters.", cid.length(), MIN_LENGTH, MAX_LENGTH));
        }
        if (!ALLOWED.matcher(cid).matches()) {
            throw new IllegalArgumentException("Content id contains invalid characters: '" + pointer + "'");
        }
        return cid;
    }

    /**
     * Content id for stores that address blobs by their own SHA-256, such as {@link LocalDirectoryBlobStore}.
     */
    public static String deriveLocal(byte[] bytes) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(bytes);
            return LOCAL_PREFIX + ByteEncoding.toHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
