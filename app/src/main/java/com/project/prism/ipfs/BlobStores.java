package com.project.prism.ipfs;

import com.project.prism.config.ConfigurationException;
import com.project.prism.config.EnvSettings;

import java.nio.file.Path;
import java.util.Locale;

public final class BlobStores {

    private BlobStores() {
    }

    /**
     * Picks the backend named by {@code BLOB_STORE} ({@code pinata}, {@code kubo} or {@code local}, default pinata).
     */
    public static BlobStore fromSettings(EnvSettings settings) {
        String kind = settings.get("BLOB_STORE", "pinata").trim().toLowerCase(Locale.ROOT);
        switch (kind) {
            case "pinata":
                return PinataBlobStore.fromSettings(settings);
            case "kubo":
            case "ipfs":
                return KuboBlobStore.fromSettings(settings);
            case "local":
                return new LocalDirectoryBlobStore(Path.of(settings.get("BLOB_LOCAL_DIR", "blobs")));
            default:
                throw new ConfigurationException("Unknown BLOB_STORE '" + kind + "' (expected pinata, kubo or local)");
        }
    }
}
