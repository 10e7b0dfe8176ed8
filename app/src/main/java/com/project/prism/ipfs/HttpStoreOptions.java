package com.project.prism.ipfs;

import com.project.prism.config.EnvSettings;

import java.time.Duration;
import java.util.Optional;

/**
 * Retry, timeout and TLS settings shared by the HTTP blob stores.
 * <ul>
 *   <li>{@code BLOB_MAX_RETRIES} attempts per request (default 3)</li>
 *   <li>{@code BLOB_RETRY_BACKOFF_MS} first backoff, doubled up to 2 s (default 200)</li>
 *   <li>{@code BLOB_CALL_TIMEOUT_SECONDS} whole-call timeout (default 120)</li>
 *   <li>{@code BLOB_TLS_INSECURE}, {@code BLOB_CA_CERT_PATH}</li>
 * </ul>
 */
public record HttpStoreOptions(
        int maxRetries,
        long initialBackoffMillis,
        Duration callTimeout,
        boolean tlsInsecure,
        Optional<String> caCertPath
) {
    public static final long MAX_BACKOFF_MILLIS = 2000;

    public HttpStoreOptions {
        maxRetries = Math.max(maxRetries, 1);
        initialBackoffMillis = Math.max(initialBackoffMillis, 0);
    }

    public static HttpStoreOptions defaults() {
        return new HttpStoreOptions(3, 200, Duration.ofSeconds(120), false, Optional.empty());
    }

    public static HttpStoreOptions fromSettings(EnvSettings settings) {
        return new HttpStoreOptions(
                settings.getInt("BLOB_MAX_RETRIES", 3),
                Math.max(settings.getLong("BLOB_RETRY_BACKOFF_MS", 200L), 100L),
                Duration.ofSeconds(settings.getLong("BLOB_CALL_TIMEOUT_SECONDS", 120L)),
                settings.getBoolean("BLOB_TLS_INSECURE", false),
                settings.get("BLOB_CA_CERT_PATH")
        );
    }
}
