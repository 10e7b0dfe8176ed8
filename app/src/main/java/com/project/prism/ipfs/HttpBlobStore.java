package com.project.prism.ipfs;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Locale;

/**
 * Shared plumbing for blob stores reached over HTTP: retries with exponential backoff,
 * a circuit breaker, status-code classification and the OkHttp client setup.
 */
abstract class HttpBlobStore implements BlobStore {
    private static final Logger LOG = LoggerFactory.getLogger(HttpBlobStore.class);

    protected final OkHttpClient httpClient;
    protected final HttpStoreOptions options;
    protected final CircuitBreaker circuitBreaker;
    private final String storeName;

    protected HttpBlobStore(String storeName, HttpStoreOptions options) {
        this.storeName = storeName;
        this.options = options;
        this.httpClient = buildHttpClient(options);
        this.circuitBreaker = new CircuitBreaker(storeName);
    }

    public CircuitBreaker.State circuitState() {
        return circuitBreaker.getState();
    }

    /**
     * Runs {@code request}, retrying only failures whose {@link BlobStoreException#isRetryable()} is true.
     * Non-retryable answers (not found, quota) mean the store is up and do not count against the breaker.
     */
    protected <T> T execute(Request request, ResponseHandler<T> handler) throws BlobStoreException {
        if (!circuitBreaker.canExecute()) {
            throw new StoreUnavailableException(storeName
                    + " circuit breaker is OPEN - service temporarily unavailable");
        }

        BlobStoreException last = null;
        long backoffMs = options.initialBackoffMillis();
        for (int attempt = 1; attempt <= options.maxRetries(); attempt++) {
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    throw classify(response.code(), bodySnippet(response), request);
                }
                T result = handler.handle(response);
                circuitBreaker.recordSuccess();
                return result;
            } catch (BlobStoreException e) {
                last = e;
            } catch (IOException e) {
                last = new StoreUnavailableException(storeName + " request failed: " + e.getMessage(), e);
            }

            if (!last.isRetryable()) {
                if (last instanceof StoreUnavailableException) {
                    circuitBreaker.recordFailure();
                } else {
                    circuitBreaker.recordSuccess();
                }
                throw last;
            }
            if (attempt < options.maxRetries()) {
                LOG.debug("{} attempt {}/{} failed ({}), retrying in {} ms",
                        storeName, attempt, options.maxRetries(), last.getMessage(), backoffMs);
                sleep(backoffMs);
                backoffMs = Math.min(Math.max(backoffMs * 2, 1), HttpStoreOptions.MAX_BACKOFF_MILLIS);
            }
        }
        circuitBreaker.recordFailure();
        throw last;
    }

    /**
     * Maps a non-2xx answer onto the blob store error taxonomy.
     */
    protected BlobStoreException classify(int code, String body, Request request) {
        String detail = storeName + " error " + code + (body.isEmpty() ? "" : ": " + body);
        switch (code) {
            case 404:
            case 410:
                return new BlobNotFoundException(contentIdOf(request));
            case 402:
            case 413:
                return new QuotaExceededException(detail);
            case 401:
            case 403:
                return new StoreUnavailableException(detail + " (check credentials)", false);
            case 400:
                return new StoreUnavailableException(detail, false);
            default:
                return new StoreUnavailableException(detail);
        }
    }

    /**
     * Best guess at the content id a request was about, for error messages.
     */
    protected String contentIdOf(Request request) {
        String arg = request.url().queryParameter("arg");
        if (arg != null) {
            return arg;
        }
        var segments = request.url().pathSegments();
        return segments.isEmpty() ? request.url().toString() : segments.get(segments.size() - 1);
    }

    protected static boolean mentions(String body, String... needles) {
        String lower = body.toLowerCase(Locale.ROOT);
        for (String needle : needles) {
            if (lower.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static String bodySnippet(Response response) {
        try {
            ResponseBody body = response.body();
            if (body == null) {
                return "";
            }
            String text = body.string().trim();
            return text.length() > 200 ? text.substring(0, 200) : text;
        } catch (IOException e) {
            return "";
        }
    }

    private void sleep(long millis) throws StoreUnavailableException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            circuitBreaker.recordFailure();
            throw new StoreUnavailableException("Interrupted during " + storeName + " retry", e);
        }
    }

    protected interface ResponseHandler<T> {
        T handle(Response response) throws IOException;
    }

    private static OkHttpClient buildHttpClient(HttpStoreOptions options) {
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .writeTimeout(Duration.ofSeconds(60))
                .readTimeout(Duration.ofSeconds(60))
                .callTimeout(options.callTimeout());
        try {
            X509TrustManager trustManager = buildTrustManager(options);
            if (trustManager != null) {
                SSLContext context = SSLContext.getInstance("TLS");
                context.init(null, new TrustManager[]{trustManager}, new SecureRandom());
                builder.sslSocketFactory(context.getSocketFactory(), trustManager);
            }
            if (options.tlsInsecure()) {
                builder.hostnameVerifier((hostname, session) -> true);
            }
        } catch (GeneralSecurityException | IOException e) {
            throw new IllegalStateException("Failed to configure blob store HTTP client", e);
        }
        return builder.build();
    }

    private static X509TrustManager buildTrustManager(HttpStoreOptions options)
            throws GeneralSecurityException, IOException {
        if (options.tlsInsecure()) {
            return new TrustAllManager();
        }
        if (options.caCertPath().isEmpty()) {
            return null;
        }
        KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
        trustStore.load(null, null);
        try (InputStream in = Files.newInputStream(Path.of(options.caCertPath().get()))) {
            Certificate ca = CertificateFactory.getInstance("X.509").generateCertificate(in);
            trustStore.setCertificateEntry("custom-ca", ca);
        }
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(trustStore);
        for (TrustManager manager : tmf.getTrustManagers()) {
            if (manager instanceof X509TrustManager x509) {
                return x509;
            }
        }
        throw new GeneralSecurityException("No X509TrustManager for " + options.caCertPath().get());
    }

    private static final class TrustAllManager implements X509TrustManager {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
