package com.project.prism.ipfs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.prism.config.EnvSettings;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Iterator;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Blob store backed by a Kubo (go-ipfs) node's HTTP RPC API.
 * <p>
 * Environment variables (see {@link #fromSettings(EnvSettings)}):
 * - IPFS_URL or IPFS_HOST/IPFS_PORT: RPC endpoint (default http://127.0.0.1:5001)
 * - IPFS_GATEWAY_URL: fallback gateway for reads
 * - IPFS_PIN_AFTER_ADD: pin explicitly after add (default true)
 * - IPFS_API_BEARER_TOKEN / IPFS_API_BASIC_AUTH: credentials for protected nodes
 */
public class KuboBlobStore extends HttpBlobStore {
    private static final Logger LOG = LoggerFactory.getLogger(KuboBlobStore.class);
    private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");
    private static final RequestBody EMPTY_BODY = RequestBody.create(new byte[0], null);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String apiBaseUrl;
    private final Optional<String> gatewayUrl;
    private final Optional<String> authHeader;
    private final boolean pinAfterAdd;

    public KuboBlobStore(String apiUrl, HttpStoreOptions options) {
        this(apiUrl, Optional.empty(), Optional.empty(), true, options);
    }

    public KuboBlobStore(String apiUrl, Optional<String> gatewayUrl, Optional<String> authHeader,
                         boolean pinAfterAdd, HttpStoreOptions options) {
        super("IPFS", options);
        this.apiBaseUrl = stripTrailingSlash(resolveUrl(apiUrl));
        this.gatewayUrl = gatewayUrl.filter(g -> !g.isBlank()).map(g -> g.endsWith("/") ? g : g + "/");
        this.authHeader = authHeader;
        this.pinAfterAdd = pinAfterAdd;
    }

    public static KuboBlobStore fromSettings(EnvSettings settings) {
        String url = settings.get("IPFS_URL").orElseGet(() ->
                "http://" + settings.get("IPFS_HOST", "127.0.0.1") + ":" + settings.getInt("IPFS_PORT", 5001));
        return new KuboBlobStore(
                url,
                settings.get("IPFS_GATEWAY_URL"),
                authHeaderFrom(settings),
                settings.getBoolean("IPFS_PIN_AFTER_ADD", true),
                HttpStoreOptions.fromSettings(settings));
    }

    @Override
    public String put(byte[] bytes, String name) throws BlobStoreException {
        RequestBody requestBody = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("file", name, RequestBody.create(bytes, OCTET_STREAM))
                .build();
        Request request = withAuth(new Request.Builder()
                .url(apiUrl("/api/v0/add"))
                .post(requestBody))
                .build();

        String cid = execute(request, response -> {
            JsonNode json = MAPPER.readTree(response.body().string());
            JsonNode hash = json.get("Hash");
            if (hash == null || hash.asText().isBlank()) {
                throw new StoreUnavailableException("IPFS add returned no Hash", false);
            }
            return hash.asText();
        });
        pin(cid);
        LOG.info("Stored {} ({} bytes) as {}", name, bytes.length, cid);
        return cid;
    }

    /**
     * Reads through the node's {@code cat} endpoint, falling back to the gateway when one is configured.
     */
    @Override
    public byte[] get(String contentId) throws BlobStoreException {
        String cid = ContentIds.normalize(contentId);
        HttpUrl url = HttpUrl.get(apiUrl("/api/v0/cat")).newBuilder()
                .addQueryParameter("arg", cid)
                .build();
        Request request = withAuth(new Request.Builder().url(url).post(EMPTY_BODY)).build();
        try {
            return execute(request, response -> response.body().bytes());
        } catch (BlobStoreException e) {
            if (gatewayUrl.isEmpty()) {
                throw e;
            }
            LOG.debug("IPFS cat of {} failed ({}), trying gateway", cid, e.getMessage());
            return fetchViaGateway(cid);
        }
    }

    @Override
    public void unpin(String contentId) throws BlobStoreException {
        String cid = ContentIds.normalize(contentId);
        HttpUrl url = HttpUrl.get(apiUrl("/api/v0/pin/rm")).newBuilder()
                .addQueryParameter("arg", cid)
                .build();
        execute(withAuth(new Request.Builder().url(url).post(EMPTY_BODY)).build(), response -> null);
        LOG.info("Unpinned {}", cid);
    }

    @Override
    public Set<String> list() throws BlobStoreException {
        HttpUrl url = HttpUrl.get(apiUrl("/api/v0/pin/ls")).newBuilder()
                .addQueryParameter("type", "recursive")
                .build();
        return execute(withAuth(new Request.Builder().url(url).post(EMPTY_BODY)).build(), response -> {
            JsonNode keys = MAPPER.readTree(response.body().string()).path("Keys");
            Set<String> cids = new TreeSet<>();
            Iterator<String> names = keys.fieldNames();
            while (names.hasNext()) {
                cids.add(names.next());
            }
            return cids;
        });
    }

    @Override
    public boolean testAuth() {
        Request request = withAuth(new Request.Builder()
                .url(apiUrl("/api/v0/version"))
                .post(EMPTY_BODY))
                .build();
        try {
            return execute(request, response -> true);
        } catch (BlobStoreException e) {
            LOG.debug("IPFS node not reachable: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Kubo answers 500 with a JSON message for missing pins and blocks.
     */
    @Override
    protected BlobStoreException classify(int code, String body, Request request) {
        if (code == 500 && mentions(body, "not pinned", "not found")) {
            return new BlobNotFoundException(contentIdOf(request));
        }
        return super.classify(code, body, request);
    }

    private byte[] fetchViaGateway(String cid) throws BlobStoreException {
        HttpUrl url = HttpUrl.parse(gatewayUrl.get() + cid);
        if (url == null) {
            throw new StoreUnavailableException("Invalid IPFS gateway URL: " + gatewayUrl.get(), false);
        }
        return execute(new Request.Builder().url(url).get().build(), response -> response.body().bytes());
    }

    private void pin(String cid) {
        if (!pinAfterAdd) {
            return;
        }
        HttpUrl url = HttpUrl.get(apiUrl("/api/v0/pin/add")).newBuilder()
                .addQueryParameter("arg", cid)
                .build();
        try {
            execute(withAuth(new Request.Builder().url(url).post(EMPTY_BODY)).build(), response -> null);
        } catch (BlobStoreException e) {
            LOG.warn("Failed to pin {}: {}", cid, e.getMessage());
        }
    }

    private Request.Builder withAuth(Request.Builder builder) {
        authHeader.ifPresent(value -> builder.header("Authorization", value));
        return builder;
    }

    private String apiUrl(String path) {
        return apiBaseUrl + path;
    }

    static Optional<String> authHeaderFrom(EnvSettings settings) {
        Optional<String> bearer = settings.get("IPFS_API_BEARER_TOKEN");
        if (bearer.isPresent()) {
            return Optional.of("Bearer " + bearer.get().trim());
        }
        return settings.get("IPFS_API_BASIC_AUTH").map(basic ->
                "Basic " + Base64.getEncoder().encodeToString(basic.getBytes(StandardCharsets.UTF_8)));
    }

    private static String resolveUrl(String ipfsUrl) {
        if (ipfsUrl.startsWith("http://") || ipfsUrl.startsWith("https://")) {
            return ipfsUrl;
        }
        // multiaddr form, e.g. /ip4/127.0.0.1/tcp/5001
        return "http://" + ipfsUrl.replace("/ip4/", "").replace("/tcp/", ":").replace("/", "");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
