package com.project.prism.ipfs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.project.prism.config.ConfigurationException;
import com.project.prism.config.EnvSettings;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Blob store backed by the Pinata pinning service. Writes go through the pinning API,
 * reads through the (unauthenticated) gateway.
 */
public class PinataBlobStore extends HttpBlobStore {
    private static final Logger LOG = LoggerFactory.getLogger(PinataBlobStore.class);
    private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String DEFAULT_API_URL = "https://api.pinata.cloud";
    public static final String DEFAULT_GATEWAY = "https://gateway.pinata.cloud/ipfs/";
    static final int PAGE_LIMIT = 100;

    private final String apiBaseUrl;
    private final String gatewayUrl;
    private final Map<String, String> authHeaders;

    public PinataBlobStore(String apiBaseUrl, String gatewayUrl, Map<String, String> authHeaders,
                           HttpStoreOptions options) {
        super("Pinata", options);
        this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        this.gatewayUrl = gatewayUrl.endsWith("/") ? gatewayUrl : gatewayUrl + "/";
        this.authHeaders = Map.copyOf(authHeaders);
    }

    public static Map<String, String> jwtHeaders(String jwt) {
        return Map.of("Authorization", "Bearer " + jwt.trim());
    }

    public static Map<String, String> apiKeyHeaders(String apiKey, String secret) {
        return Map.of("pinata_api_key", apiKey, "pinata_secret_api_key", secret);
    }

    /**
     * Reads {@code PINATA_JWT}, or {@code PINATA_API_KEY} with {@code PINATA_SECRET}, plus the optional
     * {@code PINATA_API_URL} and {@code IPFS_GATEWAY}.
     *
     * @throws ConfigurationException if no credentials are configured
     */
    public static PinataBlobStore fromSettings(EnvSettings settings) {
        Map<String, String> headers = settings.get("PINATA_JWT")
                .map(PinataBlobStore::jwtHeaders)
                .orElseGet(() -> {
                    var key = settings.get("PINATA_API_KEY");
                    var secret = settings.get("PINATA_SECRET");
                    if (key.isEmpty() || secret.isEmpty()) {
                        throw new ConfigurationException(
                                "PINATA_JWT, or PINATA_API_KEY and PINATA_SECRET, must be set");
                    }
                    return apiKeyHeaders(key.get(), secret.get());
                });
        return new PinataBlobStore(
                settings.get("PINATA_API_URL", DEFAULT_API_URL),
                settings.get("IPFS_GATEWAY", DEFAULT_GATEWAY),
                headers,
                HttpStoreOptions.fromSettings(settings));
    }

    @Override
    public String put(byte[] bytes, String name) throws BlobStoreException {
        return put(bytes, name, Map.of());
    }

    @Override
    public String put(byte[] bytes, String name, Map<String, String> metadata) throws BlobStoreException {
        RequestBody body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("file", name, RequestBody.create(bytes, OCTET_STREAM))
                .addFormDataPart("pinataMetadata", pinataMetadata(name, metadata))
                .build();
        Request request = authorized(new Request.Builder()
                .url(apiBaseUrl + "/pinning/pinFileToIPFS")
                .post(body))
                .build();

        String cid = execute(request, response -> {
            JsonNode hash = MAPPER.readTree(response.body().string()).get("IpfsHash");
            if (hash == null || hash.asText().isBlank()) {
                throw new StoreUnavailableException("Pinata response carried no IpfsHash", false);
            }
            return hash.asText();
        });
        LOG.info("Pinned {} ({} bytes) as {}", name, bytes.length, cid);
        return cid;
    }

    @Override
    public byte[] get(String contentId) throws BlobStoreException {
        String cid = ContentIds.normalize(contentId);
        Request request = new Request.Builder().url(gatewayUrl + cid).get().build();
        byte[] data = execute(request, response -> response.body().bytes());
        LOG.debug("Downloaded {} bytes for {}", data.length, cid);
        return data;
    }

    @Override
    public void unpin(String contentId) throws BlobStoreException {
        String cid = ContentIds.normalize(contentId);
        Request request = authorized(new Request.Builder()
                .url(apiBaseUrl + "/pinning/unpin/" + cid)
                .delete())
                .build();
        execute(request, response -> null);
        LOG.info("Unpinned {}", cid);
    }

    /**
     * Every pinned CID on the account, following {@code pageOffset} until a short page comes back.
     */
    @Override
    public Set<String> list() throws BlobStoreException {
        Set<String> cids = new TreeSet<>();
        int offset = 0;
        while (true) {
            HttpUrl url = HttpUrl.get(apiBaseUrl + "/data/pinList").newBuilder()
                    .addQueryParameter("status", "pinned")
                    .addQueryParameter("pageLimit", Integer.toString(PAGE_LIMIT))
                    .addQueryParameter("pageOffset", Integer.toString(offset))
                    .build();
            int rows = execute(authorized(new Request.Builder().url(url).get()).build(), response -> {
                JsonNode page = MAPPER.readTree(response.body().string()).path("rows");
                for (JsonNode row : page) {
                    String hash = row.path("ipfs_pin_hash").asText("");
                    if (!hash.isEmpty()) {
                        cids.add(hash);
                    }
                }
                return page.size();
            });
            if (rows < PAGE_LIMIT) {
                return cids;
            }
            offset += rows;
        }
    }

    @Override
    public boolean testAuth() {
        Request request = authorized(new Request.Builder()
                .url(apiBaseUrl + "/data/testAuthentication")
                .get())
                .build();
        try {
            return execute(request, response -> true);
        } catch (BlobStoreException e) {
            LOG.error("Pinata auth test failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Pinata reports plan limits as 403 with a message naming the limit.
     */
    @Override
    protected BlobStoreException classify(int code, String body, Request request) {
        if (code == 403 && mentions(body, "limit", "quota", "exceeded")) {
            return new QuotaExceededException("Pinata plan limit reached: " + body);
        }
        return super.classify(code, body, request);
    }

    static String pinataMetadata(String name, Map<String, String> metadata) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("name", name);
        if (!metadata.isEmpty()) {
            ObjectNode keyValues = node.putObject("keyvalues");
            new TreeMap<>(metadata).forEach(keyValues::put);
        }
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize Pinata metadata", e);
        }
    }

    private Request.Builder authorized(Request.Builder builder) {
        authHeaders.forEach(builder::header);
        return builder;
    }
}
