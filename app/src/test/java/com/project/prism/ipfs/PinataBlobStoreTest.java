package com.project.prism.ipfs;

import com.project.prism.config.ConfigurationException;
import com.project.prism.config.EnvSettings;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PinataBlobStoreTest {

    private static final String CID = "bafybeigdyrzt5sfp7udm7hu76uh7y26nf3efuylqabf3oclgtqy55fbzdi";

    private MockWebServer server;
    private PinataBlobStore store;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        store = new PinataBlobStore(
                server.url("/").toString(),
                server.url("/ipfs/").toString(),
                PinataBlobStore.apiKeyHeaders("key-123", "secret-456"),
                new HttpStoreOptions(3, 0, Duration.ofSeconds(5), false, Optional.empty()));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private RecordedRequest take() throws InterruptedException {
        return server.takeRequest(1, TimeUnit.SECONDS);
    }

    @Test
    void putPinsFileWithMetadata() throws Exception {
        server.enqueue(new MockResponse().setBody(
                "{\"IpfsHash\":\"" + CID + "\",\"PinSize\":3,\"Timestamp\":\"2026-01-01T00:00:00Z\"}"));

        String cid = store.put(new byte[]{1, 2, 3}, "patient_0xab.vcf.enc",
                Map.of("type", "encrypted_genomic_data", "blake3_hash", "ff00"));

        assertEquals(CID, cid);
        RecordedRequest request = take();
        assertEquals("POST", request.getMethod());
        assertEquals("/pinning/pinFileToIPFS", request.getPath());
        assertEquals("key-123", request.getHeader("pinata_api_key"));
        assertEquals("secret-456", request.getHeader("pinata_secret_api_key"));
        String body = request.getBody().readUtf8();
        assertTrue(body.contains("name=\"pinataMetadata\""));
        assertTrue(body.contains(
                "{\"name\":\"patient_0xab.vcf.enc\",\"keyvalues\":{\"blake3_hash\":\"ff00\",\"type\":\"encrypted_genomic_data\"}}"));
    }

    @Test
    void jwtCredentialsUseBearerHeader() throws Exception {
        PinataBlobStore jwtStore = new PinataBlobStore(server.url("/").toString(), server.url("/ipfs/").toString(),
                PinataBlobStore.jwtHeaders("eyJhbGciOi"), HttpStoreOptions.defaults());
        server.enqueue(new MockResponse().setBody("{\"message\":\"Congratulations!\"}"));

        assertTrue(jwtStore.testAuth());
        RecordedRequest request = take();
        assertEquals("/data/testAuthentication", request.getPath());
        assertEquals("Bearer eyJhbGciOi", request.getHeader("Authorization"));
    }

    @Test
    void getReadsThroughGatewayWithoutCredentials() throws Exception {
        server.enqueue(new MockResponse().setBody(new Buffer().write(new byte[]{5, 6})));

        assertArrayEquals(new byte[]{5, 6}, store.get("ipfs://" + CID));
        RecordedRequest request = take();
        assertEquals("/ipfs/" + CID, request.getPath());
        assertNull(request.getHeader("pinata_api_key"));
    }

    @Test
    void missingContentIsNotFoundAndNotRetried() {
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThrows(BlobNotFoundException.class, () -> store.get(CID));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void unpinSendsDelete() throws Exception {
        server.enqueue(new MockResponse().setBody("OK"));

        store.unpin(CID);

        RecordedRequest request = take();
        assertEquals("DELETE", request.getMethod());
        assertEquals("/pinning/unpin/" + CID, request.getPath());
    }

    @Test
    void listFollowsPages() throws Exception {
        StringBuilder firstPage = new StringBuilder("{\"count\":101,\"rows\":[");
        for (int i = 0; i < PinataBlobStore.PAGE_LIMIT; i++) {
            firstPage.append(i == 0 ? "" : ",").append("{\"ipfs_pin_hash\":\"QmHash").append(1000 + i).append("\"}");
        }
        firstPage.append("]}");
        server.enqueue(new MockResponse().setBody(firstPage.toString()));
        server.enqueue(new MockResponse().setBody("{\"count\":101,\"rows\":[{\"ipfs_pin_hash\":\"" + CID + "\"}]}"));

        Set<String> cids = store.list();

        assertEquals(101, cids.size());
        assertTrue(cids.contains(CID));
        assertEquals("/data/pinList?status=pinned&pageLimit=100&pageOffset=0", take().getPath());
        assertEquals("/data/pinList?status=pinned&pageLimit=100&pageOffset=100", take().getPath());
    }

    @Test
    void planLimitIsQuota() {
        server.enqueue(new MockResponse().setResponseCode(403)
                .setBody("{\"error\":\"Pin limit exceeded for your plan\"}"));

        assertThrows(QuotaExceededException.class, () -> store.put(new byte[]{1}, "blob"));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void rejectedCredentialsAreNotRetried() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"Invalid API key\"}"));

        StoreUnavailableException e = assertThrows(StoreUnavailableException.class,
                () -> store.put(new byte[]{1}, "blob"));
        assertFalse(e.isRetryable());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void settingsWithoutCredentialsAreRejected() {
        assertThrows(ConfigurationException.class, () -> PinataBlobStore.fromSettings(EnvSettings.of(Map.of())));
        assertThrows(ConfigurationException.class,
                () -> PinataBlobStore.fromSettings(EnvSettings.of(Map.of("PINATA_API_KEY", "only-key"))));
    }

    @Test
    void blobStoreFactoryHonoursSelection() {
        assertTrue(BlobStores.fromSettings(EnvSettings.of(Map.of("BLOB_STORE", "local"))) instanceof LocalDirectoryBlobStore);
        assertTrue(BlobStores.fromSettings(EnvSettings.of(Map.of("BLOB_STORE", "pinata", "PINATA_JWT", "jwt")))
                instanceof PinataBlobStore);
        assertThrows(ConfigurationException.class,
                () -> BlobStores.fromSettings(EnvSettings.of(Map.of("BLOB_STORE", "s3"))));
    }
}
