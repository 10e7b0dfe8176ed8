package com.project.prism.ipfs;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KuboBlobStoreTest {

    private static final String CID = "QmYwAPJzv5CZsnA625s3Xf2nemtYgPpHdWEz79ojWnPbdG";

    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private KuboBlobStore store(int retries) {
        return store(retries, Optional.empty());
    }

    private KuboBlobStore store(int retries, Optional<String> gateway) {
        HttpStoreOptions options = new HttpStoreOptions(retries, 0, Duration.ofSeconds(5), false, Optional.empty());
        return new KuboBlobStore(server.url("/").toString(), gateway, Optional.of("Bearer t0ken"), true, options);
    }

    private RecordedRequest take() throws InterruptedException {
        return server.takeRequest(1, TimeUnit.SECONDS);
    }

    @Nested
    @DisplayName("put")
    class Put {

        @Test
        void addsThenPins() throws Exception {
            server.enqueue(new MockResponse().setBody("{\"Name\":\"blob\",\"Hash\":\"" + CID + "\",\"Size\":\"12\"}"));
            server.enqueue(new MockResponse().setBody("{\"Pins\":[\"" + CID + "\"]}"));

            assertEquals(CID, store(1).put(new byte[]{1, 2, 3}, "patient_x.vcf.enc"));

            RecordedRequest add = take();
            assertEquals("/api/v0/add", add.getPath());
            assertEquals("Bearer t0ken", add.getHeader("Authorization"));
            assertTrue(add.getBody().readUtf8().contains("patient_x.vcf.enc"));
            RecordedRequest pin = take();
            assertEquals("/api/v0/pin/add?arg=" + CID, pin.getPath());
        }

        @Test
        void failedPinDoesNotFailTheUpload() throws Exception {
            server.enqueue(new MockResponse().setBody("{\"Hash\":\"" + CID + "\"}"));
            server.enqueue(new MockResponse().setResponseCode(500).setBody("{\"Message\":\"pin failed\"}"));

            assertEquals(CID, store(1).put(new byte[]{1}, "blob"));
        }

        @Test
        void retriesServerErrorsWithBackoff() throws Exception {
            server.enqueue(new MockResponse().setResponseCode(503));
            server.enqueue(new MockResponse().setResponseCode(502));
            server.enqueue(new MockResponse().setBody("{\"Hash\":\"" + CID + "\"}"));
            server.enqueue(new MockResponse().setBody("{}"));

            assertEquals(CID, store(3).put(new byte[]{1}, "blob"));
            assertEquals(4, server.getRequestCount());
        }

        @Test
        void quotaErrorsAreNotRetried() {
            server.enqueue(new MockResponse().setResponseCode(413).setBody("request entity too large"));

            QuotaExceededException e = assertThrows(QuotaExceededException.class,
                    () -> store(3).put(new byte[]{1}, "blob"));
            assertFalse(e.isRetryable());
            assertEquals(1, server.getRequestCount());
        }

        @Test
        void exhaustedRetriesSurfaceAsUnavailable() {
            for (int i = 0; i < 3; i++) {
                server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
            }

            StoreUnavailableException e = assertThrows(StoreUnavailableException.class,
                    () -> store(3).put(new byte[]{1}, "blob"));
            assertTrue(e.isRetryable());
            assertEquals(3, server.getRequestCount());
        }
    }

    @Nested
    @DisplayName("get")
    class Get {

        @Test
        void catsByContentIdAndStripsUriPrefix() throws Exception {
            server.enqueue(new MockResponse().setBody(new Buffer().write(new byte[]{9, 8, 7})));

            assertArrayEquals(new byte[]{9, 8, 7}, store(1).get("ipfs://" + CID));
            assertEquals("/api/v0/cat?arg=" + CID, take().getPath());
        }

        @Test
        void missingBlockIsNotFound() {
            server.enqueue(new MockResponse().setResponseCode(500)
                    .setBody("{\"Message\":\"block was not found locally (offline)\",\"Code\":0}"));

            BlobNotFoundException e = assertThrows(BlobNotFoundException.class, () -> store(3).get(CID));
            assertEquals(CID, e.contentId());
            assertEquals(1, server.getRequestCount());
        }

        @Test
        void fallsBackToGateway() throws Exception {
            server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
            server.enqueue(new MockResponse().setBody(new Buffer().write(new byte[]{4, 2})));

            byte[] data = store(1, Optional.of(server.url("/ipfs").toString())).get(CID);

            assertArrayEquals(new byte[]{4, 2}, data);
            take();
            RecordedRequest gateway = take();
            assertEquals("/ipfs/" + CID, gateway.getPath());
            assertNull(gateway.getHeader("Authorization"));
        }

        @Test
        void rejectsSuspiciousContentIds() {
            assertThrows(IllegalArgumentException.class, () -> store(1).get("../../etc/passwd"));
            assertEquals(0, server.getRequestCount());
        }
    }

    @Test
    void unpinOfUnknownPinIsNotFound() {
        server.enqueue(new MockResponse().setResponseCode(500)
                .setBody("{\"Message\":\"not pinned or pinned indirectly\",\"Code\":0,\"Type\":\"error\"}"));

        assertThrows(BlobNotFoundException.class, () -> store(1).unpin(CID));
    }

    @Test
    void listReadsRecursivePins() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"Keys\":{\"" + CID + "\":{\"Type\":\"recursive\"},"
                + "\"QmOther1234567890\":{\"Type\":\"recursive\"}}}"));

        assertEquals(Set.of(CID, "QmOther1234567890"), store(1).list());
        assertEquals("/api/v0/pin/ls?type=recursive", take().getPath());
    }

    @Test
    void testAuthReflectsNodeAvailability() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"Version\":\"0.27.0\"}"));
        server.enqueue(new MockResponse().setResponseCode(401));

        KuboBlobStore store = store(1);
        assertTrue(store.testAuth());
        assertFalse(store.testAuth());
    }

    @Test
    void circuitOpensAfterRepeatedFailures() throws Exception {
        KuboBlobStore store = store(1);
        for (int i = 0; i < 5; i++) {
            server.enqueue(new MockResponse().setResponseCode(503));
            assertThrows(StoreUnavailableException.class, () -> store.put(new byte[]{1}, "blob"));
        }

        assertEquals(CircuitBreaker.State.OPEN, store.circuitState());
        assertThrows(StoreUnavailableException.class, () -> store.put(new byte[]{1}, "blob"));
        assertEquals(5, server.getRequestCount());
    }
}
