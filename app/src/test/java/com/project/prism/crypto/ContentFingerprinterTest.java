package com.project.prism.crypto;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContentFingerprinterTest {

    private static final String BLAKE3_EMPTY = "af1349b9f5f9a1a6a0404dea36dcc9499bcb25c9adc112b7cc9a93cae41f3262";

    private final ContentFingerprinter fingerprinter = new ContentFingerprinter();

    @Test
    void matchesPublishedBlake3VectorForEmptyInput() {
        assertEquals(BLAKE3_EMPTY, fingerprinter.hash(new byte[0]).toHex());
    }

    @Test
    void streamingHashEqualsWholeBufferHash() throws Exception {
        byte[] data = new byte[3 * ContentFingerprinter.CHUNK_SIZE + 123];
        new Random(42).nextBytes(data);

        assertEquals(fingerprinter.hash(data), fingerprinter.hashStream(new ByteArrayInputStream(data)));
    }

    @Test
    void singleByteChangeChangesFingerprint() {
        byte[] data = "ciphertext".getBytes();
        Fingerprint original = fingerprinter.hash(data);
        data[0] ^= 1;

        assertNotEquals(original, fingerprinter.hash(data));
    }

    @Test
    void verifyComparesAgainstExpectedDigest() {
        byte[] data = "blob".getBytes();
        Fingerprint expected = fingerprinter.hash(data);

        assertTrue(fingerprinter.verify(data, expected));
        assertFalse(fingerprinter.verify("blob!".getBytes(), expected));
    }

    @Test
    void hexFormAcceptsOptionalPrefixAndRejectsWrongLength() {
        Fingerprint fingerprint = Fingerprint.fromHex("0x" + BLAKE3_EMPTY);

        assertEquals(BLAKE3_EMPTY, fingerprint.toHex());
        assertEquals("af1349b9f5f9a1a6...", fingerprint.abbreviated());
        assertThrows(IllegalArgumentException.class, () -> Fingerprint.fromHex("abcd"));
        assertThrows(IllegalArgumentException.class, () -> Fingerprint.fromHex("blake3-hash-hex"));
    }
}
