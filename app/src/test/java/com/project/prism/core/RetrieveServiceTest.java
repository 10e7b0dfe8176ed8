package com.project.prism.core;

import com.project.prism.crypto.AuthenticatedCipher;
import com.project.prism.crypto.AuthenticationFailedException;
import com.project.prism.crypto.ContentFingerprinter;
import com.project.prism.crypto.DataKey;
import com.project.prism.crypto.TamperDetectedException;
import com.project.prism.ipfs.LocalDirectoryBlobStore;
import com.project.prism.ledger.InMemoryAccessLedger;
import com.project.prism.ledger.NotAuthorizedException;
import com.project.prism.ledger.OwnerId;
import com.project.prism.ledger.Signer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetrieveServiceTest {

    private static final OwnerId PATIENT = OwnerId.of("patient-1");
    private static final OwnerId DOCTOR = OwnerId.of("doctor-1");
    private static final byte[] VCF = "##fileformat=VCFv4.2\nchr7\t117559590\trs113993960\tATCT\tA\n"
            .getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path dir;

    private final AuthenticatedCipher cipher = new AuthenticatedCipher();
    private final ContentFingerprinter fingerprinter = new ContentFingerprinter();
    private LocalDirectoryBlobStore store;
    private InMemoryAccessLedger ledger;
    private RetrieveService retrieveService;
    private DataKey key;
    private UploadReceipt receipt;

    @BeforeEach
    void setUp() throws Exception {
        store = new LocalDirectoryBlobStore(dir.resolve("blobs"));
        ledger = new InMemoryAccessLedger();
        retrieveService = new RetrieveService(cipher, fingerprinter, store, ledger);
        key = cipher.generateKey();

        Signer patient = Signer.of(PATIENT);
        ledger.registerOwner(patient);
        receipt = new UploadService(cipher, fingerprinter, store, ledger).upload(patient, VCF, key);
        ledger.requestAccess(Signer.of(DOCTOR), PATIENT);
        ledger.approve(patient, DOCTOR);
    }

    private void tamper() throws Exception {
        Path blob = store.directory().resolve(receipt.contentId());
        byte[] bytes = Files.readAllBytes(blob);
        bytes[bytes.length / 2] ^= 0x01;
        Files.write(blob, bytes);
    }

    @Test
    void approvedRequesterGetsPlaintext() throws Exception {
        assertArrayEquals(VCF, retrieveService.retrieve(PATIENT, DOCTOR, key));
        assertArrayEquals(VCF, retrieveService.retrieve(PATIENT, PATIENT, key));
    }

    @Test
    void tamperedBlobIsRejectedBeforeDecryption() throws Exception {
        tamper();

        TamperDetectedException e = assertThrows(TamperDetectedException.class,
                () -> retrieveService.retrieve(PATIENT, DOCTOR, key));
        assertEquals(receipt.fingerprint(), e.expected());
    }

    @Test
    void everySingleByteFlipIsDetected() throws Exception {
        Path blob = store.directory().resolve(receipt.contentId());
        byte[] original = Files.readAllBytes(blob);

        for (int i = 0; i < original.length; i++) {
            byte[] altered = original.clone();
            altered[i] ^= (byte) (1 << (i % 8));
            Files.write(blob, altered);
            int position = i;
            assertThrows(TamperDetectedException.class, () -> retrieveService.retrieve(PATIENT, DOCTOR, key),
                    () -> "flip at byte " + position + " went unnoticed");
        }

        Files.write(blob, original);
        assertArrayEquals(VCF, retrieveService.retrieve(PATIENT, DOCTOR, key));
    }

    @Test
    void wrongKeyFailsAuthentication() {
        assertThrows(AuthenticationFailedException.class,
                () -> retrieveService.retrieve(PATIENT, DOCTOR, cipher.generateKey()));
    }

    @Test
    void revokedRequesterIsNotAuthorized() {
        ledger.revoke(Signer.of(PATIENT), DOCTOR);

        assertThrows(NotAuthorizedException.class, () -> retrieveService.retrieve(PATIENT, DOCTOR, key));
        assertThrows(NotAuthorizedException.class, () -> retrieveService.verify(PATIENT, DOCTOR));
    }

    @Test
    void verifyReportsWithoutKey() throws Exception {
        IntegrityReport clean = retrieveService.verify(PATIENT, DOCTOR);
        assertTrue(clean.verified());
        assertEquals("INTEGRITY_VERIFIED", clean.status());
        assertEquals(receipt.size(), clean.size());

        tamper();
        IntegrityReport tampered = retrieveService.verify(PATIENT, DOCTOR);
        assertFalse(tampered.verified());
        assertTrue(tampered.describe().startsWith("TAMPERED cid=" + receipt.contentId()));
    }

    @Test
    void retrieveToFileWritesOnlyOnSuccess() throws Exception {
        Path output = dir.resolve("out/decrypted.vcf");

        retrieveService.retrieveToFile(PATIENT, DOCTOR, key, output);
        assertArrayEquals(VCF, Files.readAllBytes(output));

        Path failed = dir.resolve("out/failed.vcf");
        assertThrows(AuthenticationFailedException.class,
                () -> retrieveService.retrieveToFile(PATIENT, DOCTOR, cipher.generateKey(), failed));
        assertFalse(Files.exists(failed));
        try (Stream<Path> files = Files.list(dir.resolve("out"))) {
            assertEquals(1, files.count());
        }
    }
}
