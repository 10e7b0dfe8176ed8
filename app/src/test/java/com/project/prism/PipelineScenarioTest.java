package com.project.prism;

import com.project.prism.core.IntegrityReport;
import com.project.prism.core.RetrieveService;
import com.project.prism.core.UploadReceipt;
import com.project.prism.core.UploadService;
import com.project.prism.crypto.AuthenticatedCipher;
import com.project.prism.crypto.ContentFingerprinter;
import com.project.prism.crypto.DataKey;
import com.project.prism.crypto.TamperDetectedException;
import com.project.prism.ipfs.LocalDirectoryBlobStore;
import com.project.prism.keystore.KeyCustodian;
import com.project.prism.ledger.AccessStatus;
import com.project.prism.ledger.AuditTrail;
import com.project.prism.ledger.InMemoryAccessLedger;
import com.project.prism.ledger.LedgerState;
import com.project.prism.ledger.NotAuthorizedException;
import com.project.prism.ledger.OwnerId;
import com.project.prism.ledger.PointerRetention;
import com.project.prism.ledger.Signer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Owner and requester sharing one blob store and ledger, with the key handed over through the keystore.
 */
class PipelineScenarioTest {

    private static final Signer PATIENT = Signer.of("0x" + "a1".repeat(20));
    private static final Signer DOCTOR = Signer.of("0x" + "d0".repeat(20));
    private static final char[] PASSPHRASE = "correct horse battery staple".toCharArray();

    @TempDir
    Path dir;

    private final AuthenticatedCipher cipher = new AuthenticatedCipher();
    private final ContentFingerprinter fingerprinter = new ContentFingerprinter();
    private LocalDirectoryBlobStore blobs;
    private InMemoryAccessLedger ledger;
    private KeyCustodian custodian;
    private UploadService uploads;
    private RetrieveService retrievals;

    @BeforeEach
    void setUp() {
        blobs = new LocalDirectoryBlobStore(dir.resolve("blobs"));
        ledger = new InMemoryAccessLedger();
        custodian = new KeyCustodian(dir.resolve("keystore.json"));
        uploads = new UploadService(cipher, fingerprinter, blobs, ledger);
        retrievals = new RetrieveService(cipher, fingerprinter, blobs, ledger);
    }

    private UploadReceipt publish(byte[] data) throws Exception {
        OwnerId owner = PATIENT.identity();
        try (DataKey key = cipher.generateKey()) {
            custodian.save(owner, key, PASSPHRASE);
            ledger.registerOwner(PATIENT);
            return uploads.upload(PATIENT, data, key);
        }
    }

    private void grant() {
        ledger.requestAccess(DOCTOR, PATIENT.identity());
        ledger.approve(PATIENT, DOCTOR.identity());
    }

    @Test
    void mebibyteRoundTrip() throws Exception {
        byte[] data = new byte[1024 * 1024];
        new Random(42).nextBytes(data);
        publish(data);
        grant();

        try (DataKey key = custodian.load(PATIENT.identity(), PASSPHRASE)) {
            assertArrayEquals(data, retrievals.retrieve(PATIENT.identity(), DOCTOR.identity(), key));
        }
    }

    @Test
    void tamperingIsCaughtByFingerprint() throws Exception {
        UploadReceipt receipt = publish(App.SAMPLE_VCF.getBytes());
        grant();
        Path blob = blobs.directory().resolve(receipt.contentId());
        byte[] bytes = Files.readAllBytes(blob);
        bytes[bytes.length - 1] ^= (byte) 0x80;
        Files.write(blob, bytes);

        IntegrityReport report = retrievals.verify(PATIENT.identity(), DOCTOR.identity());
        assertFalse(report.verified());
        try (DataKey key = custodian.load(PATIENT.identity(), PASSPHRASE)) {
            assertThrows(TamperDetectedException.class,
                    () -> retrievals.retrieve(PATIENT.identity(), DOCTOR.identity(), key));
        }
    }

    @Test
    void revokedAccessCanBeRequestedAndGrantedAgain() throws Exception {
        publish(App.SAMPLE_VCF.getBytes());
        grant();
        ledger.revoke(PATIENT, DOCTOR.identity());

        try (DataKey key = custodian.load(PATIENT.identity(), PASSPHRASE)) {
            assertThrows(NotAuthorizedException.class,
                    () -> retrievals.retrieve(PATIENT.identity(), DOCTOR.identity(), key));

            grant();
            assertArrayEquals(App.SAMPLE_VCF.getBytes(),
                    retrievals.retrieve(PATIENT.identity(), DOCTOR.identity(), key));
        }

        LedgerState replayed = AuditTrail.of(ledger).replay(PointerRetention.LATEST_ONLY);
        assertEquals(AccessStatus.APPROVED, replayed.status(PATIENT.identity(), DOCTOR.identity()));
        assertEquals(7, ledger.events().size());
    }
}
