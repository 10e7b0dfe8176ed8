package com.project.prism;

import com.project.prism.core.IntegrityReport;
import com.project.prism.core.RetrieveService;
import com.project.prism.core.UploadReceipt;
import com.project.prism.core.UploadService;
import com.project.prism.crypto.AuthenticatedCipher;
import com.project.prism.crypto.ContentFingerprinter;
import com.project.prism.crypto.DataKey;
import com.project.prism.ipfs.LocalDirectoryBlobStore;
import com.project.prism.keystore.KeyCustodian;
import com.project.prism.ledger.AuditTrail;
import com.project.prism.ledger.InMemoryAccessLedger;
import com.project.prism.ledger.LedgerEvent;
import com.project.prism.ledger.NotAuthorizedException;
import com.project.prism.ledger.OwnerId;
import com.project.prism.ledger.PointerRetention;
import com.project.prism.ledger.Signer;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Arrays;

/**
 * Offline walk-through of the custody pipeline: a local blob directory and an in-memory ledger
 * stand in for IPFS and the chain.
 */
public class App {

    static final String SAMPLE_VCF = String.join("\n",
            "##fileformat=VCFv4.2",
            "#CHROM\tPOS\tID\tREF\tALT\tQUAL\tFILTER\tINFO",
            "1\t69511\trs2691305\tA\tG\t50\tPASS\t.",
            "7\t117559590\trs113993960\tATCT\tA\t60\tPASS\t.",
            "");

    public static void main(String[] args) {
        try {
            Path workDir = args.length > 0 ? Path.of(args[0]) : Files.createTempDirectory("prism-demo");
            boolean ok = run(workDir, System.out);
            System.exit(ok ? 0 : 1);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    static boolean run(Path workDir, PrintStream out) throws Exception {
        Signer patient = Signer.of("0x" + "a1".repeat(20));
        Signer doctor = Signer.of("0x" + "d0".repeat(20));
        char[] passphrase = "correct horse battery staple".toCharArray();

        AuthenticatedCipher cipher = new AuthenticatedCipher();
        ContentFingerprinter fingerprinter = new ContentFingerprinter();
        LocalDirectoryBlobStore blobs = new LocalDirectoryBlobStore(workDir.resolve("blobs"));
        InMemoryAccessLedger ledger = new InMemoryAccessLedger(PointerRetention.LATEST_ONLY, Clock.systemUTC());
        KeyCustodian custodian = new KeyCustodian(workDir.resolve("keystore.json"));
        UploadService uploads = new UploadService(cipher, fingerprinter, blobs, ledger);
        RetrieveService retrievals = new RetrieveService(cipher, fingerprinter, blobs, ledger);

        out.println("[1/6] Registering patient " + patient.identity());
        ledger.registerOwner(patient);

        out.println("[2/6] Generating data key and storing it in " + custodian.keystorePath());
        try (DataKey generated = cipher.generateKey()) {
            custodian.save(patient.identity(), generated, passphrase);
        }

        byte[] vcf = SAMPLE_VCF.getBytes(StandardCharsets.UTF_8);
        UploadReceipt receipt;
        try (DataKey key = custodian.load(patient.identity(), passphrase)) {
            out.println("[3/6] Encrypting and uploading " + vcf.length + " bytes");
            receipt = uploads.upload(patient, vcf, key);
        }
        out.println("      CID:    " + receipt.contentId());
        out.println("      BLAKE3: " + receipt.fingerprint().toHex());

        out.println("[4/6] Doctor " + doctor.identity() + " requests access; patient approves");
        ledger.requestAccess(doctor, patient.identity());
        ledger.approve(patient, doctor.identity());

        IntegrityReport report = retrievals.verify(patient.identity(), doctor.identity());
        out.println("[5/6] " + report.describe());
        boolean roundTrip;
        try (DataKey shared = custodian.load(patient.identity(), passphrase)) {
            byte[] plaintext = retrievals.retrieve(patient.identity(), doctor.identity(), shared);
            roundTrip = Arrays.equals(vcf, plaintext);
        }
        out.println("      Decrypted copy matches original: " + roundTrip);

        out.println("[6/6] Patient revokes access");
        ledger.revoke(patient, doctor.identity());
        boolean denied;
        try {
            ledger.readPointer(patient.identity(), doctor.identity());
            denied = false;
        } catch (NotAuthorizedException e) {
            denied = true;
            out.println("      Doctor is denied: " + e.getMessage());
        }

        out.println();
        out.println("Audit trail:");
        for (LedgerEvent event : AuditTrail.of(ledger).events()) {
            out.println("  " + AuditTrail.describe(event));
        }
        return report.verified() && roundTrip && denied;
    }
}
