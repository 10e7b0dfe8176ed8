package com.project.prism;

import com.project.prism.config.EnvSettings;
import com.project.prism.core.PublishFailedException;
import com.project.prism.core.UploadReceipt;
import com.project.prism.crypto.DataKey;
import com.project.prism.ledger.AccessGrant;
import com.project.prism.ledger.AccessStatus;
import com.project.prism.ledger.AuditTrail;
import com.project.prism.ledger.InMemoryAccessLedger;
import com.project.prism.ledger.LedgerEvent;
import com.project.prism.ledger.OwnerId;
import com.project.prism.ledger.Signer;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Set;

/**
 * Owner-side commands: key custody, registration, upload and grant management.
 * <p>
 * Usage: java PatientApp &lt;command&gt; [args]
 * <pre>
 *   keygen &lt;owner&gt; &lt;passphrase&gt;   generate and store a data key
 *   export-key &lt;owner&gt; &lt;passphrase&gt; print a stored key as hex, for sharing out of band
 *   register                       register the signer as an owner
 *   upload &lt;file&gt; &lt;passphrase&gt;     encrypt, store and publish a file
 *   approve &lt;requester&gt;            grant a pending request
 *   revoke &lt;requester&gt;             withdraw a grant
 *   status &lt;requester&gt;             show a requester's access status
 *   keys                           list owners in the keystore
 *   forget &lt;owner&gt;                 delete an owner's key (irreversible)
 *   audit                          show ledger events involving the signer
 * </pre>
 * Ledger commands sign with {@code ETH_PRIVATE_KEY}.
 */
public class PatientApp {

    public static void main(String[] args) {
        int code;
        try (PrismContext context = PrismContext.fromSettings(EnvSettings.fromEnv())) {
            code = run(args, context, System.out, System.err);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            code = 1;
        }
        System.exit(code);
    }

    static int run(String[] args, PrismContext context, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            printUsage(err);
            return 1;
        }
        try {
            switch (args[0]) {
                case "keygen":
                    requireArgs(args, 3);
                    return keygen(context, OwnerId.of(args[1]), args[2].toCharArray(), out);
                case "export-key":
                    requireArgs(args, 3);
                    try (DataKey key = context.custodian().load(OwnerId.of(args[1]), args[2].toCharArray())) {
                        out.println(key.toHex());
                    }
                    return 0;
                case "register":
                    context.ledger().registerOwner(context.signer());
                    out.println("Registered " + context.signer().identity());
                    return 0;
                case "upload":
                    requireArgs(args, 3);
                    return upload(context, Path.of(args[1]), args[2].toCharArray(), out, err);
                case "approve":
                    requireArgs(args, 2);
                    context.ledger().approve(context.signer(), OwnerId.of(args[1]));
                    out.println("Approved access for " + OwnerId.of(args[1]));
                    return 0;
                case "revoke":
                    requireArgs(args, 2);
                    context.ledger().revoke(context.signer(), OwnerId.of(args[1]));
                    out.println("Revoked access for " + OwnerId.of(args[1]));
                    return 0;
                case "status":
                    return status(context, args, out);
                case "keys":
                    Set<OwnerId> owners = context.custodian().list();
                    if (owners.isEmpty()) {
                        out.println("Keystore is empty: " + context.custodian().keystorePath());
                    }
                    owners.forEach(out::println);
                    return 0;
                case "forget":
                    requireArgs(args, 2);
                    boolean deleted = context.custodian().delete(OwnerId.of(args[1]));
                    out.println(deleted ? "Deleted key for " + OwnerId.of(args[1]) : "No key stored for " + args[1]);
                    return deleted ? 0 : 1;
                case "audit":
                    OwnerId me = context.signer().identity();
                    for (LedgerEvent event : AuditTrail.of(context.ledger()).involving(me)) {
                        out.println(AuditTrail.describe(event));
                    }
                    return 0;
                default:
                    err.println("Unknown command: " + args[0]);
                    printUsage(err);
                    return 1;
            }
        } catch (UsageException e) {
            err.println(e.getMessage());
            printUsage(err);
            return 1;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static int keygen(PrismContext context, OwnerId owner, char[] passphrase, PrintStream out)
            throws Exception {
        try (DataKey key = context.cipher().generateKey()) {
            context.custodian().save(owner, key, passphrase);
        }
        out.println("Generated AES-256 key for " + owner + " in " + context.custodian().keystorePath());
        return 0;
    }

    private static int upload(PrismContext context, Path file, char[] passphrase, PrintStream out, PrintStream err)
            throws Exception {
        Signer signer = context.signer();
        try (DataKey key = context.custodian().load(signer.identity(), passphrase)) {
            UploadReceipt receipt = context.uploadService().uploadFile(signer, file, key);
            out.println("Uploaded " + file.getFileName());
            out.println("  CID:         " + receipt.contentId());
            out.println("  BLAKE3:      " + receipt.fingerprint().toHex());
            out.println("  Size:        " + receipt.size() + " bytes");
            return 0;
        } catch (PublishFailedException e) {
            err.println("Blob stored as " + e.receipt().contentId() + " but the ledger did not accept the pointer: "
                    + e.getCause().getMessage());
            return 2;
        }
    }

    private static int status(PrismContext context, String[] args, PrintStream out) throws Exception {
        OwnerId me = context.signer().identity();
        if (args.length >= 2) {
            AccessStatus status = context.ledger().accessStatus(me, OwnerId.of(args[1]));
            out.println(OwnerId.of(args[1]) + ": " + status);
            return 0;
        }
        if (context.ledger() instanceof InMemoryAccessLedger memory) {
            for (AccessGrant grant : memory.grantsFor(me)) {
                out.println(grant.requester() + ": " + grant.status());
            }
            return 0;
        }
        throw new UsageException("status needs a requester id");
    }

    private static void requireArgs(String[] args, int count) throws UsageException {
        if (args.length < count) {
            throw new UsageException("Missing arguments for '" + args[0] + "'");
        }
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: PatientApp <keygen|export-key|register|upload|approve|revoke|status|keys|forget|audit> [args]");
    }

    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }
}
