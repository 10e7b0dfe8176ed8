package com.project.prism;

import com.project.prism.config.EnvSettings;
import com.project.prism.core.IntegrityReport;
import com.project.prism.crypto.DataKey;
import com.project.prism.crypto.IntegrityException;
import com.project.prism.ledger.AccessStatus;
import com.project.prism.ledger.NotAuthorizedException;
import com.project.prism.ledger.OwnerId;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Requester-side commands.
 * <p>
 * Usage: java DoctorApp &lt;command&gt; [args]
 * <pre>
 *   request &lt;owner&gt;                          ask for access to an owner's data
 *   check &lt;owner&gt;                            show the signer's access status
 *   verify &lt;owner&gt;                           download and check the blob against the ledger
 *   retrieve &lt;owner&gt; &lt;keyHex&gt; &lt;outputFile&gt;  download, verify and decrypt
 * </pre>
 */
public class DoctorApp {

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
        if (args.length < 2) {
            err.println("Usage: DoctorApp <request|check|verify|retrieve> <owner> [keyHex outputFile]");
            return 1;
        }
        try {
            OwnerId owner = OwnerId.of(args[1]);
            OwnerId me = context.signer().identity();
            switch (args[0]) {
                case "request":
                    context.ledger().requestAccess(context.signer(), owner);
                    out.println("Access requested from " + owner);
                    return 0;
                case "check":
                    AccessStatus status = context.ledger().accessStatus(owner, me);
                    out.println(owner + ": " + status);
                    return status == AccessStatus.APPROVED ? 0 : 3;
                case "verify":
                    IntegrityReport report = context.retrieveService().verify(owner, me);
                    out.println(report.describe());
                    return report.verified() ? 0 : 4;
                case "retrieve":
                    if (args.length < 4) {
                        err.println("Usage: DoctorApp retrieve <owner> <keyHex> <outputFile>");
                        return 1;
                    }
                    try (DataKey key = DataKey.fromHex(args[2])) {
                        Path written = context.retrieveService().retrieveToFile(owner, me, key, Path.of(args[3]));
                        out.println("Decrypted data written to " + written.toAbsolutePath());
                    }
                    return 0;
                default:
                    err.println("Unknown command: " + args[0]);
                    return 1;
            }
        } catch (NotAuthorizedException e) {
            err.println("Not authorized: " + e.getMessage());
            return 3;
        } catch (IntegrityException e) {
            err.println("INTEGRITY FAILURE: " + e.getMessage());
            return 4;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
