package com.project.prism.eth;

import com.project.prism.ledger.LedgerRejectedException;
import com.project.prism.ledger.LedgerRejectedException.Reason;
import com.project.prism.ledger.NotAuthorizedException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps contract revert strings onto {@link Reason}s.
 */
final class RevertReasons {

    // Hardhat: "reverted with reason string 'X'"; geth: "execution reverted: X"
    private static final Pattern HARDHAT = Pattern.compile("reason string '([^']*)'");
    private static final Pattern GETH = Pattern.compile("execution reverted:?\\s*(.*)$", Pattern.DOTALL);

    private RevertReasons() {
    }

    /**
     * The bare revert string inside a node error message, or the message itself when no known wrapper matches.
     */
    static String extract(String message) {
        if (message == null) {
            return "";
        }
        Matcher hardhat = HARDHAT.matcher(message);
        if (hardhat.find()) {
            return hardhat.group(1).trim();
        }
        Matcher geth = GETH.matcher(message);
        if (geth.find()) {
            return geth.group(1).trim();
        }
        return message.trim();
    }

    static Reason classify(String revertReason) {
        String reason = extract(revertReason).toLowerCase(Locale.ROOT);
        if (reason.contains("already registered")) {
            return Reason.ALREADY_REGISTERED;
        }
        if (reason.contains("not a registered patient") || reason.contains("not registered")) {
            return Reason.NOT_REGISTERED;
        }
        if (reason.contains("not authorized") || reason.contains("unauthorized")) {
            return Reason.NOT_AUTHORIZED;
        }
        if (reason.contains("no data") || reason.contains("no genomic data")) {
            return Reason.NO_DATA;
        }
        return Reason.INVALID_TRANSITION;
    }

    static LedgerRejectedException toException(String revertReason) {
        String reason = extract(revertReason);
        Reason classified = classify(reason);
        String message = reason.isEmpty() ? "Transaction reverted" : reason;
        if (classified == Reason.NOT_AUTHORIZED) {
            return new NotAuthorizedException(message);
        }
        return new LedgerRejectedException(classified, message);
    }
}
