package com.project.prism.ledger;

import java.util.Locale;

/**
 * How many published pointers per owner remain readable.
 */
public enum PointerRetention {
    /** Each publish replaces the previous pointer. */
    LATEST_ONLY,
    /** Every publish is kept; the newest one is the live pointer. */
    FULL_HISTORY;

    /**
     * Parses {@code latest} or {@code history} (case-insensitive), as used by {@code PRISM_POINTER_RETENTION}.
     */
    public static PointerRetention parse(String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "latest":
            case "latest_only":
                return LATEST_ONLY;
            case "history":
            case "full_history":
                return FULL_HISTORY;
            default:
                throw new IllegalArgumentException("Unknown pointer retention: " + value);
        }
    }
}
