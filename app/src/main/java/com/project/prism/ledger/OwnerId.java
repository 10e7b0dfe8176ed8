package com.project.prism.ledger;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Stable principal identifier, usually an Ethereum address.
 * <p>
 * Addresses are normalized to lowercase so {@code 0xABC..} and {@code 0xabc..}
 * name the same owner, matching how the keystore and the contracts compare them.
 */
public final class OwnerId implements Comparable<OwnerId> {

    private static final int MIN_LENGTH = 3;
    private static final int MAX_LENGTH = 128;
    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");
    private static final Pattern GENERIC = Pattern.compile("^[a-z0-9][a-z0-9@._\\-:]*$");

    private final String value;

    private OwnerId(String value) {
        this.value = value;
    }

    public static OwnerId of(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Owner id must not be null");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (normalized.length() < MIN_LENGTH || normalized.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(String.format(
                    "Owner id must be %d-%d characters: '%s'", MIN_LENGTH, MAX_LENGTH, raw));
        }
        if (normalized.startsWith("0x")) {
            if (!ADDRESS.matcher(normalized).matches()) {
                throw new IllegalArgumentException("Malformed address: '" + raw + "'");
            }
        } else if (!GENERIC.matcher(normalized).matches()) {
            throw new IllegalArgumentException(
                    "Owner id has invalid characters: '" + raw + "'. Allowed: alphanumeric and @._-:");
        }
        return new OwnerId(normalized);
    }

    public boolean isAddress() {
        return ADDRESS.matcher(value).matches();
    }

    public String value() {
        return value;
    }

    @Override
    public int compareTo(OwnerId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof OwnerId that && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
