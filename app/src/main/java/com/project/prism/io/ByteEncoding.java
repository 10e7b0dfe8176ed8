package com.project.prism.io;

import java.util.HexFormat;

public final class ByteEncoding {

    private static final HexFormat HEX = HexFormat.of();

    private ByteEncoding() {
    }

    /**
     * Lowercase hex without prefix, the form the keystore and the ledger store.
     */
    public static String toHex(byte[] data) {
        return HEX.formatHex(data);
    }

    public static byte[] fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Hex string must not be null");
        }
        String normalized = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (normalized.length() % 2 != 0) {
            throw new IllegalArgumentException("Hex string must have even length");
        }
        return HEX.parseHex(normalized);
    }

    /**
     * First {@code chars} hex characters, for log lines that must not carry whole digests.
     */
    public static String abbreviate(String hex, int chars) {
        if (hex == null || hex.length() <= chars) {
            return hex;
        }
        return hex.substring(0, chars) + "...";
    }
}
