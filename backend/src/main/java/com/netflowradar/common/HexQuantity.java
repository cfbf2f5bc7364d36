package com.netflowradar.common;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Parsing helpers for 0x-prefixed hex values as used by Ethereum JSON-RPC.
 */
public final class HexQuantity {

    private static final Pattern HEX_DIGITS = Pattern.compile("^[0-9a-fA-F]+$");

    private HexQuantity() {
    }

    /**
     * Parses a 0x-prefixed big-endian hex string as an unsigned integer of any width.
     *
     * @throws NumberFormatException if the value is null, lacks the 0x prefix or holds non-hex characters
     */
    public static BigInteger parseUnsigned(String hex) {
        if (hex == null || !(hex.startsWith("0x") || hex.startsWith("0X"))) {
            throw new NumberFormatException("Not a 0x-prefixed hex value: " + hex);
        }
        String digits = hex.substring(2);
        if (!HEX_DIGITS.matcher(digits).matches()) {
            throw new NumberFormatException("Invalid hex digits: " + hex);
        }
        return new BigInteger(digits, 16);
    }

    /** Parses a hex quantity into a long, or returns null when absent or malformed. */
    public static Long parseLongOrNull(String hex) {
        if (hex == null || hex.isBlank()) return null;
        try {
            return parseUnsigned(hex).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    public static boolean isHex(String value) {
        return value != null && HEX_DIGITS.matcher(value).matches();
    }
}
