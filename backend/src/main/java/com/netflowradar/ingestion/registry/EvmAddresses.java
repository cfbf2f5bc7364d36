package com.netflowradar.ingestion.registry;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form for EVM account addresses: "0x" + 40 lower-case hex digits.
 */
public final class EvmAddresses {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");

    private EvmAddresses() {
    }

    /**
     * Trims, lower-cases and validates. Returns null when the input is not a 20-byte hex address.
     */
    public static String normalize(String address) {
        if (address == null) return null;
        String candidate = address.trim().toLowerCase(Locale.ROOT);
        return EVM_ADDRESS.matcher(candidate).matches() ? candidate : null;
    }

    public static boolean isValid(String address) {
        return normalize(address) != null;
    }
}
