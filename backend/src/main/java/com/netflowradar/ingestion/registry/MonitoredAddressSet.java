package com.netflowradar.ingestion.registry;

import com.netflowradar.common.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable set of addresses attributed to one exchange label. Membership is case-insensitive.
 * Construction fails if any entry is malformed; instances are safe to share between threads.
 */
public final class MonitoredAddressSet {

    private final String label;
    private final Set<String> addresses;

    public MonitoredAddressSet(String label, Collection<String> configuredAddresses) {
        if (label == null || label.isBlank()) {
            throw new ConfigurationException("Exchange label is required");
        }
        if (configuredAddresses == null || configuredAddresses.isEmpty()) {
            throw new ConfigurationException("Exchange '" + label + "' has no monitored addresses");
        }
        Set<String> normalized = new LinkedHashSet<>();
        List<String> invalid = new ArrayList<>();
        for (String raw : configuredAddresses) {
            String address = EvmAddresses.normalize(raw);
            if (address == null) {
                invalid.add(raw);
            } else {
                normalized.add(address);
            }
        }
        if (!invalid.isEmpty()) {
            throw new ConfigurationException("Exchange '" + label + "' has malformed addresses: " + invalid);
        }
        this.label = label.trim();
        this.addresses = Set.copyOf(normalized);
    }

    public boolean contains(String address) {
        String normalized = EvmAddresses.normalize(address);
        return normalized != null && addresses.contains(normalized);
    }

    public String label() {
        return label;
    }

    public int size() {
        return addresses.size();
    }

    public Set<String> addresses() {
        return addresses;
    }
}
