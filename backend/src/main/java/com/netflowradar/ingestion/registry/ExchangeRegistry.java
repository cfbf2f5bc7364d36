package com.netflowradar.ingestion.registry;

import com.netflowradar.common.ConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All monitored exchanges, keyed by label. Built once at startup from configuration; read-only afterwards.
 */
public final class ExchangeRegistry {

    private final Map<String, MonitoredAddressSet> byLabel;

    public ExchangeRegistry(Map<String, ? extends Collection<String>> addressesByLabel) {
        if (addressesByLabel == null || addressesByLabel.isEmpty()) {
            throw new ConfigurationException("At least one exchange with monitored addresses is required");
        }
        Map<String, MonitoredAddressSet> sets = new LinkedHashMap<>();
        addressesByLabel.forEach((label, addresses) -> {
            MonitoredAddressSet set = new MonitoredAddressSet(label, addresses);
            if (sets.putIfAbsent(set.label(), set) != null) {
                throw new ConfigurationException("Duplicate exchange label: " + set.label());
            }
        });
        this.byLabel = Collections.unmodifiableMap(sets);
    }

    public List<MonitoredAddressSet> exchanges() {
        return List.copyOf(byLabel.values());
    }

    public Optional<MonitoredAddressSet> find(String label) {
        return Optional.ofNullable(byLabel.get(label));
    }

    public boolean isKnown(String label) {
        return label != null && byLabel.containsKey(label);
    }
}
