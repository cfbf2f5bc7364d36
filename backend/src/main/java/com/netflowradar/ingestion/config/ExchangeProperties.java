package com.netflowradar.ingestion.config;

import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Monitored addresses per exchange label, e.g. netflowradar.exchanges.binance[0]=0x...
 * Addresses are validated when the registry is built.
 */
@ConfigurationProperties(prefix = "netflowradar")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ExchangeProperties {

    @NotEmpty
    private Map<String, List<String>> exchanges = new LinkedHashMap<>();

    public void setExchanges(Map<String, List<String>> exchanges) {
        this.exchanges = exchanges != null ? new LinkedHashMap<>(exchanges) : new LinkedHashMap<>();
    }
}
