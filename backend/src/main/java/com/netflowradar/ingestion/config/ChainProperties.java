package com.netflowradar.ingestion.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Chain RPC endpoints: WebSocket for the log subscription, optional HTTP list for head-block probing.
 */
@ConfigurationProperties(prefix = "netflowradar.chain")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ChainProperties {

    /** ws:// or wss:// endpoint supporting eth_subscribe. */
    @NotBlank
    private String wsUrl;

    /** HTTP JSON-RPC endpoints, rotated round-robin. Empty disables the head probe. */
    private List<String> httpUrls = new ArrayList<>();

    public void setHttpUrls(List<String> httpUrls) {
        this.httpUrls = httpUrls != null ? httpUrls : new ArrayList<>();
    }
}
