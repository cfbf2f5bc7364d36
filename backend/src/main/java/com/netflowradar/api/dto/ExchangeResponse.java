package com.netflowradar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExchangeResponse(
        String exchange,
        @JsonProperty("monitored_addresses") int monitoredAddresses,
        @JsonProperty("has_netflow") boolean hasNetflow
) {
}
