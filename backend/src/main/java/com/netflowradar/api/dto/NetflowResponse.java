package com.netflowradar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.netflowradar.domain.NetflowSnapshot;

/**
 * Latest netflow for one exchange. Amounts are base-10 strings so 256-bit values survive JSON clients.
 */
public record NetflowResponse(
        String exchange,
        String inflow,
        String outflow,
        @JsonProperty("cumulative_netflow") String cumulativeNetflow,
        @JsonProperty("last_updated") String lastUpdated
) {

    public static NetflowResponse from(NetflowSnapshot s) {
        return new NetflowResponse(
                s.getExchange(),
                s.getInflow() != null ? s.getInflow().toString() : "0",
                s.getOutflow() != null ? s.getOutflow().toString() : "0",
                s.getCumulativeNetflow() != null ? s.getCumulativeNetflow().toString() : "0",
                s.getLastUpdated() != null ? s.getLastUpdated().toString() : null);
    }
}
