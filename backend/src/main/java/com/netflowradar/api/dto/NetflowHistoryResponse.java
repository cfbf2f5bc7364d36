package com.netflowradar.api.dto;

import java.util.List;

/**
 * GET /api/v1/netflow/{exchange}/history response, newest first.
 */
public record NetflowHistoryResponse(String exchange, List<NetflowResponse> items) {
}
