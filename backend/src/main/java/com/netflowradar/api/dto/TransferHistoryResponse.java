package com.netflowradar.api.dto;

import java.util.List;

/**
 * GET /api/v1/transfers/{exchange} response, newest first.
 */
public record TransferHistoryResponse(String exchange, List<TransferResponse> items) {
}
