package com.netflowradar.api.controller;

import com.netflowradar.api.dto.TransferHistoryResponse;
import com.netflowradar.api.dto.TransferResponse;
import com.netflowradar.query.NetflowQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /api/v1/transfers/{exchange}?limit=N. Ledger entries for one exchange, newest first.
 */
@RestController
@RequestMapping("/api/v1/transfers")
@RequiredArgsConstructor
public class TransferController {

    private final NetflowQueryService netflowQueryService;

    @GetMapping("/{exchange}")
    public ResponseEntity<?> recent(@PathVariable String exchange,
                                    @RequestParam(defaultValue = "50") int limit) {
        if (!netflowQueryService.isKnownExchange(exchange)) {
            return NetflowController.unknownExchange(exchange);
        }
        List<TransferResponse> items = netflowQueryService.recentTransfers(exchange, limit).stream()
                .map(TransferResponse::from)
                .toList();
        return ResponseEntity.ok(new TransferHistoryResponse(exchange, items));
    }
}
