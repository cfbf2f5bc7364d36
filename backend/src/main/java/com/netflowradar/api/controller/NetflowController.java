package com.netflowradar.api.controller;

import com.netflowradar.api.dto.ErrorBody;
import com.netflowradar.api.dto.NetflowHistoryResponse;
import com.netflowradar.api.dto.NetflowResponse;
import com.netflowradar.query.NetflowQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /api/v1/netflow endpoints. Latest snapshot per exchange, latest across exchanges, snapshot history.
 */
@RestController
@RequestMapping("/api/v1/netflow")
@RequiredArgsConstructor
public class NetflowController {

    private final NetflowQueryService netflowQueryService;

    @GetMapping
    public ResponseEntity<?> latestAny() {
        return netflowQueryService.latestAny()
                .<ResponseEntity<?>>map(s -> ResponseEntity.ok(NetflowResponse.from(s)))
                .orElseGet(() -> notFound("NETFLOW_NOT_FOUND", "No netflow has been recorded yet"));
    }

    @GetMapping("/{exchange}")
    public ResponseEntity<?> latest(@PathVariable String exchange) {
        if (!netflowQueryService.isKnownExchange(exchange)) {
            return unknownExchange(exchange);
        }
        return netflowQueryService.latest(exchange)
                .<ResponseEntity<?>>map(s -> ResponseEntity.ok(NetflowResponse.from(s)))
                .orElseGet(() -> notFound("NETFLOW_NOT_FOUND", "No netflow recorded for exchange " + exchange));
    }

    @GetMapping("/{exchange}/history")
    public ResponseEntity<?> history(@PathVariable String exchange,
                                     @RequestParam(defaultValue = "50") int limit) {
        if (!netflowQueryService.isKnownExchange(exchange)) {
            return unknownExchange(exchange);
        }
        List<NetflowResponse> items = netflowQueryService.history(exchange, limit).stream()
                .map(NetflowResponse::from)
                .toList();
        return ResponseEntity.ok(new NetflowHistoryResponse(exchange, items));
    }

    static ResponseEntity<?> unknownExchange(String exchange) {
        return notFound("UNKNOWN_EXCHANGE", "Exchange is not configured: " + exchange);
    }

    private static ResponseEntity<?> notFound(String error, String message) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of(error, message));
    }
}
