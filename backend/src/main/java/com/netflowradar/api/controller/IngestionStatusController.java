package com.netflowradar.api.controller;

import com.netflowradar.api.dto.IngestionStatusResponse;
import com.netflowradar.query.IngestionStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/v1/ingestion/status. Subscriber liveness and counters.
 */
@RestController
@RequestMapping("/api/v1/ingestion")
@RequiredArgsConstructor
public class IngestionStatusController {

    private final IngestionStatusService ingestionStatusService;

    @GetMapping("/status")
    public IngestionStatusResponse status() {
        return IngestionStatusResponse.from(ingestionStatusService.current());
    }
}
