package com.netflowradar.api.controller;

import com.netflowradar.api.dto.ExchangeResponse;
import com.netflowradar.query.NetflowQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/exchanges")
@RequiredArgsConstructor
public class ExchangeController {

    private final NetflowQueryService netflowQueryService;

    @GetMapping
    public List<ExchangeResponse> list() {
        return netflowQueryService.exchanges().stream()
                .map(e -> new ExchangeResponse(e.exchange(), e.monitoredAddresses(), e.hasNetflow()))
                .toList();
    }
}
