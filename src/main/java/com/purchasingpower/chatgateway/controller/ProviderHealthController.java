package com.purchasingpower.chatgateway.controller;

import com.purchasingpower.chatgateway.service.ProviderHealthService;
import com.purchasingpower.chatgateway.service.ProviderStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Operator endpoints for provider health.
 *
 * Endpoints:
 * - GET /api/v1/providers/health - credential and last probe per provider, in chain order
 * - POST /api/v1/providers/health/probe - probe every configured provider now
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/providers/health")
@RequiredArgsConstructor
public class ProviderHealthController {

    private final ProviderHealthService healthService;

    @GetMapping
    public ResponseEntity<List<ProviderStatus>> getHealth() {
        return ResponseEntity.ok(healthService.getStatuses());
    }

    @PostMapping("/probe")
    public ResponseEntity<List<ProviderStatus>> probe() {
        log.info("Manual provider probe requested");
        return ResponseEntity.ok(healthService.probeAll());
    }
}
