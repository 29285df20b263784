package com.rewardradar.api.controller;

import com.rewardradar.api.dto.MessageResponse;
import com.rewardradar.diagnostics.DiagnosticsService;
import com.rewardradar.diagnostics.DiagnosticsSnapshot;
import com.rewardradar.fetch.FetchOrchestrator;
import com.rewardradar.ratelimit.RateLimiterStateService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /cache/clear (optionally for one home), POST /rate-limit/reset, GET /diagnostics.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class MaintenanceController {

    private final FetchOrchestrator fetchOrchestrator;
    private final RateLimiterStateService rateLimiterStateService;
    private final DiagnosticsService diagnosticsService;

    @PostMapping("/cache/clear")
    public ResponseEntity<MessageResponse> clearCache(@RequestParam(name = "homeId", required = false) String homeId) {
        if (homeId != null && !homeId.isBlank()) {
            int removed = fetchOrchestrator.clearCache(homeId.trim());
            return ResponseEntity.ok(new MessageResponse("Cache cleared for home (" + removed + " entries)"));
        }
        fetchOrchestrator.clearCache();
        return ResponseEntity.ok(new MessageResponse("Cache cleared"));
    }

    @PostMapping("/rate-limit/reset")
    public ResponseEntity<MessageResponse> resetRateLimit() {
        rateLimiterStateService.reset();
        return ResponseEntity.ok(new MessageResponse("Rate limiter reset"));
    }

    @GetMapping("/diagnostics")
    public DiagnosticsSnapshot diagnostics() {
        return diagnosticsService.snapshot();
    }
}
