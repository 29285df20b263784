package com.rewardradar.api.controller;

import com.rewardradar.client.Home;
import com.rewardradar.fetch.FetchOrchestrator;
import com.rewardradar.polling.DeviceInventory;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * GET /homes (account homes, cached), GET /devices (tracked device ids by type from the last device poll).
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HomesController {

    private final FetchOrchestrator fetchOrchestrator;
    private final DeviceInventory deviceInventory;

    @GetMapping("/homes")
    public Mono<List<Home>> homes() {
        return Mono.fromCallable(fetchOrchestrator::fetchHomes)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/devices")
    public Map<String, List<String>> devices() {
        return deviceInventory.idsByType();
    }
}
