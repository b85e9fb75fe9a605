package com.forgeflow.controller;

import com.forgeflow.model.dto.HealthResponse;
import com.forgeflow.service.DatabaseHealthService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

/**
 * Health check endpoints.
 */
@RestController
@RequestMapping
public class HealthController {

    private final DatabaseHealthService databaseHealthService;
    private final Clock clock;
    private final String env;
    private final String version;

    public HealthController(DatabaseHealthService databaseHealthService,
                            Clock clock,
                            @Value("${forgeflow.env:local}") String env,
                            @Value("${forgeflow.version:0.1.0}") String version) {
        this.databaseHealthService = databaseHealthService;
        this.clock = clock;
        this.env = env;
        this.version = version;
    }

    @GetMapping("/")
    public Mono<Map<String, String>> root() {
        return Mono.just(Map.of(
            "service", "ForgeFlow Core API",
            "version", version
        ));
    }

    @GetMapping("/health")
    public Mono<HealthResponse> health() {
        return databaseHealthService.probe()
                .map(dbError -> HealthResponse.builder()
                        .status("ok")
                        .timestamp(clock.instant())
                        .env(env)
                        .dbOk(dbError.isEmpty())
                        .dbError(dbError.orElse(null))
                        .build());
    }
}
