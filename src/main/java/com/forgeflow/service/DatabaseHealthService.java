package com.forgeflow.service;

import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * Probes the database with a trivial query.
 */
@Service
@RequiredArgsConstructor
public class DatabaseHealthService {

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

    private final DatabaseClient databaseClient;

    /**
     * @return empty when the database answered, otherwise the error message
     */
    public Mono<Optional<String>> probe() {
        return databaseClient.sql("SELECT 1")
                .fetch()
                .first()
                .timeout(PROBE_TIMEOUT)
                .then(Mono.just(Optional.<String>empty()))
                .onErrorResume(error -> Mono.just(Optional.of(String.valueOf(error.getMessage()))));
    }
}
