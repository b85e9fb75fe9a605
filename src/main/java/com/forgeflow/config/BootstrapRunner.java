package com.forgeflow.config;

import com.forgeflow.exception.DuplicateResourceException;
import com.forgeflow.service.BootstrapService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.time.Duration;

/**
 * Runs provisioning once the application context is up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "forgeflow.bootstrap", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BootstrapRunner implements ApplicationRunner {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final BootstrapService bootstrapService;

    @Override
    public void run(ApplicationArguments args) {
        try {
            bootstrapService.provisionIfEmpty()
                    .blockOptional(TIMEOUT)
                    .ifPresent(issued -> {
                        log.info("Bootstrap API key {} issued", issued.getKey().getId());
                        if (bootstrapService.generatesSecret()) {
                            reveal(System.out, issued.getApiKey());
                        }
                    });
        } catch (DuplicateResourceException e) {
            // another instance provisioned first
            log.info("Bootstrap skipped: {}", e.getMessage());
        }
    }

    /**
     * The generated secret goes to the console exactly once and never through the logger.
     */
    static void reveal(PrintStream console, String secret) {
        console.println("=================================================================");
        console.println(" Bootstrap admin API key (shown once, store it now):");
        console.println(" " + secret);
        console.println("=================================================================");
    }
}
