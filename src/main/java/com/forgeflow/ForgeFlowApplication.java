package com.forgeflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.reactive.ReactiveUserDetailsServiceAutoConfiguration;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;

/**
 * ForgeFlow Core API Server
 *
 * Project, flow and flow-run service with API key authentication,
 * built with Spring Boot WebFlux and R2DBC.
 */
// API keys are the only credentials; no in-memory user store
@SpringBootApplication(exclude = ReactiveUserDetailsServiceAutoConfiguration.class)
@EnableR2dbcRepositories
public class ForgeFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForgeFlowApplication.class, args);
    }

}
