package com.forgeflow.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeflow.exception.AuthFailure;
import com.forgeflow.exception.AuthenticationFailedException;
import com.forgeflow.exception.StoreUnavailableException;
import com.forgeflow.model.dto.ErrorResponse;
import com.forgeflow.service.AuthenticationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Collections;

/**
 * Filter for API Key authentication.
 * Validates Bearer tokens and sets the owning user in the security context.
 *
 * Registered inside the security filter chain by {@link com.forgeflow.config.SecurityConfig},
 * not as a standalone bean.
 */
@Slf4j
@RequiredArgsConstructor
public class ApiKeyAuthenticationFilter implements WebFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthenticationService authenticationService;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();

        // Skip authentication for public endpoints
        if (isPublicEndpoint(path)) {
            return chain.filter(exchange);
        }

        String apiKey = extractBearer(exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION));

        return authenticationService.authenticate(apiKey)
                .flatMap(user -> {
                    // Create authentication token with the user as principal
                    UsernamePasswordAuthenticationToken authentication =
                            new UsernamePasswordAuthenticationToken(user, null, Collections.emptyList());

                    return chain.filter(exchange)
                            .contextWrite(ReactiveSecurityContextHolder.withAuthentication(authentication));
                })
                .onErrorResume(AuthenticationFailedException.class, error -> {
                    log.warn("API key verification failed for {}: {}", path, error.getFailure());
                    return reject(exchange.getResponse(), HttpStatus.UNAUTHORIZED,
                            ErrorResponse.of(error.getMessage(), error.getFailure().name()));
                })
                .onErrorResume(StoreUnavailableException.class, error -> {
                    log.error("API key verification unavailable for {}", path, error.getCause());
                    return reject(exchange.getResponse(), HttpStatus.SERVICE_UNAVAILABLE,
                            ErrorResponse.of(error.getMessage(), "STORE_UNAVAILABLE"));
                });
    }

    static String extractBearer(String authHeader) {
        // the auth scheme is case-insensitive
        if (authHeader == null || !authHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    static boolean isPublicEndpoint(String path) {
        return path.equals("/") || path.equals("/health");
    }

    private Mono<Void> reject(ServerHttpResponse response, HttpStatus status, ErrorResponse body) {
        if (response.isCommitted()) {
            return Mono.empty();
        }
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        if (status == HttpStatus.UNAUTHORIZED) {
            response.getHeaders().set(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize error response", e);
            return response.setComplete();
        }
        DataBuffer buffer = response.bufferFactory().wrap(bytes);
        return response.writeWith(Mono.just(buffer));
    }
}
