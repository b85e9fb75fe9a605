package com.forgeflow.controller;

import com.forgeflow.model.dto.ApiKeyIssueRequest;
import com.forgeflow.model.dto.ApiKeyIssueResponse;
import com.forgeflow.model.dto.ApiKeyResponse;
import com.forgeflow.model.dto.UserResponse;
import com.forgeflow.model.entity.User;
import com.forgeflow.service.ApiKeyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Controller for the authenticated user and their API keys.
 */
@RestController
@RequiredArgsConstructor
public class AuthController {

    private final ApiKeyService apiKeyService;

    @GetMapping("/me")
    public Mono<UserResponse> me(@AuthenticationPrincipal User user) {
        return Mono.just(UserResponse.from(user));
    }

    @PostMapping("/api-keys")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ApiKeyIssueResponse> issueApiKey(
            @AuthenticationPrincipal User user,
            @Valid @RequestBody ApiKeyIssueRequest request) {
        return apiKeyService.issue(user.getId(), request.getName(), request.getExpiresAt());
    }

    @GetMapping("/api-keys")
    public Flux<ApiKeyResponse> listApiKeys(@AuthenticationPrincipal User user) {
        return apiKeyService.listKeys(user.getId());
    }
}
