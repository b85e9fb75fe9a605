package com.forgeflow.controller;

import com.forgeflow.model.dto.FlowCreateRequest;
import com.forgeflow.model.dto.FlowResponse;
import com.forgeflow.model.dto.FlowRunResponse;
import com.forgeflow.model.entity.User;
import com.forgeflow.service.FlowRunService;
import com.forgeflow.service.FlowService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Controller for flows and their runs.
 */
@RestController
@RequiredArgsConstructor
public class FlowController {

    private final FlowService flowService;
    private final FlowRunService flowRunService;

    @PostMapping("/flows")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<FlowResponse> createFlow(
            @AuthenticationPrincipal User user,
            @Valid @RequestBody FlowCreateRequest request) {
        return flowService.createFlow(user.getId(), request);
    }

    @GetMapping("/flows/{flowId}")
    public Mono<FlowResponse> getFlow(
            @AuthenticationPrincipal User user,
            @PathVariable Long flowId) {
        return flowService.getFlow(user.getId(), flowId);
    }

    @DeleteMapping("/flows/{flowId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteFlow(
            @AuthenticationPrincipal User user,
            @PathVariable Long flowId) {
        return flowService.deleteFlow(user.getId(), flowId);
    }

    /**
     * Record a run of the flow. Nothing is executed.
     */
    @PostMapping("/flows/{flowId}/run")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<FlowRunResponse> runFlow(
            @AuthenticationPrincipal User user,
            @PathVariable Long flowId) {
        return flowRunService.createRun(user.getId(), flowId);
    }

    @GetMapping("/flows/{flowId}/runs")
    public Flux<FlowRunResponse> listRuns(
            @AuthenticationPrincipal User user,
            @PathVariable Long flowId) {
        return flowRunService.listRuns(user.getId(), flowId);
    }

    @GetMapping("/runs/{runId}")
    public Mono<FlowRunResponse> getRun(
            @AuthenticationPrincipal User user,
            @PathVariable Long runId) {
        return flowRunService.getRun(user.getId(), runId);
    }
}
