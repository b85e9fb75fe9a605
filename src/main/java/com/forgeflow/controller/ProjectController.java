package com.forgeflow.controller;

import com.forgeflow.model.dto.FlowResponse;
import com.forgeflow.model.dto.ProjectCreateRequest;
import com.forgeflow.model.dto.ProjectResponse;
import com.forgeflow.model.entity.User;
import com.forgeflow.service.FlowService;
import com.forgeflow.service.ProjectService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Controller for project management.
 */
@RestController
@RequestMapping("/projects")
@RequiredArgsConstructor
public class ProjectController {

    private final ProjectService projectService;
    private final FlowService flowService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ProjectResponse> createProject(
            @AuthenticationPrincipal User user,
            @Valid @RequestBody ProjectCreateRequest request) {
        return projectService.createProject(user.getId(), request);
    }

    @GetMapping
    public Flux<ProjectResponse> listProjects(@AuthenticationPrincipal User user) {
        return projectService.listProjects(user.getId());
    }

    @GetMapping("/{projectId}")
    public Mono<ProjectResponse> getProject(
            @AuthenticationPrincipal User user,
            @PathVariable Long projectId) {
        return projectService.getProject(user.getId(), projectId);
    }

    @DeleteMapping("/{projectId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteProject(
            @AuthenticationPrincipal User user,
            @PathVariable Long projectId) {
        return projectService.deleteProject(user.getId(), projectId);
    }

    @GetMapping("/{projectId}/flows")
    public Flux<FlowResponse> listFlows(
            @AuthenticationPrincipal User user,
            @PathVariable Long projectId) {
        return flowService.listFlows(user.getId(), projectId);
    }
}
