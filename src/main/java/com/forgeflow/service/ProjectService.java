package com.forgeflow.service;

import com.forgeflow.exception.ResourceNotFoundException;
import com.forgeflow.exception.StoreUnavailableException;
import com.forgeflow.model.dto.ProjectCreateRequest;
import com.forgeflow.model.dto.ProjectResponse;
import com.forgeflow.model.entity.Project;
import com.forgeflow.repository.ProjectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Service for project management.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectService {

    private final ProjectRepository projectRepository;
    private final Clock clock;

    /**
     * Create a project owned by the user.
     *
     * @param ownerId Authenticated user ID
     * @param request Project create request
     * @return Project response
     */
    @Transactional
    public Mono<ProjectResponse> createProject(Long ownerId, ProjectCreateRequest request) {
        Instant now = clock.instant();
        Project project = Project.builder()
                .ownerId(ownerId)
                .name(request.getName())
                .createdAt(now)
                .updatedAt(now)
                .build();

        return projectRepository.save(project)
                // owner deleted after authentication
                .onErrorMap(DataIntegrityViolationException.class, e -> new ResourceNotFoundException("User", ownerId))
                .onErrorMap(StoreUnavailableException::isUnavailable, StoreUnavailableException::new)
                .doOnNext(saved -> log.info("Created project {} for user {}", saved.getId(), ownerId))
                .map(ProjectResponse::from);
    }

    /**
     * List the user's projects.
     */
    public Flux<ProjectResponse> listProjects(Long ownerId) {
        return projectRepository.findByOwnerIdOrderByIdAsc(ownerId)
                .onErrorMap(StoreUnavailableException::isUnavailable, StoreUnavailableException::new)
                .map(ProjectResponse::from);
    }

    /**
     * Get a project owned by the user.
     */
    public Mono<ProjectResponse> getProject(Long ownerId, Long projectId) {
        return findOwned(ownerId, projectId).map(ProjectResponse::from);
    }

    /**
     * Delete a project owned by the user. Its flows and runs are removed by the database cascade.
     */
    @Transactional
    public Mono<Void> deleteProject(Long ownerId, Long projectId) {
        return findOwned(ownerId, projectId)
                .flatMap(projectRepository::delete)
                .onErrorMap(StoreUnavailableException::isUnavailable, StoreUnavailableException::new)
                .doOnSuccess(ignored -> log.info("Deleted project {} of user {}", projectId, ownerId));
    }

    Mono<Project> findOwned(Long ownerId, Long projectId) {
        return projectRepository.findByIdAndOwnerId(projectId, ownerId)
                .onErrorMap(StoreUnavailableException::isUnavailable, StoreUnavailableException::new)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Project", projectId)));
    }
}
