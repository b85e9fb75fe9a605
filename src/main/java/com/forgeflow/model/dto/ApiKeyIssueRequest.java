package com.forgeflow.model.dto;

import jakarta.validation.constraints.Future;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request DTO for issuing an API key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyIssueRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 200, message = "Name cannot exceed 200 characters")
    private String name;

    @Future(message = "Expiry must be in the future")
    private Instant expiresAt;
}
