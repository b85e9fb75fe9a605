package com.forgeflow.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for API key issuance.
 * Contains the API key which is only returned once at creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyIssueResponse {
    private ApiKeyResponse key;
    private String apiKey;
    private String message;
}
