package com.nipt.orchestrator.api.dto;

import com.nipt.orchestrator.service.PipelineOrchestrator;

import java.util.UUID;

/**
 * Response body for POST /sessions and GET /sessions/{id}.
 * selectedPackage and summary are null while no package is selected.
 */
public record SessionResponse(
        UUID   id,
        String datasetPath,
        String selectedPackage,
        String summary
) {
    public static SessionResponse from(UUID id, PipelineOrchestrator orchestrator) {
        return new SessionResponse(
                id,
                orchestrator.bucket().path().toString(),
                orchestrator.selectedTitle().orElse(null),
                orchestrator.summary().orElse(null)
        );
    }
}
