package com.nipt.orchestrator.api.dto;

/**
 * Request body for POST /sessions.
 *
 * Required: datasetPath
 * Optional: logging, threads, verbose - omitted fields fall back to the nipt.* defaults.
 */
public record OpenSessionRequest(String datasetPath, Boolean logging, Integer threads, Boolean verbose) {}
