package com.nipt.orchestrator.api.dto;

import java.util.Map;

/**
 * Request body for PUT /sessions/{id}/package.
 *
 * index selects an installed package; title alone binds an empty ad-hoc package.
 * params are applied to an installed package when it is bound.
 */
public record SelectPackageRequest(Integer index, String title, Map<String, Object> params) {

    public SelectPackageRequest {
        if (params == null) params = Map.of();
    }
}
