package com.nipt.orchestrator.api.dto;

import com.nipt.orchestrator.bucket.DatasetCategory;
import com.nipt.orchestrator.bucket.DatasetView;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Files of one step code returned by GET /sessions/{id}/datasets/{code}.
 */
public record DatasetResponse(
        String              stepCode,
        DatasetCategory     category,
        Map<String, String> filter,
        List<String>        files
) {
    public static DatasetResponse from(String stepCode, DatasetView view) {
        return new DatasetResponse(
                stepCode,
                view.category(),
                view.filter().toQuery(),
                view.files().stream().map(Path::toString).toList()
        );
    }
}
