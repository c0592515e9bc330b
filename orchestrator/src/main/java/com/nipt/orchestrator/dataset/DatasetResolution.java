package com.nipt.orchestrator.dataset;

import com.nipt.orchestrator.bucket.DatasetCategory;
import com.nipt.orchestrator.bucket.DatasetFilter;

/**
 * Outcome of resolving a step code that exists in one of the dataset namespaces.
 */
public record DatasetResolution(
        String          stepCode,
        DatasetCategory category,
        String          location,
        DatasetFilter   filter) {}
