package com.nipt.orchestrator.bucket;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Query sent to a {@link Bucket} to select files of one resolved step.
 *
 * @param pipelines package label; null for categories that are not package scoped
 * @param ext       file extension without the leading dot, e.g. "nii.gz"
 * @param regex     optional file-name pattern, null when the caller gave none
 * @param category  namespace the step code was found in
 * @param location  storage path or label of the step inside that namespace
 */
public record DatasetFilter(
        String          pipelines,
        String          ext,
        String          regex,
        DatasetCategory category,
        String          location) {

    public DatasetFilter {
        Objects.requireNonNull(ext, "ext");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(location, "location");
    }

    /** Flat key/value view, in the form storage implementations index by. */
    public Map<String, String> toQuery() {
        Map<String, String> query = new LinkedHashMap<>();
        if (pipelines != null) query.put("pipelines", pipelines);
        query.put("ext", ext);
        if (regex != null) query.put("regex", regex);
        query.put(category.filterKey(), location);
        return Collections.unmodifiableMap(query);
    }
}
