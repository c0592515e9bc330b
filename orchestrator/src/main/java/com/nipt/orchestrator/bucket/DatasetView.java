package com.nipt.orchestrator.bucket;

import java.nio.file.Path;
import java.util.List;

/**
 * Filtered, read-only copy of the files a {@link Bucket} holds for one query.
 */
public record DatasetView(DatasetCategory category, DatasetFilter filter, List<Path> files) {

    public DatasetView {
        files = List.copyOf(files);
    }

    public boolean isEmpty() { return files.isEmpty(); }
}
