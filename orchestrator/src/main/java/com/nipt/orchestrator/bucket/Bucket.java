package com.nipt.orchestrator.bucket;

import java.nio.file.Path;

/**
 * Storage and indexing view over one dataset directory.
 *
 * Implementations are supplied by a storage plugin through a {@link BucketFactory}.
 * The orchestrator shares a bucket with every interface and resolver it creates
 * and never persists anything itself.
 */
public interface Bucket {

    /** Root directory of the dataset. */
    Path path();

    /** Re-scan the dataset so later queries see files produced since the last scan. */
    void update();

    /** Human-readable description of the dataset contents. */
    String summary();

    DatasetView query(DatasetCategory category, DatasetFilter filter);
}
