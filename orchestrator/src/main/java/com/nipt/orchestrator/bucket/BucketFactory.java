package com.nipt.orchestrator.bucket;

import java.nio.file.Path;

/**
 * Opens a {@link Bucket} for a dataset path. Contributed as a Spring bean by a storage plugin.
 */
public interface BucketFactory {

    Bucket open(Path datasetPath);
}
