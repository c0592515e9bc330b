package com.nipt.orchestrator.processing;

import com.nipt.orchestrator.bucket.Bucket;

/**
 * Opens {@link PipelineInterface}s. Contributed as a Spring bean by an interface plugin.
 */
public interface InterfaceProvider {

    PipelineInterface open(Bucket bucket, String title, InterfaceOptions options);
}
