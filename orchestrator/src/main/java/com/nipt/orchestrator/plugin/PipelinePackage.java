package com.nipt.orchestrator.plugin;

import com.nipt.orchestrator.pipeline.PipelineDefinition;
import com.nipt.orchestrator.processing.PipelineInterface;

/**
 * A pluggable bundle exposing one titled pipeline definition.
 *
 * Plugins declare implementations as Spring {@code @Component}s; the
 * {@link PackageCatalog} collects them at startup.
 */
public interface PipelinePackage {

    PackageManifest manifest();

    /**
     * Instantiate the package's pipeline, bound to {@code pipelineInterface}.
     * Called on every selection and rebind; each call must return a new instance.
     */
    PipelineDefinition create(PipelineInterface pipelineInterface);
}
