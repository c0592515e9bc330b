package com.nipt.orchestrator.service;

import com.nipt.orchestrator.bucket.Bucket;
import com.nipt.orchestrator.bucket.BucketFactory;
import com.nipt.orchestrator.config.NiptProperties;
import com.nipt.orchestrator.plugin.PackageCatalog;
import com.nipt.orchestrator.processing.InterfaceProvider;
import com.nipt.orchestrator.progress.LoggingProgressSink;
import com.nipt.orchestrator.progress.ProgressSink;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Creates {@link PipelineOrchestrator}s wired to the installed plugins.
 *
 * Storage ({@link BucketFactory}) and processing ({@link InterfaceProvider}) come
 * from plugin beans; without them no orchestrator can be created. A
 * {@link ProgressSink} bean replaces the default log-based progress output.
 */
@Component
public class OrchestratorFactory {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorFactory.class);

    private final NiptProperties                    properties;
    private final PackageCatalog                    catalog;
    private final ObjectProvider<BucketFactory>     bucketFactory;
    private final ObjectProvider<InterfaceProvider> interfaceProvider;
    private final ObjectProvider<ProgressSink>      progressSink;
    private final MeterRegistry                     meterRegistry;

    public OrchestratorFactory(NiptProperties properties,
                               PackageCatalog catalog,
                               ObjectProvider<BucketFactory> bucketFactory,
                               ObjectProvider<InterfaceProvider> interfaceProvider,
                               ObjectProvider<ProgressSink> progressSink,
                               MeterRegistry meterRegistry) {
        this.properties        = properties;
        this.catalog           = catalog;
        this.bucketFactory     = bucketFactory;
        this.interfaceProvider = interfaceProvider;
        this.progressSink      = progressSink;
        this.meterRegistry     = meterRegistry;
    }

    public PipelineOrchestrator create(Path datasetPath) {
        return create(datasetPath, OrchestratorOptions.defaults());
    }

    public PipelineOrchestrator create(Path datasetPath, OrchestratorOptions options) {
        BucketFactory buckets = bucketFactory.getIfAvailable();
        if (buckets == null) {
            throw new IllegalStateException("No BucketFactory bean registered; install a storage plugin");
        }
        InterfaceProvider interfaces = interfaceProvider.getIfAvailable();
        if (interfaces == null) {
            throw new IllegalStateException("No InterfaceProvider bean registered; install an interface plugin");
        }
        OrchestratorOptions effective = options != null ? options : OrchestratorOptions.defaults();

        Bucket bucket = buckets.open(datasetPath);
        log.info("Opened dataset {}", datasetPath);
        return new PipelineOrchestrator(
                bucket,
                catalog,
                interfaces,
                effective.interfaceOptions(properties),
                effective.verbose(properties),
                progressSink.getIfAvailable(LoggingProgressSink::new),
                properties.progressInterval(),
                meterRegistry);
    }
}
