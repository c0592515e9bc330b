package com.nipt.orchestrator.dataset;

import com.nipt.orchestrator.bucket.DatasetCategory;
import com.nipt.orchestrator.bucket.DatasetFilter;
import com.nipt.orchestrator.processing.PipelineInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Maps a step code to the namespace that holds its data and builds the bucket query for it.
 *
 * Namespaces are tried in {@link DatasetCategory} declaration order
 * (processed, reported, masked); the first one that knows the code wins.
 * A code unknown to all three resolves to empty, which callers treat as
 * "no data" rather than as a failure.
 */
public class DatasetResolver {

    private static final Logger log = LoggerFactory.getLogger(DatasetResolver.class);

    public static final String DEFAULT_EXTENSION = "nii.gz";

    private final PipelineInterface pipelineInterface;

    public DatasetResolver(PipelineInterface pipelineInterface) {
        this.pipelineInterface = Objects.requireNonNull(pipelineInterface, "pipelineInterface");
    }

    public Optional<DatasetResolution> resolve(String stepCode) {
        return resolve(stepCode, DEFAULT_EXTENSION, null);
    }

    /**
     * @param ext   file extension to select; null means {@link #DEFAULT_EXTENSION}
     * @param regex optional file-name pattern, passed through to the query
     */
    public Optional<DatasetResolution> resolve(String stepCode, String ext, String regex) {
        if (stepCode == null) {
            return Optional.empty();
        }
        for (DatasetCategory category : DatasetCategory.values()) {
            Optional<String> location = pipelineInterface.locate(category, stepCode);
            if (location.isPresent()) {
                DatasetFilter filter = new DatasetFilter(
                        category.packageScoped() ? pipelineInterface.label() : null,
                        ext == null ? DEFAULT_EXTENSION : ext,
                        regex,
                        category,
                        location.get());
                log.debug("Step code '{}' resolved to {} at '{}'", stepCode, category, location.get());
                return Optional.of(new DatasetResolution(stepCode, category, location.get(), filter));
            }
        }
        log.debug("Step code '{}' has no data in pipeline '{}'", stepCode, pipelineInterface.label());
        return Optional.empty();
    }
}
