package com.nipt.orchestrator.support;

import com.nipt.orchestrator.bucket.DatasetCategory;
import com.nipt.orchestrator.pipeline.Parameter;
import com.nipt.orchestrator.pipeline.PipelineDefinition;
import com.nipt.orchestrator.plugin.PackageManifest;
import com.nipt.orchestrator.plugin.PipelinePackage;
import com.nipt.orchestrator.processing.PipelineInterface;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test package "T1proc" with a single "denoise" step that records produced data as step code 010.
 */
public class DenoisePackage implements PipelinePackage {

    public static final String TITLE = "T1proc";

    private final AtomicInteger invocations = new AtomicInteger();
    private final List<Double>  sigmas      = new ArrayList<>();

    @Override
    public PackageManifest manifest() {
        return new PackageManifest(TITLE, "1.0.0", "T1-weighted preprocessing. Parameters: sigma, suffix.");
    }

    @Override
    public PipelineDefinition create(PipelineInterface pipelineInterface) {
        return new Definition(pipelineInterface);
    }

    public int invocations() { return invocations.get(); }

    public synchronized List<Double> sigmas() { return List.copyOf(sigmas); }

    private class Definition extends PipelineDefinition {

        private final Parameter<Double> sigma  = parameter("sigma", Double.class, 1.0, "Noise level");
        private final Parameter<String> suffix = parameter("suffix", String.class, null);

        Definition(PipelineInterface pipelineInterface) {
            super(pipelineInterface);
            registerStep("denoise", "Non-local means denoising", this::denoise);
        }

        private void denoise() {
            invocations.incrementAndGet();
            synchronized (DenoisePackage.this) {
                sigmas.add(sigma.get());
            }
            if (pipelineInterface() instanceof FakePipelineInterface fake) {
                fake.produce(DatasetCategory.PROCESSED, "010", "denoise");
            }
        }
    }
}
