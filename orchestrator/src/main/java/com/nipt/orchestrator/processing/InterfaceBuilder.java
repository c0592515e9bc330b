package com.nipt.orchestrator.processing;

/**
 * Authors an ad-hoc step directly against a {@link PipelineInterface}, without an
 * installed package. Supplied by the interface plugin through {@link PipelineInterface#builder()}.
 *
 * <pre>
 *   orchestrator.setEmptyPackage("Smoothing");
 *   orchestrator.getBuilder().orElseThrow()
 *           .initStep("gaussian", "040")
 *           .setInput("input", "010")
 *           .setOutput("output")
 *           .setCommand("3dmerge -1blur_fwhm 4 -prefix *[output] *[input]")
 *           .run();
 * </pre>
 */
public interface InterfaceBuilder {

    /** Start a step named {@code title} whose output is stored under {@code stepCode}. */
    InterfaceBuilder initStep(String title, String stepCode);

    /** Read input files from the output of an earlier step code. */
    InterfaceBuilder setInput(String label, String sourceStepCode);

    InterfaceBuilder setOutput(String label);

    /** Command template; inputs and outputs are referenced as {@code *[label]}. */
    InterfaceBuilder setCommand(String command);

    /** Submit the step's jobs to the interface. */
    void run();
}
