/* (C)2026 */
package com.ammann.eegprune.enumeration;

/**
 * Named steps of the pruning pipeline, in execution order.
 *
 * <p>Every fatal failure is reported together with the step it happened in.
 */
public enum PipelineStep {
    /** Drop stimulation protocols that start during unwanted sleep stages */
    FILTER_PROTOCOLS("filter-protocols"),
    /** Find invalid-data spans */
    DETECT("detect"),
    /** Move events of interest out of invalid-data spans */
    RELOCATE("relocate"),
    /** Remove invalid-data spans */
    EXCISE("excise"),
    /** Remove unwanted sleep-stage spans */
    REMOVE_STAGES("remove-stages"),
    /** Compare stim start and stim end counts per protocol type */
    CHECK_PROTOCOLS("check-protocols"),
    /** Build the reconciliation report */
    REPORT("report"),
    /** Keep only the configured event types */
    FILTER_EVENTS("filter-events");

    private final String label;

    PipelineStep(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
