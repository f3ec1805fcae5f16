/* (C)2026 */
package com.ammann.eegprune.model;

import com.ammann.eegprune.enumeration.PipelineStep;

/**
 * Result of one recording within a batch: either a result or the step that failed.
 */
public record BatchOutcome(
        String recordingId, PruningResult result, PipelineStep failedStep, String errorMessage) {

    public static BatchOutcome success(PruningResult result) {
        return new BatchOutcome(result.original().id(), result, null, null);
    }

    public static BatchOutcome failure(String recordingId, PipelineStep step, String message) {
        return new BatchOutcome(recordingId, null, step, message);
    }

    public boolean succeeded() {
        return result != null;
    }
}
