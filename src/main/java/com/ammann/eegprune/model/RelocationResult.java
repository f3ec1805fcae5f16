/* (C)2026 */
package com.ammann.eegprune.model;

import com.ammann.eegprune.dto.PipelineWarningDTO;
import java.util.List;

/**
 * Timeline after relocation, the per-event outcomes and the events that could not be moved.
 */
public record RelocationResult(
        Timeline timeline, List<RelocationOutcome> outcomes, List<PipelineWarningDTO> warnings) {

    public RelocationResult {
        outcomes = List.copyOf(outcomes);
        warnings = List.copyOf(warnings);
    }

    public long movedCount() {
        return outcomes.stream().filter(RelocationOutcome::moved).count();
    }
}
