/* (C)2026 */
package com.ammann.eegprune.dto;

import com.ammann.eegprune.enumeration.PipelineStep;
import com.ammann.eegprune.enumeration.WarningType;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Recoverable anomaly raised by a pipeline step.
 *
 * @param type    anomaly category
 * @param step    step that raised it
 * @param message human-readable description
 * @param eventId affected event, {@code null} when not event-specific
 */
@Schema(description = "Recoverable anomaly raised during pruning")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineWarningDTO(
        @Schema(description = "Warning category") WarningType type,
        @Schema(description = "Pipeline step that raised the warning") PipelineStep step,
        @Schema(description = "Description of the anomaly") String message,
        @Schema(description = "Identifier of the affected event") Long eventId) {

    public static PipelineWarningDTO of(WarningType type, PipelineStep step, String message) {
        return new PipelineWarningDTO(type, step, message, null);
    }

    public static PipelineWarningDTO forEvent(
            WarningType type, PipelineStep step, long eventId, String message) {
        return new PipelineWarningDTO(type, step, message, eventId);
    }
}
