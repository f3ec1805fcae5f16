/* (C)2026 */
package com.ammann.eegprune.dto;

import jakarta.validation.constraints.NotNull;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Event as delivered by the annotation layer.
 *
 * @param type      type label, e.g. {@code stim start}, {@code Sleep Stage}
 * @param latency   1-based sample index
 * @param protoType protocol type of stimulation events
 * @param code      annotation code, the stage number as text for sleep-stage markers
 */
@Schema(description = "Input event")
public record EventDTO(
        @Schema(description = "Event type label", example = "stim start") String type,
        @NotNull @Schema(description = "Latency as 1-based sample index") Integer latency,
        @Schema(description = "Stimulation protocol type") Integer protoType,
        @Schema(description = "Annotation code (sleep stage as text)") String code) {}
