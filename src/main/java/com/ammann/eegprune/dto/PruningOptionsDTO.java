/* (C)2026 */
package com.ammann.eegprune.dto;

import jakarta.validation.constraints.Min;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Per-request overrides of the configured pruning options. Absent fields keep the
 * configured value.
 */
@Schema(description = "Optional overrides of the configured pruning options")
public record PruningOptionsDTO(
        @Min(0) @Schema(description = "Samples added after a span end when relocating") Integer bufferSamples,
        @Schema(description = "Event types relocated and reported") List<String> relocationEventTypes,
        @Schema(description = "Protocol types of interest (empty = any)") List<Integer> protoTypes,
        @Schema(description = "Sleep stage codes whose data is removed") List<Integer> unwantedStages,
        @Min(0) @Schema(description = "Spans closer than this merge") Integer contiguityGap,
        @Schema(description = "Event types kept in the final recording") List<String> keepEventTypes,
        @Schema(description = "Time zone of the report's Actual_Time column") String reportZone) {}
