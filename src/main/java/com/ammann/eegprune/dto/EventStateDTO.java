/* (C)2026 */
package com.ammann.eegprune.dto;

import com.ammann.eegprune.model.Event;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Event of the pruned recording including its provenance.
 */
@Schema(description = "Event after pruning")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventStateDTO(
        @Schema(description = "Event identifier") Long id,
        @Schema(description = "Event type label") String type,
        @Schema(description = "Latency in the pruned recording (1-based)") Integer latency,
        @Schema(description = "Stimulation protocol type") Integer protoType,
        @Schema(description = "Annotation code") String code,
        @Schema(description = "Samples removed at this seam (boundary markers)") Integer duration,
        @Schema(description = "Latency in the recording as loaded") Integer originalLatency,
        @Schema(description = "Moved out of an invalid-data span") Boolean moved,
        @Schema(description = "Relocation distance in seconds") Double shiftSeconds) {

    public static EventStateDTO from(Event event) {
        return new EventStateDTO(
                event.id(),
                event.type().label(),
                event.latency(),
                event.protoType(),
                event.code(),
                event.isBoundary() ? event.duration() : null,
                event.provenance().originalLatency(),
                event.provenance().moved(),
                event.provenance().shiftSeconds());
    }
}
