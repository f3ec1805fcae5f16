/* (C)2026 */
package com.ammann.eegprune.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Recording submitted for pruning.
 *
 * <p>Channel values of {@code null} are treated as invalid data. Either
 * {@code timestampsMillis} (one per sample) or {@code startTime} must be given.
 */
@Schema(description = "Recording submitted for pruning")
public record RecordingRequestDTO(
        @NotBlank @Schema(description = "Recording/session identifier") String recordingId,
        @NotNull @Positive @Schema(description = "Sample rate in Hz") Double sampleRateHz,
        @NotEmpty @Schema(description = "Channel rows; null marks invalid data")
                List<List<Double>> channels,
        @Schema(description = "Wall-clock time of the first sample") Instant startTime,
        @Schema(description = "Per-sample epoch milliseconds") List<Long> timestampsMillis,
        @Valid @Schema(description = "Events on the recording") List<EventDTO> events,
        @Valid @Schema(description = "Option overrides") PruningOptionsDTO options,
        @Schema(description = "Include pruned samples and timestamps in the response")
                Boolean includeData) {}
