/* (C)2026 */
package com.ammann.eegprune.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Outcome of a pruning run: what was removed, the resulting events, the reconciliation
 * report and every warning. Samples and timestamps are only present when requested.
 */
@Schema(description = "Result of pruning one recording")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PruningResultDTO(
        @Schema(description = "Recording/session identifier") String recordingId,
        @Schema(description = "Samples before pruning") Integer originalSampleCount,
        @Schema(description = "Samples after pruning") Integer sampleCount,
        @Schema(description = "Detected invalid-data spans") List<SpanDTO> invalidSpans,
        @Schema(description = "Removed sleep-stage spans") List<SpanDTO> stageSpans,
        @Schema(description = "Removal totals per category") List<RemovalSummaryDTO> removals,
        @Schema(description = "Events of the pruned recording") List<EventStateDTO> events,
        @Schema(description = "Reconciliation report rows") List<ReconciliationRecordDTO> report,
        @Schema(description = "Recoverable anomalies") List<PipelineWarningDTO> warnings,
        @Schema(description = "Pruned channel rows") List<List<Double>> channels,
        @Schema(description = "Pruned per-sample epoch milliseconds") List<Long> timestampsMillis) {}
