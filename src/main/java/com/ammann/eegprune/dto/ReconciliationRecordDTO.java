/* (C)2026 */
package com.ammann.eegprune.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One audit row mapping a retained event of interest back to where it originally sat.
 *
 * <p>Property order is the CSV column order and must not change; new columns are only
 * ever appended.
 *
 * @param eventType          event type label
 * @param protoType          protocol type, {@code null} when absent
 * @param originalLatencySec original latency in seconds
 * @param newLatencySec      latency in the pruned recording in seconds
 * @param actualTime         wall-clock time at the original latency, {@code HH:mm:ss}
 * @param shiftDistanceSec   signed shift, new minus original
 * @param moved              {@code true} when the event does not sit at its original latency
 * @param sleepStage         stage code in effect at the event, or {@code unknown}
 * @param provenanceFallback {@code true} when original values were unavailable and current ones were used
 */
@Schema(description = "Reconciliation row for one retained event of interest")
@JsonPropertyOrder({
    "Event_Type",
    "Proto_Type",
    "Original_Latency_sec",
    "New_Latency_sec",
    "Actual_Time",
    "Shift_Distance_sec",
    "Moved",
    "Sleep_Stage",
    "Provenance_Fallback"
})
public record ReconciliationRecordDTO(
        @JsonProperty("Event_Type") @Schema(description = "Event type label") String eventType,
        @JsonProperty("Proto_Type") @Schema(description = "Protocol type") Integer protoType,
        @JsonProperty("Original_Latency_sec") @Schema(description = "Original latency (s)")
                double originalLatencySec,
        @JsonProperty("New_Latency_sec") @Schema(description = "Latency after pruning (s)")
                double newLatencySec,
        @JsonProperty("Actual_Time") @Schema(description = "Original wall-clock time (HH:mm:ss)")
                String actualTime,
        @JsonProperty("Shift_Distance_sec") @Schema(description = "New minus original latency (s)")
                double shiftDistanceSec,
        @JsonProperty("Moved") @Schema(description = "Event no longer at its original latency")
                boolean moved,
        @JsonProperty("Sleep_Stage") @Schema(description = "Sleep stage code or 'unknown'")
                String sleepStage,
        @JsonProperty("Provenance_Fallback")
                @Schema(description = "Current values substituted for missing original values")
                boolean provenanceFallback) {

    public static final String UNKNOWN_STAGE = "unknown";

    public static String stageLabel(Integer stage) {
        return stage == null ? UNKNOWN_STAGE : stage.toString();
    }
}
