/* (C)2026 */
package com.ammann.eegprune.enumeration;

/**
 * Recoverable anomalies reported alongside pipeline results.
 * None of these abort a recording.
 */
public enum WarningType {
    /** Relocation target lies beyond the end of the recording; event left in place */
    UNRESOLVABLE_RELOCATION,
    /** Unequal stim start and stim end counts for one protocol type */
    PROTOCOL_COUNT_MISMATCH,
    /** Report row built from current latency/time because original provenance is absent */
    MISSING_PROVENANCE,
    /** Non-boundary event dropped because its latency exceeded the shrunk timeline */
    TRAILING_EVENT_DROPPED,
    /** Stim start without stim end (or the reverse) */
    INCOMPLETE_PROTOCOL,
    /** Sleep-stage marker or requested stage with an unusable code */
    INVALID_SLEEP_STAGE_CODE
}
