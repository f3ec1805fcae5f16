/* (C)2026 */
package com.ammann.eegprune.model;

import com.ammann.eegprune.dto.PipelineWarningDTO;
import com.ammann.eegprune.dto.ReconciliationRecordDTO;
import com.ammann.eegprune.dto.RemovalSummaryDTO;
import java.util.List;

/**
 * Everything a pruning run produced for one recording.
 *
 * @param original     recording as loaded
 * @param pruned       recording after all excisions and the final event filter
 * @param invalidSpans invalid-data spans, in loaded coordinates
 * @param stageSpans   unwanted sleep-stage spans, in coordinates after invalid-data excision
 * @param removals     totals per removal category
 * @param relocations  relocation outcomes for events of interest
 * @param report       reconciliation rows
 * @param warnings     every recoverable anomaly, in step order
 */
public record PruningResult(
        Recording original,
        Recording pruned,
        SpanSet invalidSpans,
        SpanSet stageSpans,
        List<RemovalSummaryDTO> removals,
        List<RelocationOutcome> relocations,
        List<ReconciliationRecordDTO> report,
        List<PipelineWarningDTO> warnings) {

    public PruningResult {
        removals = List.copyOf(removals);
        relocations = List.copyOf(relocations);
        report = List.copyOf(report);
        warnings = List.copyOf(warnings);
    }
}
