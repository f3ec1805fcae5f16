/* (C)2026 */
package com.ammann.eegprune.model;

import com.ammann.eegprune.dto.PipelineWarningDTO;
import com.ammann.eegprune.dto.ReconciliationRecordDTO;
import java.util.List;

/** Immutable reconciliation rows, sorted by original time, plus provenance warnings. */
public record ReconciliationReport(
        List<ReconciliationRecordDTO> records, List<PipelineWarningDTO> warnings) {

    public ReconciliationReport {
        records = List.copyOf(records);
        warnings = List.copyOf(warnings);
    }
}
