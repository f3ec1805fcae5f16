/* (C)2026 */
package com.ammann.eegprune.model;

import com.ammann.eegprune.dto.PipelineWarningDTO;
import java.util.List;
import java.util.Map;

/**
 * Spans covering unwanted sleep stages.
 *
 * @param spans                  normalized spans, bound to the timeline revision they were built on
 * @param samplesRemovedByStage  samples covered per stage code, before merging
 * @param spanCountByStage       spans per stage code, before merging
 * @param warnings               markers or requested stages that were skipped
 */
public record StageSpans(
        SpanSet spans,
        Map<Integer, Long> samplesRemovedByStage,
        Map<Integer, Integer> spanCountByStage,
        List<PipelineWarningDTO> warnings) {

    public StageSpans {
        samplesRemovedByStage = Map.copyOf(samplesRemovedByStage);
        spanCountByStage = Map.copyOf(spanCountByStage);
        warnings = List.copyOf(warnings);
    }
}
