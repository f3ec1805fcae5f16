/* (C)2026 */
package com.ammann.eegprune.service;

import com.ammann.eegprune.model.Recording;
import com.ammann.eegprune.model.SampleMatrix;
import com.ammann.eegprune.model.Span;
import com.ammann.eegprune.model.SpanSet;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds contiguous runs of invalid sample columns.
 *
 * <p>A column is invalid when any channel holds NaN. Each maximal run becomes one span,
 * including runs of a single sample and runs touching the first or last sample. Detection
 * is a pure function of the matrix; callers log segment counts and durations.
 */
@ApplicationScoped
public class InvalidSpanDetectorService {

    /**
     * Detects invalid-data spans.
     *
     * @param matrix sample matrix to scan
     * @return normalized spans, empty when no invalid column exists
     */
    public SpanSet detect(SampleMatrix matrix) {
        int n = matrix.sampleCount();
        List<Span> runs = new ArrayList<>();
        int runStart = 0;

        for (int i = 1; i <= n; i++) {
            boolean invalid = matrix.isInvalidColumn(i);
            if (invalid && runStart == 0) {
                runStart = i;
            } else if (!invalid && runStart != 0) {
                runs.add(new Span(runStart, i - 1));
                runStart = 0;
            }
        }
        if (runStart != 0) {
            runs.add(new Span(runStart, n));
        }

        return runs.isEmpty() ? SpanSet.empty() : SpanSet.normalize(runs);
    }

    /**
     * Detects invalid-data spans and binds them to the recording's current timeline revision,
     * so they cannot be excised from a later, shrunk timeline.
     */
    public SpanSet detect(Recording recording) {
        return detect(recording.samples()).boundTo(recording.timeline().revision());
    }
}
