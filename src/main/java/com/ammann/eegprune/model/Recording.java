/* (C)2026 */
package com.ammann.eegprune.model;

import com.ammann.eegprune.exception.ValidationException;
import java.util.Objects;

/**
 * One recording as handled by the pipeline: sample matrix and timeline, always aligned
 * column for column.
 *
 * @param id       recording or session identifier used in logs and errors
 * @param samples  channels x samples matrix
 * @param timeline timestamp table and events for the same samples
 */
public record Recording(String id, SampleMatrix samples, Timeline timeline) {

    public Recording {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(samples, "samples");
        Objects.requireNonNull(timeline, "timeline");
        if (samples.sampleCount() != timeline.sampleCount()) {
            throw ValidationException.sizeMismatch(
                    "timestamp table", samples.sampleCount(), timeline.sampleCount());
        }
    }

    public int sampleCount() {
        return timeline.sampleCount();
    }

    public double sampleRateHz() {
        return timeline.sampleRateHz();
    }

    public Recording withTimeline(Timeline newTimeline) {
        return new Recording(id, samples, newTimeline);
    }
}
