/* (C)2026 */
package com.ammann.eegprune.model;

import com.ammann.eegprune.exception.InvalidSpanException;

/**
 * Closed interval of 1-based sample indices marked for removal.
 *
 * @param start first sample in the span (at least 1)
 * @param end   last sample in the span (at least {@code start})
 */
public record Span(int start, int end) {

    public Span {
        if (start > end) {
            throw InvalidSpanException.reversed(start, end);
        }
        if (start < 1) {
            throw InvalidSpanException.beforeFirstSample(start, end);
        }
    }

    public static Span of(int start, int end) {
        return new Span(start, end);
    }

    /** Number of samples covered, {@code end - start + 1}. */
    public int length() {
        return end - start + 1;
    }

    public boolean contains(int sampleIndex) {
        return sampleIndex >= start && sampleIndex <= end;
    }

    public boolean overlaps(Span other) {
        return other.start <= end && other.end >= start;
    }
}
