/* (C)2026 */
package com.ammann.eegprune.exception;

/**
 * Raised when a span handed to the exciser does not fit the current timeline.
 *
 * <p>Signals a stale span set or an ordering bug upstream. Spans are never clamped
 * into range.
 */
public class ExcisionRangeException extends PruningException
{
    public ExcisionRangeException(String message)
    {
        super(message);
    }

    public static ExcisionRangeException outOfBounds(int start, int end, int sampleCount)
    {
        return new ExcisionRangeException(
                String.format(
                        "Span [%d, %d] lies outside the timeline [1, %d]", start, end, sampleCount));
    }

    public static ExcisionRangeException staleSpanSet(int spanRevision, int timelineRevision)
    {
        return new ExcisionRangeException(
                String.format(
                        "Span set was computed against timeline revision %d but the timeline is at"
                                + " revision %d; recompute spans after each excision",
                        spanRevision, timelineRevision));
    }

    public static ExcisionRangeException unboundSpanSet(int timelineRevision)
    {
        return new ExcisionRangeException(
                String.format(
                        "Span set is not bound to a timeline revision; bind it to revision %d"
                                + " before excising",
                        timelineRevision));
    }
}
