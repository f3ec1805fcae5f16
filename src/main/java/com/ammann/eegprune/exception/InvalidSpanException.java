/* (C)2026 */
package com.ammann.eegprune.exception;

/**
 * Raised when a span is malformed: start after end, or start before the first sample.
 * Fatal for the recording being processed; the span is surfaced, never coerced.
 */
public class InvalidSpanException extends PruningException
{
    private final long start;
    private final long end;

    public InvalidSpanException(String message, long start, long end)
    {
        super(message);
        this.start = start;
        this.end = end;
    }

    public long getStart()
    {
        return start;
    }

    public long getEnd()
    {
        return end;
    }

    public static InvalidSpanException reversed(long start, long end)
    {
        return new InvalidSpanException(
                String.format("Invalid span [%d, %d]: start is after end", start, end), start, end);
    }

    public static InvalidSpanException beforeFirstSample(long start, long end)
    {
        return new InvalidSpanException(
                String.format("Invalid span [%d, %d]: sample indices start at 1", start, end),
                start,
                end);
    }
}
