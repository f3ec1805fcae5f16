/* (C)2026 */
package com.ammann.eegprune.model;

import com.ammann.eegprune.enumeration.EventType;
import com.ammann.eegprune.exception.ValidationException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Authoritative sample-to-wall-clock mapping of one recording plus its ordered events.
 *
 * <p>Invariants held by every instance:
 * <ul>
 *   <li>the timestamp table has exactly one entry per sample and never decreases</li>
 *   <li>{@code originalIndices[i]} is the 1-based index the sample had when loaded</li>
 *   <li>events are sorted by {@link Event#TIMELINE_ORDER}</li>
 * </ul>
 *
 * <p>The revision counts excisions applied so far; {@link #excisedOriginalSpans()} records
 * every removed sample in loaded-recording coordinates.
 */
public final class Timeline {

    private final double sampleRateHz;
    private final long[] wallClockMillis;
    private final int[] originalIndices;
    private final List<Event> events;
    private final int revision;
    private final SpanSet excisedOriginalSpans;
    private final long nextEventId;

    public Timeline(
            double sampleRateHz,
            long[] wallClockMillis,
            int[] originalIndices,
            List<Event> events,
            int revision,
            SpanSet excisedOriginalSpans,
            long nextEventId) {
        if (!(sampleRateHz > 0) || Double.isInfinite(sampleRateHz)) {
            throw ValidationException.invalidParameter(
                    "sampleRateHz", sampleRateHz, "positive finite number");
        }
        if (wallClockMillis.length != originalIndices.length) {
            throw ValidationException.sizeMismatch(
                    "original index table", wallClockMillis.length, originalIndices.length);
        }
        for (int i = 1; i < wallClockMillis.length; i++) {
            if (wallClockMillis[i] < wallClockMillis[i - 1]) {
                throw new ValidationException(
                        String.format(
                                "Timestamp table decreases at sample %d (%d -> %d)",
                                i + 1, wallClockMillis[i - 1], wallClockMillis[i]));
            }
        }
        List<Event> sorted = new ArrayList<>(events);
        sorted.sort(Event.TIMELINE_ORDER);
        long maxId = sorted.stream().mapToLong(Event::id).max().orElse(0L);

        this.sampleRateHz = sampleRateHz;
        this.wallClockMillis = wallClockMillis.clone();
        this.originalIndices = originalIndices.clone();
        this.events = Collections.unmodifiableList(sorted);
        this.revision = revision;
        this.excisedOriginalSpans = excisedOriginalSpans;
        this.nextEventId = Math.max(nextEventId, maxId + 1);
    }

    /**
     * Creates the revision-0 timeline of a freshly loaded recording.
     *
     * <p>Every event gets its original latency and wall-clock time captured here, before
     * any edit can move it.
     *
     * @throws ValidationException when an event latency lies outside {@code [1, N]}
     */
    public static Timeline load(double sampleRateHz, long[] wallClockMillis, List<Event> events) {
        int n = wallClockMillis.length;
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) {
            indices[i] = i + 1;
        }
        List<Event> captured = new ArrayList<>(events.size());
        for (Event event : events) {
            if (event.latency() < 1 || event.latency() > n) {
                throw ValidationException.invalidParameter(
                        "event " + event.id() + " latency", event.latency(), "value in [1, " + n + "]");
            }
            captured.add(
                    event.withProvenance(
                            event.provenance()
                                    .preserveOrCapture(
                                            event.latency(), wallClockMillis[event.latency() - 1])));
        }
        return new Timeline(sampleRateHz, wallClockMillis, indices, captured, 0, SpanSet.empty(), 1L);
    }

    /** Loads a timeline whose timestamps advance uniformly from {@code start} at the sample rate. */
    public static Timeline uniform(double sampleRateHz, Instant start, int sampleCount, List<Event> events) {
        long startMillis = start.toEpochMilli();
        long[] wallClock = new long[sampleCount];
        for (int i = 0; i < sampleCount; i++) {
            wallClock[i] = startMillis + Math.round(i * 1000.0 / sampleRateHz);
        }
        return load(sampleRateHz, wallClock, events);
    }

    public double sampleRateHz() {
        return sampleRateHz;
    }

    public int sampleCount() {
        return wallClockMillis.length;
    }

    /** Epoch milliseconds of the 1-based sample. */
    public long wallClockAt(int sampleIndex) {
        return wallClockMillis[sampleIndex - 1];
    }

    /** 1-based index the given current sample had in the recording as loaded. */
    public int originalIndexAt(int sampleIndex) {
        return originalIndices[sampleIndex - 1];
    }

    public boolean isInRange(int sampleIndex) {
        return sampleIndex >= 1 && sampleIndex <= wallClockMillis.length;
    }

    public long[] wallClockMillis() {
        return wallClockMillis.clone();
    }

    public int[] originalIndices() {
        return originalIndices.clone();
    }

    public List<Event> events() {
        return events;
    }

    public List<Event> eventsOfType(EventType type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    public int revision() {
        return revision;
    }

    public SpanSet excisedOriginalSpans() {
        return excisedOriginalSpans;
    }

    public long nextEventId() {
        return nextEventId;
    }

    public double toSeconds(long samples) {
        return samples / sampleRateHz;
    }

    /** Same samples and revision, different event list (re-sorted). */
    public Timeline withEvents(List<Event> newEvents) {
        return new Timeline(
                sampleRateHz,
                wallClockMillis,
                originalIndices,
                newEvents,
                revision,
                excisedOriginalSpans,
                nextEventId);
    }

    /**
     * Returns the timeline after removing the columns not flagged in {@code keep}.
     * Timestamps and original indices are filtered with the very same mask.
     */
    public Timeline retainColumns(
            boolean[] keep,
            int keptCount,
            List<Event> newEvents,
            SpanSet newExcisedOriginalSpans,
            long newNextEventId) {
        if (keep.length != wallClockMillis.length) {
            throw ValidationException.sizeMismatch("keep mask", wallClockMillis.length, keep.length);
        }
        long[] wallClock = new long[keptCount];
        int[] indices = new int[keptCount];
        int k = 0;
        for (int i = 0; i < keep.length; i++) {
            if (keep[i]) {
                wallClock[k] = wallClockMillis[i];
                indices[k] = originalIndices[i];
                k++;
            }
        }
        return new Timeline(
                sampleRateHz,
                wallClock,
                indices,
                newEvents,
                revision + 1,
                newExcisedOriginalSpans,
                newNextEventId);
    }

    @Override
    public String toString() {
        return "Timeline{samples="
                + wallClockMillis.length
                + ", rate="
                + sampleRateHz
                + ", events="
                + events.size()
                + ", revision="
                + revision
                + ", excised="
                + excisedOriginalSpans
                + "}";
    }
}
