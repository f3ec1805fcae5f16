/* (C)2026 */
package com.ammann.eegprune.model;

import com.ammann.eegprune.enumeration.EventType;
import java.util.Comparator;
import java.util.Objects;
import java.util.Set;

/**
 * Discrete marker on a recording timeline.
 *
 * @param id          identifier, unique within a recording and stable across edits
 * @param type        event category
 * @param latency     1-based sample index into the current timeline
 * @param protoType   stimulation protocol type, {@code null} when not applicable
 * @param code        raw annotation code as loaded (sleep stage text for stage markers)
 * @param sleepStage  stage code parsed once from {@code code}, {@code null} when absent or unparseable
 * @param duration    samples removed at the seam (boundary markers), otherwise 0
 * @param provenance  original position and relocation metadata
 */
public record Event(
        long id,
        EventType type,
        int latency,
        Integer protoType,
        String code,
        Integer sleepStage,
        int duration,
        EventProvenance provenance) {

    /** Latency order; boundary markers first on ties, then by id. */
    public static final Comparator<Event> TIMELINE_ORDER =
            Comparator.comparingInt(Event::latency)
                    .thenComparing(e -> e.type() != EventType.BOUNDARY)
                    .thenComparingLong(Event::id);

    public Event {
        Objects.requireNonNull(type, "type");
        if (provenance == null) {
            provenance = EventProvenance.NONE;
        }
    }

    public static Event of(long id, EventType type, int latency) {
        return new Event(id, type, latency, null, null, null, 0, EventProvenance.NONE);
    }

    public static Event stimulation(long id, EventType type, int latency, Integer protoType) {
        return new Event(id, type, latency, protoType, null, null, 0, EventProvenance.NONE);
    }

    public static Event sleepStage(long id, int latency, String code) {
        return new Event(
                id, EventType.SLEEP_STAGE, latency, null, code, parseStageCode(code), 0,
                EventProvenance.NONE);
    }

    public static Event boundary(long id, int latency, int duration) {
        return new Event(
                id, EventType.BOUNDARY, latency, null, null, null, duration, EventProvenance.NONE);
    }

    /**
     * Parses a sleep-stage code such as {@code "2"} or {@code "2.0"}.
     *
     * @return the integral stage, or {@code null} for blank, non-numeric or fractional codes
     */
    public static Integer parseStageCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        try {
            double value = Double.parseDouble(code.trim());
            if (Double.isNaN(value) || value != Math.rint(value)) {
                return null;
            }
            return (int) value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public boolean isBoundary() {
        return type == EventType.BOUNDARY;
    }

    /**
     * @param types      accepted types
     * @param protoTypes accepted protocol types; an empty set accepts any
     */
    public boolean matches(Set<EventType> types, Set<Integer> protoTypes) {
        if (!types.contains(type)) {
            return false;
        }
        return protoTypes.isEmpty() || (protoType != null && protoTypes.contains(protoType));
    }

    public Event withLatency(int newLatency) {
        return new Event(id, type, newLatency, protoType, code, sleepStage, duration, provenance);
    }

    public Event withDuration(int newDuration) {
        return new Event(id, type, latency, protoType, code, sleepStage, newDuration, provenance);
    }

    public Event withProvenance(EventProvenance newProvenance) {
        return new Event(id, type, latency, protoType, code, sleepStage, duration, newProvenance);
    }
}
