/* (C)2026 */
package com.ammann.eegprune.model;

/**
 * Where an event originally sat, and whether relocation moved it.
 *
 * @param originalLatency         1-based latency in the recording as loaded, {@code null} if never captured
 * @param originalWallClockMillis epoch milliseconds at the original latency, {@code null} if never captured
 * @param moved                   {@code true} once relocation moved the event out of an invalid span
 * @param shiftSeconds            accumulated relocation distance in seconds (new minus old)
 */
public record EventProvenance(
        Integer originalLatency, Long originalWallClockMillis, boolean moved, double shiftSeconds) {

    public static final EventProvenance NONE = new EventProvenance(null, null, false, 0.0);

    public static EventProvenance captured(int originalLatency, long originalWallClockMillis) {
        return new EventProvenance(originalLatency, originalWallClockMillis, false, 0.0);
    }

    public boolean hasOriginalLatency() {
        return originalLatency != null;
    }

    public boolean hasOriginalWallClock() {
        return originalWallClockMillis != null;
    }

    /**
     * Captures the original position unless one is already recorded; the first capture wins.
     */
    public EventProvenance preserveOrCapture(int latency, long wallClockMillis) {
        return new EventProvenance(
                originalLatency != null ? originalLatency : Integer.valueOf(latency),
                originalWallClockMillis != null ? originalWallClockMillis : Long.valueOf(wallClockMillis),
                moved,
                shiftSeconds);
    }

    /** Marks the event as moved and adds the given shift to the accumulated shift. */
    public EventProvenance withRelocation(double additionalShiftSeconds) {
        return new EventProvenance(
                originalLatency, originalWallClockMillis, true, shiftSeconds + additionalShiftSeconds);
    }
}
