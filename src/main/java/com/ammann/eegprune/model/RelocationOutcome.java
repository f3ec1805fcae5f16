/* (C)2026 */
package com.ammann.eegprune.model;

/**
 * What relocation did to one event of interest.
 *
 * @param eventId         event identifier
 * @param previousLatency latency before relocation
 * @param newLatency      latency after relocation (equal to previous when not moved)
 * @param moved           whether the event was moved
 * @param shiftSeconds    {@code (newLatency - previousLatency) / rate}
 * @param span            span the event sat in, {@code null} when outside every span
 */
public record RelocationOutcome(
        long eventId,
        int previousLatency,
        int newLatency,
        boolean moved,
        double shiftSeconds,
        Span span) {}
