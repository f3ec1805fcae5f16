/* (C)2026 */
package com.ammann.eegprune.model;

import com.ammann.eegprune.enumeration.EventType;
import com.ammann.eegprune.exception.ValidationException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.Set;

/**
 * Settings of one pruning run.
 *
 * @param bufferSamples        samples added after a span end when relocating an event
 * @param relocationEventTypes event types relocated out of invalid spans and reported
 * @param protoTypes           protocol types of interest; empty means any
 * @param unwantedStages       sleep stage codes whose data and stimulation protocols are removed
 * @param contiguityGap        spans whose start is within this many samples of the previous end merge
 * @param keepEventTypes       event types kept in the final recording
 * @param reportZone           zone used to render the report's wall-clock column
 */
public record PruningOptions(
        int bufferSamples,
        Set<EventType> relocationEventTypes,
        Set<Integer> protoTypes,
        Set<Integer> unwantedStages,
        int contiguityGap,
        Set<EventType> keepEventTypes,
        ZoneId reportZone) {

    public static final int DEFAULT_BUFFER_SAMPLES = 2;

    public PruningOptions {
        if (bufferSamples < 0) {
            throw ValidationException.invalidParameter(
                    "bufferSamples", bufferSamples, "non-negative integer");
        }
        if (contiguityGap < 0) {
            throw ValidationException.invalidParameter(
                    "contiguityGap", contiguityGap, "non-negative integer");
        }
        relocationEventTypes = Set.copyOf(relocationEventTypes);
        protoTypes = Set.copyOf(protoTypes);
        unwantedStages = Set.copyOf(unwantedStages);
        keepEventTypes = Set.copyOf(keepEventTypes);
        if (reportZone == null) {
            reportZone = ZoneOffset.UTC;
        }
    }

    /** Stim start/end of protocol type 4, removing wake, N1 and REM data. */
    public static PruningOptions defaults() {
        return new PruningOptions(
                DEFAULT_BUFFER_SAMPLES,
                EnumSet.of(EventType.STIM_START, EventType.STIM_END),
                Set.of(4),
                Set.of(0, 1, 4),
                SpanSet.DEFAULT_CONTIGUITY_GAP,
                EnumSet.of(EventType.STIM_START, EventType.STIM_END, EventType.BOUNDARY),
                ZoneOffset.UTC);
    }

    public PruningOptions withUnwantedStages(Set<Integer> stages) {
        return new PruningOptions(
                bufferSamples,
                relocationEventTypes,
                protoTypes,
                stages,
                contiguityGap,
                keepEventTypes,
                reportZone);
    }

    public PruningOptions withBufferSamples(int samples) {
        return new PruningOptions(
                samples,
                relocationEventTypes,
                protoTypes,
                unwantedStages,
                contiguityGap,
                keepEventTypes,
                reportZone);
    }
}
