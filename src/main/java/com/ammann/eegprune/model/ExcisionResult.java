/* (C)2026 */
package com.ammann.eegprune.model;

import com.ammann.eegprune.dto.PipelineWarningDTO;
import java.util.List;

/**
 * Recording after excision plus what the excision did.
 *
 * @param recording         pruned recording (the input instance itself for a no-op)
 * @param excised           normalized spans removed, in pre-excision coordinates
 * @param droppedEvents     events removed because they sat inside an excised span
 * @param insertedBoundaries boundary markers added at seams
 * @param warnings          trailing events dropped after excision
 */
public record ExcisionResult(
        Recording recording,
        SpanSet excised,
        List<Event> droppedEvents,
        List<Event> insertedBoundaries,
        List<PipelineWarningDTO> warnings) {

    public ExcisionResult {
        droppedEvents = List.copyOf(droppedEvents);
        insertedBoundaries = List.copyOf(insertedBoundaries);
        warnings = List.copyOf(warnings);
    }

    public static ExcisionResult noop(Recording recording) {
        return new ExcisionResult(recording, SpanSet.empty(), List.of(), List.of(), List.of());
    }

    public long samplesRemoved() {
        return excised.totalLength();
    }
}
