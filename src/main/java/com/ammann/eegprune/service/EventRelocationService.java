/* (C)2026 */
package com.ammann.eegprune.service;

import com.ammann.eegprune.dto.PipelineWarningDTO;
import com.ammann.eegprune.enumeration.EventType;
import com.ammann.eegprune.enumeration.PipelineStep;
import com.ammann.eegprune.enumeration.WarningType;
import com.ammann.eegprune.exception.ValidationException;
import com.ammann.eegprune.model.Event;
import com.ammann.eegprune.model.EventProvenance;
import com.ammann.eegprune.model.RelocationOutcome;
import com.ammann.eegprune.model.RelocationResult;
import com.ammann.eegprune.model.Span;
import com.ammann.eegprune.model.SpanSet;
import com.ammann.eegprune.model.Timeline;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Moves events of interest out of spans that are about to be excised.
 *
 * <p>An event matching the type and protocol filter whose latency lies inside a span
 * (closed interval) moves to {@code span.end + bufferSamples}. If that target lies in
 * another span the event keeps moving past it. The original latency and wall-clock time
 * are captured on first move and never overwritten by later passes.
 *
 * <p>A target beyond the end of the recording cannot be resolved: the event stays where
 * it is and an {@link WarningType#UNRESOLVABLE_RELOCATION} warning is returned.
 */
@ApplicationScoped
public class EventRelocationService {

    private static final Logger LOG = Logger.getLogger(EventRelocationService.class);

    /**
     * Relocates matching events out of the given spans.
     *
     * @param timeline      timeline whose events are relocated (not modified)
     * @param spans         spans about to be excised
     * @param bufferSamples samples added after the span end
     * @param types         event types to relocate
     * @param protoTypes    protocol types to relocate; empty means any
     * @return new timeline, per-event outcomes and warnings
     */
    public RelocationResult relocate(
            Timeline timeline,
            SpanSet spans,
            int bufferSamples,
            Set<EventType> types,
            Set<Integer> protoTypes) {

        if (bufferSamples < 0) {
            throw ValidationException.invalidParameter(
                    "bufferSamples", bufferSamples, "non-negative integer");
        }

        int n = timeline.sampleCount();
        double rate = timeline.sampleRateHz();
        List<Event> updated = new ArrayList<>(timeline.events().size());
        List<RelocationOutcome> outcomes = new ArrayList<>();
        List<PipelineWarningDTO> warnings = new ArrayList<>();
        int moved = 0;
        int startsRemained = 0;
        int endsRemained = 0;

        for (Event event : timeline.events()) {
            if (!event.matches(types, protoTypes)) {
                updated.add(event);
                continue;
            }

            Optional<Span> containing = spans.findContaining(event.latency());
            if (containing.isEmpty()) {
                LOG.infof(
                        "Unmoved event: type=%s, proto_type=%s, latency=%d",
                        event.type().label(), event.protoType(), event.latency());
                outcomes.add(
                        new RelocationOutcome(
                                event.id(), event.latency(), event.latency(), false, 0.0, null));
                if (event.type() == EventType.STIM_START) {
                    startsRemained++;
                } else if (event.type() == EventType.STIM_END) {
                    endsRemained++;
                }
                updated.add(event);
                continue;
            }

            Span span = containing.get();
            long target = targetLatency(span, spans, bufferSamples);
            if (target > n) {
                String message =
                        String.format(
                                "Event '%s' (id %d) at latency %d cannot be moved past span [%d, %d]:"
                                        + " target %d exceeds recording length %d",
                                event.type().label(),
                                event.id(),
                                event.latency(),
                                span.start(),
                                span.end(),
                                target,
                                n);
                LOG.warn(message);
                warnings.add(
                        PipelineWarningDTO.forEvent(
                                WarningType.UNRESOLVABLE_RELOCATION,
                                PipelineStep.RELOCATE,
                                event.id(),
                                message));
                outcomes.add(
                        new RelocationOutcome(
                                event.id(), event.latency(), event.latency(), false, 0.0, span));
                updated.add(event);
                continue;
            }

            int newLatency = (int) target;
            double shiftSeconds = (newLatency - event.latency()) / rate;
            EventProvenance provenance =
                    event.provenance()
                            .preserveOrCapture(event.latency(), timeline.wallClockAt(event.latency()))
                            .withRelocation(shiftSeconds);
            updated.add(event.withLatency(newLatency).withProvenance(provenance));
            outcomes.add(
                    new RelocationOutcome(
                            event.id(), event.latency(), newLatency, true, shiftSeconds, span));
            moved++;

            LOG.infof(
                    "Moved event: type=%s, proto_type=%s, original latency=%d, new latency=%d,"
                            + " shift=%.2f seconds",
                    event.type().label(),
                    event.protoType(),
                    event.latency(),
                    newLatency,
                    shiftSeconds);
        }

        LOG.infof(
                "Relocation summary: %d moved, %d stim start remained, %d stim end remained,"
                        + " %d unresolvable",
                moved, startsRemained, endsRemained, warnings.size());

        return new RelocationResult(timeline.withEvents(updated), outcomes, warnings);
    }

    /**
     * {@code span.end + buffer}, pushed past any further span it lands in. A zero buffer
     * means the first sample after the span.
     */
    private long targetLatency(Span span, SpanSet spans, int bufferSamples) {
        int step = Math.max(bufferSamples, 1);
        long target = (long) span.end() + step;
        Optional<Span> landing = findContaining(spans, target);
        while (landing.isPresent()) {
            target = (long) landing.get().end() + step;
            landing = findContaining(spans, target);
        }
        return target;
    }

    private Optional<Span> findContaining(SpanSet spans, long sampleIndex) {
        return sampleIndex > Integer.MAX_VALUE
                ? Optional.empty()
                : spans.findContaining((int) sampleIndex);
    }
}
