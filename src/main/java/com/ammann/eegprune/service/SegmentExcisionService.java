/* (C)2026 */
package com.ammann.eegprune.service;

import com.ammann.eegprune.dto.PipelineWarningDTO;
import com.ammann.eegprune.enumeration.PipelineStep;
import com.ammann.eegprune.enumeration.WarningType;
import com.ammann.eegprune.exception.ExcisionRangeException;
import com.ammann.eegprune.model.Event;
import com.ammann.eegprune.model.ExcisionResult;
import com.ammann.eegprune.model.Recording;
import com.ammann.eegprune.model.SampleMatrix;
import com.ammann.eegprune.model.Span;
import com.ammann.eegprune.model.SpanSet;
import com.ammann.eegprune.model.Timeline;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Physically removes spans from a recording and rebuilds every dependent structure.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>re-normalize the span set and reject stale or out-of-range spans</li>
 *   <li>drop every non-boundary event inside an excised span; boundary markers from earlier
 *       passes are kept and collapse onto the seam</li>
 *   <li>delete the sample columns and the timestamp entries with one shared keep mask</li>
 *   <li>shift surviving events by the number of samples excised before them, in one pass</li>
 *   <li>insert (or extend) a boundary marker at each seam</li>
 *   <li>sort events and drop trailing events that fall past the new end</li>
 * </ol>
 *
 * <p>The input recording is never modified; a new recording is returned.
 */
@ApplicationScoped
public class SegmentExcisionService {

    private static final Logger LOG = Logger.getLogger(SegmentExcisionService.class);

    /**
     * Excises the given spans.
     *
     * @param recording recording to prune (not modified)
     * @param spanSet   spans in the recording's current coordinates, bound to its timeline revision
     * @return pruned recording and excision details; the same recording for an empty span set
     * @throws ExcisionRangeException when a span lies outside {@code [1, N]} or the span set is
     *     unbound or bound to another timeline revision
     */
    public ExcisionResult excise(Recording recording, SpanSet spanSet) {
        if (spanSet == null || spanSet.isEmpty()) {
            LOG.debug("No spans to excise");
            return ExcisionResult.noop(recording);
        }

        Timeline timeline = recording.timeline();
        if (!spanSet.isBound()) {
            throw ExcisionRangeException.unboundSpanSet(timeline.revision());
        }
        if (spanSet.baselineRevision() != timeline.revision()) {
            throw ExcisionRangeException.staleSpanSet(
                    spanSet.baselineRevision(), timeline.revision());
        }

        SpanSet spans = SpanSet.normalize(spanSet.spans(), spanSet.contiguityGap());
        int n = timeline.sampleCount();
        for (Span span : spans) {
            if (span.end() > n) {
                throw ExcisionRangeException.outOfBounds(span.start(), span.end(), n);
            }
        }

        SpanSet history = extendHistory(timeline, spans);

        List<Span> list = spans.spans();
        long[] removedBefore = new long[list.size()];
        long totalRemoved = 0;
        boolean[] keep = new boolean[n];
        Arrays.fill(keep, true);
        for (int i = 0; i < list.size(); i++) {
            Span span = list.get(i);
            removedBefore[i] = totalRemoved;
            totalRemoved += span.length();
            Arrays.fill(keep, span.start() - 1, span.end(), false);
        }
        int keptCount = (int) (n - totalRemoved);

        List<Event> survivors = new ArrayList<>(timeline.events().size() + list.size());
        List<Event> dropped = new ArrayList<>();
        for (Event event : timeline.events()) {
            int position = locate(list, event.latency());
            if (position >= 0) {
                if (event.isBoundary()) {
                    Span span = list.get(position);
                    survivors.add(event.withLatency((int) (span.start() - removedBefore[position])));
                } else {
                    LOG.debugf(
                            "Dropping event '%s' (id %d) at latency %d inside excised span",
                            event.type().label(), event.id(), event.latency());
                    dropped.add(event);
                }
                continue;
            }
            int spansBefore = -(position + 1);
            long shift = spansBefore < list.size() ? removedBefore[spansBefore] : totalRemoved;
            survivors.add(event.withLatency((int) (event.latency() - shift)));
        }

        long nextEventId = timeline.nextEventId();
        List<Event> inserted = new ArrayList<>();
        Map<Integer, Integer> boundaryAtLatency = new HashMap<>();
        for (int i = 0; i < survivors.size(); i++) {
            if (survivors.get(i).isBoundary()) {
                boundaryAtLatency.putIfAbsent(survivors.get(i).latency(), i);
            }
        }
        for (int i = 0; i < list.size(); i++) {
            Span span = list.get(i);
            int seam = (int) (span.start() - removedBefore[i]);
            Integer existing = boundaryAtLatency.get(seam);
            if (existing != null) {
                Event boundary = survivors.get(existing);
                survivors.set(existing, boundary.withDuration(boundary.duration() + span.length()));
            } else {
                Event boundary = Event.boundary(nextEventId++, seam, span.length());
                survivors.add(boundary);
                inserted.add(boundary);
                boundaryAtLatency.put(seam, survivors.size() - 1);
            }
        }

        survivors.sort(Event.TIMELINE_ORDER);

        List<PipelineWarningDTO> warnings = new ArrayList<>();
        while (!survivors.isEmpty() && survivors.get(survivors.size() - 1).latency() > keptCount) {
            Event trailing = survivors.remove(survivors.size() - 1);
            if (trailing.isBoundary()) {
                inserted.removeIf(b -> b.id() == trailing.id());
                LOG.infof(
                        "Dropped boundary marker at latency %d past the end of the pruned recording"
                                + " (%d samples)",
                        trailing.latency(), keptCount);
            } else {
                String message =
                        String.format(
                                "Dropped event '%s' (id %d) at latency %d past the end of the pruned"
                                        + " recording (%d samples)",
                                trailing.type().label(), trailing.id(), trailing.latency(), keptCount);
                LOG.warn(message);
                warnings.add(
                        PipelineWarningDTO.forEvent(
                                WarningType.TRAILING_EVENT_DROPPED,
                                PipelineStep.EXCISE,
                                trailing.id(),
                                message));
            }
        }

        Timeline prunedTimeline =
                timeline.retainColumns(keep, keptCount, survivors, history, nextEventId);
        SampleMatrix prunedSamples = recording.samples().retainColumns(keep, keptCount);
        Recording pruned = new Recording(recording.id(), prunedSamples, prunedTimeline);

        LOG.infof(
                "Excised %d spans (%d samples, %.2f seconds): %d -> %d samples, %d events dropped,"
                        + " %d boundary markers inserted",
                list.size(),
                totalRemoved,
                timeline.toSeconds(totalRemoved),
                n,
                keptCount,
                dropped.size(),
                inserted.size());

        return new ExcisionResult(pruned, spans, dropped, inserted, warnings);
    }

    /**
     * Index of the span containing {@code latency}, or {@code -(spansBefore + 1)} where
     * {@code spansBefore} is the number of spans ending before it.
     */
    private int locate(List<Span> spans, int latency) {
        int low = 0;
        int high = spans.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            Span span = spans.get(mid);
            if (span.end() < latency) {
                low = mid + 1;
            } else if (span.start() > latency) {
                high = mid - 1;
            } else {
                return mid;
            }
        }
        return -(low + 1);
    }

    /** Maps the spans to loaded-recording coordinates and adds them to the excision history. */
    private SpanSet extendHistory(Timeline timeline, SpanSet spans) {
        List<Span> runs = new ArrayList<>();
        for (Span span : spans) {
            int runStart = timeline.originalIndexAt(span.start());
            int previous = runStart;
            for (int i = span.start() + 1; i <= span.end(); i++) {
                int original = timeline.originalIndexAt(i);
                if (original != previous + 1) {
                    runs.add(new Span(runStart, previous));
                    runStart = original;
                }
                previous = original;
            }
            runs.add(new Span(runStart, previous));
        }

        return timeline.excisedOriginalSpans().union(SpanSet.normalize(runs));
    }
}
