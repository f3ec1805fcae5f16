/* (C)2026 */
package com.ammann.eegprune.service;

import com.ammann.eegprune.dto.PipelineWarningDTO;
import com.ammann.eegprune.enumeration.EventType;
import com.ammann.eegprune.enumeration.PipelineStep;
import com.ammann.eegprune.enumeration.WarningType;
import com.ammann.eegprune.model.Event;
import com.ammann.eegprune.model.Span;
import com.ammann.eegprune.model.SpanSet;
import com.ammann.eegprune.model.StageSpans;
import com.ammann.eegprune.model.Timeline;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.jboss.logging.Logger;

/**
 * Turns unwanted sleep-stage scoring into removal spans.
 *
 * <p>A stage marker covers the samples from its latency up to the sample before the next
 * stage marker, or to the end of the recording for the last one. Markers whose code is
 * unwanted yield a span. Valid stage codes are {@value #MIN_STAGE} to {@value #MAX_STAGE}.
 */
@ApplicationScoped
public class SleepStageSpanService {

    private static final Logger LOG = Logger.getLogger(SleepStageSpanService.class);

    static final int MIN_STAGE = 0;
    static final int MAX_STAGE = 5;

    public static boolean isValidStage(int stage) {
        return stage >= MIN_STAGE && stage <= MAX_STAGE;
    }

    public StageSpans unwantedStageSpans(Timeline timeline, Set<Integer> unwantedStages) {
        return unwantedStageSpans(timeline, unwantedStages, SpanSet.DEFAULT_CONTIGUITY_GAP);
    }

    /**
     * Builds spans for every marker of an unwanted stage.
     *
     * @param timeline       timeline to scan
     * @param unwantedStages stage codes to remove; codes outside 0..5 are ignored with a warning
     * @param contiguityGap  merge threshold for the resulting span set
     * @return spans bound to the timeline's revision, per-stage totals and warnings
     */
    public StageSpans unwantedStageSpans(
            Timeline timeline, Set<Integer> unwantedStages, int contiguityGap) {
        List<PipelineWarningDTO> warnings = new ArrayList<>();

        Set<Integer> stages = new TreeSet<>();
        for (Integer stage : unwantedStages) {
            if (stage != null && isValidStage(stage)) {
                stages.add(stage);
            } else {
                String message =
                        String.format(
                                "Unwanted stage %s is not a valid sleep stage code [%d-%d]; ignored",
                                stage, MIN_STAGE, MAX_STAGE);
                LOG.warn(message);
                warnings.add(
                        PipelineWarningDTO.of(
                                WarningType.INVALID_SLEEP_STAGE_CODE,
                                PipelineStep.REMOVE_STAGES,
                                message));
            }
        }

        if (stages.isEmpty()) {
            LOG.info("No valid unwanted sleep stages to remove");
            return new StageSpans(
                    SpanSet.normalize(List.of(), contiguityGap).boundTo(timeline.revision()),
                    Map.of(),
                    Map.of(),
                    warnings);
        }

        warnOnDuplicateLatencies(timeline);

        List<Event> markers = timeline.eventsOfType(EventType.SLEEP_STAGE);
        int n = timeline.sampleCount();
        List<Span> spans = new ArrayList<>();
        Map<Integer, Long> samplesByStage = new TreeMap<>();
        Map<Integer, Integer> countByStage = new TreeMap<>();

        for (int i = 0; i < markers.size(); i++) {
            Event marker = markers.get(i);
            Integer stage = marker.sleepStage();
            if (stage == null || !isValidStage(stage)) {
                String message =
                        String.format(
                                "Ignoring sleep stage marker at latency %d with invalid code '%s'",
                                marker.latency(), marker.code());
                LOG.warn(message);
                warnings.add(
                        PipelineWarningDTO.forEvent(
                                WarningType.INVALID_SLEEP_STAGE_CODE,
                                PipelineStep.REMOVE_STAGES,
                                marker.id(),
                                message));
                continue;
            }
            if (!stages.contains(stage)) {
                continue;
            }

            int start = marker.latency();
            int end = i + 1 < markers.size() ? markers.get(i + 1).latency() - 1 : n;
            end = Math.min(end, n);
            if (start > n || end < start) {
                LOG.debugf(
                        "Sleep stage %d marker at latency %d covers no samples",
                        stage,
                        Integer.valueOf(start));
                continue;
            }

            Span span = new Span(start, end);
            spans.add(span);
            samplesByStage.merge(stage, (long) span.length(), Long::sum);
            countByStage.merge(stage, 1, Integer::sum);
            LOG.infof(
                    "Removing sleep stage %d from sample %d to %d (%.2f to %.2f seconds)",
                    stage, start, end, timeline.toSeconds(start), timeline.toSeconds(end));
        }

        if (spans.isEmpty()) {
            LOG.info("No unwanted sleep stages found; no data removed");
        }
        for (Integer stage : stages) {
            LOG.infof(
                    "Stage %d: %.2f seconds marked for removal",
                    stage, timeline.toSeconds(samplesByStage.getOrDefault(stage, 0L)));
        }

        return new StageSpans(
                SpanSet.normalize(spans, contiguityGap).boundTo(timeline.revision()),
                samplesByStage,
                countByStage,
                warnings);
    }

    private void warnOnDuplicateLatencies(Timeline timeline) {
        Set<Integer> seen = new HashSet<>();
        for (Event event : timeline.events()) {
            if (!event.isBoundary() && !seen.add(event.latency())) {
                LOG.warnf(
                        "Events share latency %d; verify event timings", event.latency());
                return;
            }
        }
    }
}
