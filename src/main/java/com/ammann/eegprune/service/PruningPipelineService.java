/* (C)2026 */
package com.ammann.eegprune.service;

import com.ammann.eegprune.dto.PipelineWarningDTO;
import com.ammann.eegprune.dto.RemovalSummaryDTO;
import com.ammann.eegprune.enumeration.PipelineStep;
import com.ammann.eegprune.exception.PipelineStepException;
import com.ammann.eegprune.exception.PruningException;
import com.ammann.eegprune.model.ExcisionResult;
import com.ammann.eegprune.model.ProtocolFilterResult;
import com.ammann.eegprune.model.PruningOptions;
import com.ammann.eegprune.model.PruningResult;
import com.ammann.eegprune.model.ReconciliationReport;
import com.ammann.eegprune.model.Recording;
import com.ammann.eegprune.model.RelocationResult;
import com.ammann.eegprune.model.Span;
import com.ammann.eegprune.model.SpanSet;
import com.ammann.eegprune.model.StageSpans;
import com.ammann.eegprune.model.Timeline;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

/**
 * Runs the full pruning sequence on one recording.
 *
 * <p>Steps run in a fixed order: drop stimulation protocols that began in unwanted sleep
 * stages, detect invalid data, move events of interest out of it, excise it, excise unwanted
 * sleep stages, cross-check protocol counts, build the reconciliation report and finally
 * keep only the event types needed downstream. Fatal errors are rethrown as
 * {@link PipelineStepException} naming the step; recoverable anomalies are collected as
 * warnings in step order.
 */
@ApplicationScoped
public class PruningPipelineService {

    private static final Logger LOG = Logger.getLogger(PruningPipelineService.class);

    static final String MDC_RECORDING = "recording";

    private final StimProtocolFilterService protocolFilter;
    private final InvalidSpanDetectorService detector;
    private final EventRelocationService relocator;
    private final SegmentExcisionService exciser;
    private final SleepStageSpanService stageSpans;
    private final ProtocolCountService protocolCounter;
    private final ReconciliationReportService reporter;
    private final EventFilterService eventFilter;

    @Inject MeterRegistry meterRegistry;

    @Inject
    public PruningPipelineService(
            StimProtocolFilterService protocolFilter,
            InvalidSpanDetectorService detector,
            EventRelocationService relocator,
            SegmentExcisionService exciser,
            SleepStageSpanService stageSpans,
            ProtocolCountService protocolCounter,
            ReconciliationReportService reporter,
            EventFilterService eventFilter) {
        this.protocolFilter = protocolFilter;
        this.detector = detector;
        this.relocator = relocator;
        this.exciser = exciser;
        this.stageSpans = stageSpans;
        this.protocolCounter = protocolCounter;
        this.reporter = reporter;
        this.eventFilter = eventFilter;
    }

    /**
     * Prunes one recording.
     *
     * @param recording recording as loaded
     * @param options   pruning options
     * @return pruned recording plus everything needed to audit the run
     * @throws PipelineStepException when a step fails fatally
     */
    public PruningResult run(Recording recording, PruningOptions options) {
        MDC.put(MDC_RECORDING, recording.id());
        PipelineStep step = PipelineStep.FILTER_PROTOCOLS;
        try {
            LOG.infof(
                    "Pruning recording '%s': %d samples at %.2f Hz, %d events",
                    recording.id(),
                    recording.sampleCount(),
                    recording.sampleRateHz(),
                    recording.timeline().events().size());

            List<PipelineWarningDTO> warnings = new ArrayList<>();
            List<RemovalSummaryDTO> removals = new ArrayList<>();
            Recording current = recording;

            if (!options.unwantedStages().isEmpty()) {
                ProtocolFilterResult filtered =
                        protocolFilter.removeProtocolsInUnwantedStages(
                                current.timeline(), options.unwantedStages(), options.protoTypes());
                warnings.addAll(filtered.warnings());
                current = current.withTimeline(filtered.timeline());
            } else {
                LOG.debug("No unwanted sleep stages configured; protocol filter skipped");
            }

            step = PipelineStep.DETECT;
            SpanSet invalid = detector.detect(current);
            logInvalidSpans(invalid, current.timeline());

            step = PipelineStep.RELOCATE;
            RelocationResult relocation =
                    relocator.relocate(
                            current.timeline(),
                            invalid,
                            options.bufferSamples(),
                            options.relocationEventTypes(),
                            options.protoTypes());
            warnings.addAll(relocation.warnings());
            current = current.withTimeline(relocation.timeline());
            recordRelocations(relocation.movedCount(), relocation.warnings().size());

            step = PipelineStep.EXCISE;
            ExcisionResult invalidExcision = exciser.excise(current, invalid);
            warnings.addAll(invalidExcision.warnings());
            current = invalidExcision.recording();
            if (!invalid.isEmpty()) {
                removals.add(
                        new RemovalSummaryDTO(
                                RemovalSummaryDTO.INVALID_DATA,
                                invalid.size(),
                                invalid.totalLength(),
                                recording.timeline().toSeconds(invalid.totalLength())));
                recordExcised(RemovalSummaryDTO.INVALID_DATA, invalid.totalLength());
            }

            step = PipelineStep.REMOVE_STAGES;
            SpanSet stageSet = SpanSet.empty();
            if (!options.unwantedStages().isEmpty()) {
                StageSpans stages =
                        stageSpans.unwantedStageSpans(
                                current.timeline(), options.unwantedStages(), options.contiguityGap());
                warnings.addAll(stages.warnings());
                stageSet = stages.spans();
                ExcisionResult stageExcision = exciser.excise(current, stageSet);
                warnings.addAll(stageExcision.warnings());
                current = stageExcision.recording();
                for (Map.Entry<Integer, Long> entry : stages.samplesRemovedByStage().entrySet()) {
                    String category = RemovalSummaryDTO.SLEEP_STAGE_PREFIX + entry.getKey();
                    removals.add(
                            new RemovalSummaryDTO(
                                    category,
                                    stages.spanCountByStage().getOrDefault(entry.getKey(), 0),
                                    entry.getValue(),
                                    current.timeline().toSeconds(entry.getValue())));
                    recordExcised(category, entry.getValue());
                }
            }

            step = PipelineStep.CHECK_PROTOCOLS;
            warnings.addAll(protocolCounter.check(current.timeline(), options.protoTypes()));

            step = PipelineStep.REPORT;
            ReconciliationReport report =
                    reporter.report(
                            recording.timeline(),
                            current.timeline(),
                            options.relocationEventTypes(),
                            options.protoTypes(),
                            options.reportZone());
            warnings.addAll(report.warnings());

            step = PipelineStep.FILTER_EVENTS;
            current =
                    current.withTimeline(
                            eventFilter.retain(
                                    current.timeline(),
                                    options.keepEventTypes(),
                                    options.protoTypes()));

            LOG.infof(
                    "Pruned recording '%s': %d -> %d samples, %d events kept, %d report rows, %d warnings",
                    recording.id(),
                    recording.sampleCount(),
                    current.sampleCount(),
                    current.timeline().events().size(),
                    report.records().size(),
                    warnings.size());

            return new PruningResult(
                    recording,
                    current,
                    invalid,
                    stageSet,
                    removals,
                    relocation.outcomes(),
                    report.records(),
                    warnings);
        } catch (PruningException | IllegalArgumentException e) {
            recordFailure(step);
            throw new PipelineStepException(recording.id(), step, e);
        } finally {
            MDC.remove(MDC_RECORDING);
        }
    }

    private void logInvalidSpans(SpanSet invalid, Timeline timeline) {
        if (invalid.isEmpty()) {
            LOG.info("No invalid-data segments found");
            return;
        }
        int number = 1;
        for (Span span : invalid) {
            LOG.infof(
                    "Identified invalid-data segment #%d from sample %d to %d (%.2f seconds)",
                    number++, span.start(), span.end(), timeline.toSeconds(span.length()));
        }
        LOG.infof(
                "Total invalid data: %.2f seconds in %d segments",
                timeline.toSeconds(invalid.totalLength()), invalid.size());
    }

    private void recordExcised(String category, long samples) {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder("eeg_samples_excised_total")
                .description("Total samples excised by removal category")
                .tag("category", category)
                .register(meterRegistry)
                .increment(samples);
    }

    private void recordRelocations(long moved, long unresolvable) {
        if (meterRegistry == null) {
            return;
        }
        if (moved > 0) {
            Counter.builder("eeg_events_relocated_total")
                    .description("Total events moved out of invalid-data segments")
                    .register(meterRegistry)
                    .increment(moved);
        }
        if (unresolvable > 0) {
            Counter.builder("eeg_relocations_unresolvable_total")
                    .description("Total events that could not be moved past the end of a segment")
                    .register(meterRegistry)
                    .increment(unresolvable);
        }
    }

    private void recordFailure(PipelineStep step) {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder("eeg_pipeline_failures_total")
                .description("Total pruning runs that failed, by step")
                .tag("step", step.label())
                .register(meterRegistry)
                .increment();
    }
}
