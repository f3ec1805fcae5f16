/* (C)2026 */
package com.ammann.eegprune.service;

import com.ammann.eegprune.dto.PipelineWarningDTO;
import com.ammann.eegprune.dto.ReconciliationRecordDTO;
import com.ammann.eegprune.enumeration.EventType;
import com.ammann.eegprune.enumeration.PipelineStep;
import com.ammann.eegprune.enumeration.WarningType;
import com.ammann.eegprune.model.Event;
import com.ammann.eegprune.model.EventProvenance;
import com.ammann.eegprune.model.ReconciliationReport;
import com.ammann.eegprune.model.Timeline;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Builds the audit table mapping every retained event of interest to where it originally sat.
 *
 * <p>Original latency and wall-clock time come from the event's provenance, or from the
 * matching event of the loaded timeline when the provenance lacks them. Wall-clock lookups by
 * original latency always use the loaded (pre-excision) timestamp table. When neither source
 * knows the original position the row falls back to current values and is flagged.
 *
 * <p>The sleep stage of a row is the most recent stage marker at or before the event's
 * current latency. Rows are ordered by original time so protocol order reads as it happened.
 */
@ApplicationScoped
public class ReconciliationReportService {

    private static final Logger LOG = Logger.getLogger(ReconciliationReportService.class);

    private static final DateTimeFormatter TIME_OF_DAY = DateTimeFormatter.ofPattern("HH:mm:ss");

    /**
     * Builds the reconciliation report.
     *
     * @param original   timeline as loaded, before any excision
     * @param current    timeline after excision
     * @param types      event types of interest
     * @param protoTypes protocol types of interest; empty means any
     * @param zone       zone used to render wall-clock times
     * @return immutable rows plus {@link WarningType#MISSING_PROVENANCE} warnings
     */
    public ReconciliationReport report(
            Timeline original,
            Timeline current,
            Set<EventType> types,
            Set<Integer> protoTypes,
            ZoneId zone) {

        Map<Long, Event> loadedById = new HashMap<>();
        for (Event event : original.events()) {
            loadedById.put(event.id(), event);
        }
        SleepStageLookup stages = SleepStageLookup.of(current.events());
        DateTimeFormatter formatter = TIME_OF_DAY.withZone(zone);
        double rate = current.sampleRateHz();

        List<Row> rows = new ArrayList<>();
        List<PipelineWarningDTO> warnings = new ArrayList<>();

        for (Event event : current.events()) {
            if (!event.matches(types, protoTypes)) {
                continue;
            }

            EventProvenance provenance = event.provenance();
            Event loaded = loadedById.get(event.id());

            Integer originalLatency = provenance.originalLatency();
            if (originalLatency == null && loaded != null) {
                originalLatency =
                        loaded.provenance().hasOriginalLatency()
                                ? loaded.provenance().originalLatency()
                                : Integer.valueOf(loaded.latency());
            }

            Long originalWallClock = provenance.originalWallClockMillis();
            if (originalWallClock == null && loaded != null && loaded.provenance().hasOriginalWallClock()) {
                originalWallClock = loaded.provenance().originalWallClockMillis();
            }
            if (originalWallClock == null
                    && originalLatency != null
                    && original.isInRange(originalLatency)) {
                originalWallClock = original.wallClockAt(originalLatency);
            }

            boolean fallback = false;
            if (originalLatency == null) {
                originalLatency = event.latency();
                fallback = true;
            }
            if (originalWallClock == null) {
                originalWallClock =
                        current.isInRange(event.latency()) ? current.wallClockAt(event.latency()) : null;
                fallback = true;
            }
            if (fallback) {
                String message =
                        String.format(
                                "Event '%s' (id %d) has no original provenance; reporting current"
                                        + " latency %d instead",
                                event.type().label(), event.id(), event.latency());
                LOG.warn(message);
                warnings.add(
                        PipelineWarningDTO.forEvent(
                                WarningType.MISSING_PROVENANCE,
                                PipelineStep.REPORT,
                                event.id(),
                                message));
            }

            double originalSec = originalLatency / rate;
            double newSec = event.latency() / rate;
            String actualTime =
                    originalWallClock == null
                            ? ""
                            : formatter.format(Instant.ofEpochMilli(originalWallClock));

            ReconciliationRecordDTO record =
                    new ReconciliationRecordDTO(
                            event.type().label(),
                            event.protoType(),
                            originalSec,
                            newSec,
                            actualTime,
                            newSec - originalSec,
                            event.latency() != originalLatency,
                            ReconciliationRecordDTO.stageLabel(stages.stageAt(event.latency())),
                            fallback);
            rows.add(
                    new Row(
                            originalWallClock == null ? Long.MAX_VALUE : originalWallClock,
                            originalLatency,
                            event.id(),
                            record));
        }

        rows.sort(
                Comparator.comparingLong(Row::originalWallClock)
                        .thenComparingInt(Row::originalLatency)
                        .thenComparingLong(Row::eventId));

        LOG.infof(
                "Reconciliation report: %d rows, %d moved, %d using fallback provenance",
                rows.size(),
                rows.stream().filter(r -> r.record().moved()).count(),
                warnings.size());

        return new ReconciliationReport(rows.stream().map(Row::record).toList(), warnings);
    }

    private record Row(
            long originalWallClock, int originalLatency, long eventId, ReconciliationRecordDTO record) {}
}
