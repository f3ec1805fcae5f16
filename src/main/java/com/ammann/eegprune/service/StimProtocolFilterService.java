/* (C)2026 */
package com.ammann.eegprune.service;

import com.ammann.eegprune.dto.PipelineWarningDTO;
import com.ammann.eegprune.enumeration.EventType;
import com.ammann.eegprune.enumeration.PipelineStep;
import com.ammann.eegprune.enumeration.WarningType;
import com.ammann.eegprune.model.Event;
import com.ammann.eegprune.model.ProtocolFilterResult;
import com.ammann.eegprune.model.Timeline;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.jboss.logging.Logger;

/**
 * Removes whole stimulation protocols that were delivered during an unwanted sleep stage.
 *
 * <p>Stim start and stim end events of the same protocol type are paired in latency order.
 * When the event directly following an unwanted sleep-stage marker belongs to a paired
 * protocol, both its start and end are removed. Unpaired stim events are reported and kept.
 */
@ApplicationScoped
public class StimProtocolFilterService {

    private static final Logger LOG = Logger.getLogger(StimProtocolFilterService.class);

    /**
     * @param timeline       timeline to filter (not modified)
     * @param unwantedStages stage codes whose protocols are removed
     * @param protoTypes     protocol types considered; empty means any
     */
    public ProtocolFilterResult removeProtocolsInUnwantedStages(
            Timeline timeline, Set<Integer> unwantedStages, Set<Integer> protoTypes) {

        List<Event> events = timeline.events();
        List<PipelineWarningDTO> warnings = new ArrayList<>();
        List<long[]> protocols = pairProtocols(events, protoTypes, warnings);

        Map<Long, Integer> protocolOfEvent = new HashMap<>();
        for (int p = 0; p < protocols.size(); p++) {
            protocolOfEvent.put(protocols.get(p)[0], p);
            protocolOfEvent.put(protocols.get(p)[1], p);
        }

        Set<Integer> toRemove = new LinkedHashSet<>();
        for (int i = 0; i < events.size() - 1; i++) {
            Event marker = events.get(i);
            if (marker.type() != EventType.SLEEP_STAGE
                    || marker.sleepStage() == null
                    || !unwantedStages.contains(marker.sleepStage())) {
                continue;
            }
            Event next = events.get(i + 1);
            Integer protocol = protocolOfEvent.get(next.id());
            if (protocol != null && toRemove.add(protocol)) {
                LOG.infof(
                        "Removing protocol %d (%s of type %d at %.2f seconds, sample %d, and its"
                                + " counterpart) during sleep stage %d",
                        protocol + 1,
                        next.type().label(),
                        next.protoType(),
                        timeline.toSeconds(next.latency()),
                        next.latency(),
                        marker.sleepStage());
            }
        }

        if (toRemove.isEmpty()) {
            LOG.info("No stimulation protocols found following unwanted sleep stages");
            return new ProtocolFilterResult(timeline, protocols.size(), 0, warnings);
        }

        Set<Long> removedIds = new HashSet<>();
        for (int protocol : toRemove) {
            removedIds.add(protocols.get(protocol)[0]);
            removedIds.add(protocols.get(protocol)[1]);
        }
        List<Event> kept = events.stream().filter(e -> !removedIds.contains(e.id())).toList();

        LOG.infof(
                "Protocols removed: %d, protocols remaining: %d",
                toRemove.size(), protocols.size() - toRemove.size());

        return new ProtocolFilterResult(
                timeline.withEvents(kept), protocols.size(), toRemove.size(), warnings);
    }

    /** Pairs start and end ids per protocol type; unpaired events become warnings. */
    private List<long[]> pairProtocols(
            List<Event> events, Set<Integer> protoTypes, List<PipelineWarningDTO> warnings) {
        List<long[]> protocols = new ArrayList<>();
        Map<Integer, Event> openStarts = new TreeMap<>();

        for (Event event : events) {
            if (!event.type().isStimulation() || event.protoType() == null) {
                continue;
            }
            if (!protoTypes.isEmpty() && !protoTypes.contains(event.protoType())) {
                continue;
            }
            if (event.type() == EventType.STIM_START) {
                Event unmatched = openStarts.put(event.protoType(), event);
                if (unmatched != null) {
                    warnings.add(incomplete(unmatched, "is followed by another stim start"));
                }
            } else {
                Event start = openStarts.remove(event.protoType());
                if (start == null) {
                    warnings.add(incomplete(event, "has no preceding stim start"));
                } else {
                    protocols.add(new long[] {start.id(), event.id()});
                }
            }
        }
        for (Event start : openStarts.values()) {
            warnings.add(incomplete(start, "has no corresponding stim end"));
        }
        return protocols;
    }

    private PipelineWarningDTO incomplete(Event event, String reason) {
        String message =
                String.format(
                        "%s of type %d at latency %d %s; protocol ignored",
                        event.type().label(), event.protoType(), event.latency(), reason);
        LOG.warn(message);
        return PipelineWarningDTO.forEvent(
                WarningType.INCOMPLETE_PROTOCOL, PipelineStep.FILTER_PROTOCOLS, event.id(), message);
    }
}
