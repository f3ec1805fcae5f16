/* (C)2026 */
package com.ammann.eegprune.service;

import com.ammann.eegprune.dto.PipelineWarningDTO;
import com.ammann.eegprune.enumeration.EventType;
import com.ammann.eegprune.enumeration.PipelineStep;
import com.ammann.eegprune.enumeration.WarningType;
import com.ammann.eegprune.model.Event;
import com.ammann.eegprune.model.Timeline;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.jboss.logging.Logger;

/**
 * Compares stim start and stim end counts per protocol type. A mismatch is reported as a
 * warning; events are never added or removed here.
 */
@ApplicationScoped
public class ProtocolCountService {

    private static final Logger LOG = Logger.getLogger(ProtocolCountService.class);

    /**
     * @param timeline   timeline to check
     * @param protoTypes protocol types to check; empty checks every type present
     * @return one {@link WarningType#PROTOCOL_COUNT_MISMATCH} warning per unbalanced type
     */
    public List<PipelineWarningDTO> check(Timeline timeline, Set<Integer> protoTypes) {
        Map<Integer, int[]> counts = new TreeMap<>();
        for (Integer protoType : protoTypes) {
            counts.put(protoType, new int[2]);
        }

        for (Event event : timeline.events()) {
            if (!event.type().isStimulation() || event.protoType() == null) {
                continue;
            }
            if (!protoTypes.isEmpty() && !protoTypes.contains(event.protoType())) {
                continue;
            }
            int[] pair = counts.computeIfAbsent(event.protoType(), k -> new int[2]);
            pair[event.type() == EventType.STIM_START ? 0 : 1]++;
        }

        List<PipelineWarningDTO> warnings = new ArrayList<>();
        for (Map.Entry<Integer, int[]> entry : counts.entrySet()) {
            int starts = entry.getValue()[0];
            int ends = entry.getValue()[1];
            if (starts != ends) {
                String message =
                        String.format(
                                "Protocol type %d has %d stim start but %d stim end events",
                                entry.getKey(), starts, ends);
                LOG.warn(message);
                warnings.add(
                        PipelineWarningDTO.of(
                                WarningType.PROTOCOL_COUNT_MISMATCH,
                                PipelineStep.CHECK_PROTOCOLS,
                                message));
            } else {
                LOG.debugf(
                        "Protocol type %d balanced: %d start/end pairs",
                        entry.getKey(),
                        Integer.valueOf(starts));
            }
        }
        return warnings;
    }
}
