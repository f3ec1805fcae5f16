/* (C)2026 */
package com.ammann.eegprune.service;

import com.ammann.eegprune.enumeration.EventType;
import com.ammann.eegprune.model.Event;
import com.ammann.eegprune.model.Timeline;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/**
 * Keeps only the event types needed downstream. Stimulation events must also carry one of
 * the selected protocol types.
 */
@ApplicationScoped
public class EventFilterService {

    private static final Logger LOG = Logger.getLogger(EventFilterService.class);

    public Timeline retain(Timeline timeline, Set<EventType> keepTypes, Set<Integer> protoTypes) {
        List<Event> kept =
                timeline.events().stream()
                        .filter(e -> keepTypes.contains(e.type()))
                        .filter(
                                e ->
                                        !e.type().isStimulation()
                                                || protoTypes.isEmpty()
                                                || (e.protoType() != null
                                                        && protoTypes.contains(e.protoType())))
                        .toList();

        LOG.infof(
                "Event filter kept %d of %d events (types: %s)",
                kept.size(),
                timeline.events().size(),
                keepTypes.stream().map(EventType::label).sorted().collect(Collectors.joining(", ")));
        if (LOG.isDebugEnabled()) {
            for (Event event : kept) {
                LOG.debugf(
                        "Event %d: '%s', proto %s, latency %d",
                        event.id(), event.type().label(), event.protoType(), event.latency());
            }
        }
        return timeline.withEvents(kept);
    }
}
