/* (C)2026 */
package com.ammann.eegprune.service;

import com.ammann.eegprune.dto.EventDTO;
import com.ammann.eegprune.dto.EventStateDTO;
import com.ammann.eegprune.dto.PruningResultDTO;
import com.ammann.eegprune.dto.RecordingRequestDTO;
import com.ammann.eegprune.dto.SpanDTO;
import com.ammann.eegprune.enumeration.EventType;
import com.ammann.eegprune.exception.ValidationException;
import com.ammann.eegprune.model.Event;
import com.ammann.eegprune.model.EventProvenance;
import com.ammann.eegprune.model.PruningResult;
import com.ammann.eegprune.model.Recording;
import com.ammann.eegprune.model.SampleMatrix;
import com.ammann.eegprune.model.Timeline;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Converts between the REST payloads and the pruning model.
 *
 * <p>Incoming {@code null} channel values become NaN so the detector treats them as invalid
 * data; outgoing NaN values are written as {@code null}. Events are numbered 1..k in input
 * order.
 */
@ApplicationScoped
public class RecordingMappingService {

    private static final Logger LOG = Logger.getLogger(RecordingMappingService.class);

    public Recording toRecording(RecordingRequestDTO request) {
        SampleMatrix samples = toMatrix(request.channels());
        int n = samples.sampleCount();
        if (n == 0) {
            throw new ValidationException("Recording '" + request.recordingId() + "' has no samples");
        }

        List<Event> events = toEvents(request.events());
        Timeline timeline;
        if (request.timestampsMillis() != null) {
            if (request.timestampsMillis().size() != n) {
                throw ValidationException.sizeMismatch(
                        "timestampsMillis", n, request.timestampsMillis().size());
            }
            long[] wallClock = new long[n];
            for (int i = 0; i < n; i++) {
                Long millis = request.timestampsMillis().get(i);
                if (millis == null) {
                    throw ValidationException.invalidParameter(
                            "timestampsMillis[" + i + "]", null, "epoch milliseconds");
                }
                wallClock[i] = millis;
            }
            timeline = Timeline.load(request.sampleRateHz(), wallClock, events);
        } else if (request.startTime() != null) {
            timeline = Timeline.uniform(request.sampleRateHz(), request.startTime(), n, events);
        } else {
            throw new ValidationException(
                    "Either timestampsMillis or startTime is required for recording '"
                            + request.recordingId()
                            + "'");
        }

        LOG.debugf(
                "Mapped recording '%s': %d channels, %d samples, %d events",
                request.recordingId(), samples.channelCount(), n, events.size());
        return new Recording(request.recordingId(), samples, timeline);
    }

    public PruningResultDTO toResponse(PruningResult result, boolean includeData) {
        Recording pruned = result.pruned();
        return new PruningResultDTO(
                pruned.id(),
                result.original().sampleCount(),
                pruned.sampleCount(),
                result.invalidSpans().stream().map(SpanDTO::from).toList(),
                result.stageSpans().stream().map(SpanDTO::from).toList(),
                result.removals(),
                pruned.timeline().events().stream().map(EventStateDTO::from).toList(),
                result.report(),
                result.warnings(),
                includeData ? toRows(pruned.samples()) : null,
                includeData ? toList(pruned.timeline().wallClockMillis()) : null);
    }

    private SampleMatrix toMatrix(List<List<Double>> channels) {
        if (channels == null || channels.isEmpty()) {
            throw new ValidationException("At least one channel is required");
        }
        double[][] data = new double[channels.size()][];
        for (int c = 0; c < channels.size(); c++) {
            List<Double> row = channels.get(c);
            if (row == null) {
                throw ValidationException.invalidParameter("channels[" + c + "]", null, "list of samples");
            }
            data[c] = new double[row.size()];
            for (int i = 0; i < row.size(); i++) {
                Double value = row.get(i);
                data[c][i] = value == null ? Double.NaN : value;
            }
        }
        return new SampleMatrix(data);
    }

    private List<Event> toEvents(List<EventDTO> dtos) {
        if (dtos == null) {
            return List.of();
        }
        List<Event> events = new ArrayList<>(dtos.size());
        long id = 1;
        for (EventDTO dto : dtos) {
            if (dto.latency() == null) {
                throw ValidationException.invalidParameter("event " + id + " latency", null, "sample index");
            }
            EventType type = EventType.fromLabel(dto.type());
            if (type == EventType.BOUNDARY) {
                throw ValidationException.invalidParameter(
                        "event " + id + " type", dto.type(), "a type other than 'boundary'");
            }
            Event event =
                    type == EventType.SLEEP_STAGE
                            ? Event.sleepStage(id, dto.latency(), dto.code())
                            : new Event(
                                    id,
                                    type,
                                    dto.latency(),
                                    dto.protoType(),
                                    dto.code(),
                                    null,
                                    0,
                                    EventProvenance.NONE);
            events.add(event);
            id++;
        }
        return events;
    }

    private static List<List<Double>> toRows(SampleMatrix matrix) {
        double[][] data = matrix.toArray();
        List<List<Double>> rows = new ArrayList<>(data.length);
        for (double[] channel : data) {
            List<Double> row = new ArrayList<>(channel.length);
            for (double value : channel) {
                row.add(Double.isNaN(value) ? null : value);
            }
            rows.add(row);
        }
        return rows;
    }

    private static List<Long> toList(long[] values) {
        List<Long> list = new ArrayList<>(values.length);
        for (long value : values) {
            list.add(value);
        }
        return list;
    }
}
