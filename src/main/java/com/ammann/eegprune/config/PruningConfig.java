/* (C)2026 */
package com.ammann.eegprune.config;

import com.ammann.eegprune.dto.PruningOptionsDTO;
import com.ammann.eegprune.enumeration.EventType;
import com.ammann.eegprune.exception.ValidationException;
import com.ammann.eegprune.model.PruningOptions;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Configured pruning options. Requests may override any of them per call.
 *
 * <p>Configuration:
 * <ul>
 *   <li>{@code eeg.pruning.relocation.buffer-samples} - samples added after a span end (default: 2)</li>
 *   <li>{@code eeg.pruning.relocation.event-types} - event types relocated and reported</li>
 *   <li>{@code eeg.pruning.proto-types} - protocol types of interest (default: 4)</li>
 *   <li>{@code eeg.pruning.unwanted-stages} - sleep stages removed (default: 0,1,4)</li>
 *   <li>{@code eeg.pruning.span.contiguity-gap} - spans closer than this merge (default: 1)</li>
 *   <li>{@code eeg.pruning.keep-event-types} - event types kept after pruning</li>
 *   <li>{@code eeg.pruning.report.zone} - zone of the report's wall-clock column (default: UTC)</li>
 * </ul>
 */
@ApplicationScoped
public class PruningConfig {

    @ConfigProperty(name = "eeg.pruning.relocation.buffer-samples", defaultValue = "2")
    int bufferSamples = PruningOptions.DEFAULT_BUFFER_SAMPLES;

    @ConfigProperty(name = "eeg.pruning.relocation.event-types", defaultValue = "stim start,stim end")
    List<String> relocationEventTypes = List.of("stim start", "stim end");

    @ConfigProperty(name = "eeg.pruning.proto-types", defaultValue = "4")
    List<Integer> protoTypes = List.of(4);

    @ConfigProperty(name = "eeg.pruning.unwanted-stages", defaultValue = "0,1,4")
    List<Integer> unwantedStages = List.of(0, 1, 4);

    @ConfigProperty(name = "eeg.pruning.span.contiguity-gap", defaultValue = "1")
    int contiguityGap = 1;

    @ConfigProperty(
            name = "eeg.pruning.keep-event-types",
            defaultValue = "stim start,stim end,boundary")
    List<String> keepEventTypes = List.of("stim start", "stim end", "boundary");

    @ConfigProperty(name = "eeg.pruning.report.zone", defaultValue = "UTC")
    String reportZone = "UTC";

    public int bufferSamples() {
        return bufferSamples;
    }

    public int contiguityGap() {
        return contiguityGap;
    }

    public List<Integer> unwantedStages() {
        return unwantedStages;
    }

    public String reportZone() {
        return reportZone;
    }

    /** Options as configured. */
    public PruningOptions toOptions() {
        return merge(null);
    }

    /**
     * Applies request overrides on top of the configured options.
     *
     * @param overrides overrides, may be {@code null}; absent fields keep the configured value
     * @throws ValidationException for negative counts or an unknown zone
     */
    public PruningOptions merge(PruningOptionsDTO overrides) {
        PruningOptionsDTO o =
                overrides != null
                        ? overrides
                        : new PruningOptionsDTO(null, null, null, null, null, null, null);

        int buffer = o.bufferSamples() != null ? o.bufferSamples() : bufferSamples;
        int gap = o.contiguityGap() != null ? o.contiguityGap() : contiguityGap;
        if (buffer < 0) {
            throw ValidationException.invalidParameter("bufferSamples", buffer, "non-negative integer");
        }
        if (gap < 0) {
            throw ValidationException.invalidParameter("contiguityGap", gap, "non-negative integer");
        }

        return new PruningOptions(
                buffer,
                toTypes(o.relocationEventTypes() != null ? o.relocationEventTypes() : relocationEventTypes),
                Set.copyOf(o.protoTypes() != null ? o.protoTypes() : protoTypes),
                Set.copyOf(o.unwantedStages() != null ? o.unwantedStages() : unwantedStages),
                gap,
                toTypes(o.keepEventTypes() != null ? o.keepEventTypes() : keepEventTypes),
                toZone(o.reportZone() != null ? o.reportZone() : reportZone));
    }

    private static Set<EventType> toTypes(List<String> labels) {
        Set<EventType> types = new LinkedHashSet<>();
        for (String label : labels) {
            types.add(EventType.fromLabel(label));
        }
        return types;
    }

    private static ZoneId toZone(String zone) {
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new ValidationException("Unknown report time zone '" + zone + "'", e);
        }
    }
}
