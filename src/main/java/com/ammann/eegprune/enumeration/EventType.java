/* (C)2026 */
package com.ammann.eegprune.enumeration;

import java.util.Locale;

/**
 * Category tag carried by every event on a recording timeline.
 *
 * <p>Labels match the event type strings written by the upstream annotation tooling
 * ({@code "stim start"}, {@code "Sleep Stage"}, ...). Parsing is case-insensitive;
 * any unrecognized label maps to {@link #GENERIC}.
 */
public enum EventType {
    /** Any marker without pruning semantics */
    GENERIC("generic"),
    /** Start of a stimulation protocol */
    STIM_START("stim start"),
    /** End of a stimulation protocol */
    STIM_END("stim end"),
    /** Sleep-stage scoring marker, code carries the stage */
    SLEEP_STAGE("Sleep Stage"),
    /** Synthetic marker at an excision seam */
    BOUNDARY("boundary");

    private final String label;

    EventType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isStimulation() {
        return this == STIM_START || this == STIM_END;
    }

    /**
     * Resolves an event type from its annotation label or enum name.
     *
     * @param value label such as {@code "stim start"} or name such as {@code "STIM_START"}
     * @return matching type, {@link #GENERIC} for unknown or blank labels
     */
    public static EventType fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return GENERIC;
        }
        String trimmed = value.trim();
        for (EventType type : values()) {
            if (type.label.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        String normalized = trimmed.toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (EventType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return GENERIC;
    }
}
