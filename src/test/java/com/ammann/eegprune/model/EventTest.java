/* (C)2026 */
package com.ammann.eegprune.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.eegprune.enumeration.EventType;
import java.util.EnumSet;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class EventTest {

    @ParameterizedTest
    @CsvSource({"2, 2", "' 3.0 ', 3", "0, 0", "5.0, 5"})
    void parsesIntegralStageCodes(String code, int stage) {
        assertThat(Event.parseStageCode(code)).isEqualTo(stage);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"2.5", "N2", "  ", "NaN"})
    void rejectsNonIntegralStageCodes(String code) {
        assertThat(Event.parseStageCode(code)).isNull();
    }

    @Test
    void sleepStageFactoryKeepsCodeAndStage() {
        Event event = Event.sleepStage(1, 10, "4");

        assertThat(event.type()).isEqualTo(EventType.SLEEP_STAGE);
        assertThat(event.code()).isEqualTo("4");
        assertThat(event.sleepStage()).isEqualTo(4);
    }

    @Test
    void matchesByTypeAndProtocol() {
        Event start = Event.stimulation(1, EventType.STIM_START, 10, 4);
        Set<EventType> stim = EnumSet.of(EventType.STIM_START, EventType.STIM_END);

        assertThat(start.matches(stim, Set.of(4))).isTrue();
        assertThat(start.matches(stim, Set.of(3))).isFalse();
        assertThat(start.matches(stim, Set.of())).isTrue();
        assertThat(start.matches(EnumSet.of(EventType.STIM_END), Set.of())).isFalse();
        assertThat(Event.of(2, EventType.STIM_START, 10).matches(stim, Set.of(4))).isFalse();
    }

    @Test
    void provenanceKeepsFirstCaptureAndAccumulatesShift() {
        EventProvenance provenance =
                EventProvenance.NONE
                        .preserveOrCapture(100, 5_000L)
                        .withRelocation(1.5)
                        .preserveOrCapture(120, 9_000L)
                        .withRelocation(0.5);

        assertThat(provenance.originalLatency()).isEqualTo(100);
        assertThat(provenance.originalWallClockMillis()).isEqualTo(5_000L);
        assertThat(provenance.moved()).isTrue();
        assertThat(provenance.shiftSeconds()).isEqualTo(2.0);
    }

    @Test
    void nullProvenanceBecomesNone() {
        Event event = new Event(1, EventType.GENERIC, 1, null, null, null, 0, null);

        assertThat(event.provenance()).isEqualTo(EventProvenance.NONE);
        assertThat(event.provenance().hasOriginalLatency()).isFalse();
    }
}
