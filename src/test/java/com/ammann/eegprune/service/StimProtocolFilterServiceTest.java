/* (C)2026 */
package com.ammann.eegprune.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.eegprune.dto.PipelineWarningDTO;
import com.ammann.eegprune.enumeration.WarningType;
import com.ammann.eegprune.model.Event;
import com.ammann.eegprune.model.ProtocolFilterResult;
import com.ammann.eegprune.model.Timeline;
import com.ammann.eegprune.support.TestRecordings;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StimProtocolFilterServiceTest {

    private StimProtocolFilterService filter;

    @BeforeEach
    void setUp() {
        filter = new StimProtocolFilterService();
    }

    @Test
    void removesProtocolStartingRightAfterUnwantedStage() {
        Timeline timeline =
                TestRecordings.timeline(
                        200,
                        10.0,
                        List.of(
                                TestRecordings.stage(1, 10, 0),
                                TestRecordings.stimStart(2, 11, 4),
                                TestRecordings.stimEnd(3, 50, 4),
                                TestRecordings.stage(4, 100, 2),
                                TestRecordings.stimStart(5, 101, 4),
                                TestRecordings.stimEnd(6, 150, 4)));

        ProtocolFilterResult result =
                filter.removeProtocolsInUnwantedStages(timeline, Set.of(0, 1, 4), Set.of(4));

        assertThat(result.protocolsFound()).isEqualTo(2);
        assertThat(result.protocolsRemoved()).isEqualTo(1);
        assertThat(result.timeline().events()).extracting(Event::id).containsExactly(1L, 4L, 5L, 6L);
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void keepsEverythingWithoutUnwantedStages() {
        Timeline timeline =
                TestRecordings.timeline(
                        200,
                        10.0,
                        List.of(
                                TestRecordings.stage(1, 10, 2),
                                TestRecordings.stimStart(2, 11, 4),
                                TestRecordings.stimEnd(3, 50, 4)));

        ProtocolFilterResult result =
                filter.removeProtocolsInUnwantedStages(timeline, Set.of(0, 1, 4), Set.of(4));

        assertThat(result.protocolsRemoved()).isZero();
        assertThat(result.timeline()).isSameAs(timeline);
    }

    @Test
    void incompleteProtocolsAreWarnedAbout() {
        Timeline timeline =
                TestRecordings.timeline(
                        200,
                        10.0,
                        List.of(
                                TestRecordings.stimEnd(1, 5, 4),
                                TestRecordings.stimStart(2, 20, 4),
                                TestRecordings.stimStart(3, 30, 4),
                                TestRecordings.stimEnd(4, 40, 4),
                                TestRecordings.stimStart(5, 90, 4)));

        ProtocolFilterResult result =
                filter.removeProtocolsInUnwantedStages(timeline, Set.of(0), Set.of(4));

        assertThat(result.protocolsFound()).isEqualTo(1);
        assertThat(result.warnings())
                .extracting(PipelineWarningDTO::eventId)
                .containsExactly(1L, 2L, 5L);
        assertThat(result.warnings())
                .allMatch(w -> w.type() == WarningType.INCOMPLETE_PROTOCOL);
    }

    @Test
    void otherProtocolTypesAreIgnored() {
        Timeline timeline =
                TestRecordings.timeline(
                        200,
                        10.0,
                        List.of(
                                TestRecordings.stage(1, 10, 0),
                                TestRecordings.stimStart(2, 11, 3),
                                TestRecordings.stimEnd(3, 50, 3)));

        ProtocolFilterResult result =
                filter.removeProtocolsInUnwantedStages(timeline, Set.of(0), Set.of(4));

        assertThat(result.protocolsFound()).isZero();
        assertThat(result.timeline().events()).hasSize(3);
    }
}
