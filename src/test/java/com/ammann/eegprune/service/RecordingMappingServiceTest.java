/* (C)2026 */
package com.ammann.eegprune.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.ammann.eegprune.dto.EventDTO;
import com.ammann.eegprune.dto.PruningResultDTO;
import com.ammann.eegprune.dto.RecordingRequestDTO;
import com.ammann.eegprune.enumeration.EventType;
import com.ammann.eegprune.exception.ValidationException;
import com.ammann.eegprune.model.Event;
import com.ammann.eegprune.model.PruningOptions;
import com.ammann.eegprune.model.PruningResult;
import com.ammann.eegprune.model.Recording;
import com.ammann.eegprune.model.Span;
import com.ammann.eegprune.support.TestRecordings;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RecordingMappingServiceTest {

    private RecordingMappingService mapper;

    @BeforeEach
    void setUp() {
        mapper = new RecordingMappingService();
    }

    @Test
    void mapsChannelsTimestampsAndEvents() {
        RecordingRequestDTO request =
                new RecordingRequestDTO(
                        "night-01",
                        2.0,
                        List.of(Arrays.asList(1.0, null, 3.0), List.of(4.0, 5.0, 6.0)),
                        null,
                        List.of(1_000L, 1_500L, 2_000L),
                        List.of(
                                new EventDTO("stim start", 1, 4, null),
                                new EventDTO("Sleep Stage", 2, null, "3"),
                                new EventDTO("lights off", 3, null, "L")),
                        null,
                        null);

        Recording recording = mapper.toRecording(request);

        assertThat(recording.id()).isEqualTo("night-01");
        assertThat(recording.sampleCount()).isEqualTo(3);
        assertThat(recording.samples().isInvalidColumn(2)).isTrue();
        assertThat(recording.timeline().wallClockAt(3)).isEqualTo(2_000L);
        assertThat(recording.timeline().events())
                .extracting(Event::id, Event::type)
                .containsExactly(
                        tuple(1L, EventType.STIM_START),
                        tuple(2L, EventType.SLEEP_STAGE),
                        tuple(3L, EventType.GENERIC));
        assertThat(recording.timeline().events().get(1).sleepStage()).isEqualTo(3);
        assertThat(recording.timeline().events().get(0).protoType()).isEqualTo(4);
    }

    @Test
    void derivesUniformTimestampsFromStartTime() {
        Instant start = Instant.parse("2024-03-01T23:00:00Z");
        RecordingRequestDTO request =
                new RecordingRequestDTO(
                        "night-02", 4.0, List.of(List.of(1.0, 2.0, 3.0)), start, null, null, null, null);

        Recording recording = mapper.toRecording(request);

        assertThat(recording.timeline().wallClockAt(3)).isEqualTo(start.toEpochMilli() + 500L);
        assertThat(recording.timeline().events()).isEmpty();
    }

    @Test
    void requiresTimestampsOrStartTime() {
        RecordingRequestDTO request =
                new RecordingRequestDTO(
                        "night-03", 4.0, List.of(List.of(1.0)), null, null, null, null, null);

        assertThatThrownBy(() -> mapper.toRecording(request))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("startTime");
    }

    @Test
    void rejectsTimestampCountMismatch() {
        RecordingRequestDTO request =
                new RecordingRequestDTO(
                        "night-04", 4.0, List.of(List.of(1.0, 2.0)), null, List.of(0L), null, null, null);

        assertThatThrownBy(() -> mapper.toRecording(request))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("timestampsMillis");
    }

    @Test
    void rejectsClientSuppliedBoundaryMarkers() {
        RecordingRequestDTO request =
                new RecordingRequestDTO(
                        "night-05",
                        4.0,
                        List.of(List.of(1.0, 2.0)),
                        Instant.EPOCH,
                        null,
                        List.of(new EventDTO("boundary", 1, null, null)),
                        null,
                        null);

        assertThatThrownBy(() -> mapper.toRecording(request))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void responseCarriesDataOnlyWhenRequested() {
        Recording recording =
                TestRecordings.recording(
                        "night-06",
                        100,
                        10.0,
                        List.of(TestRecordings.stimStart(1, 15, 4), TestRecordings.stimEnd(2, 60, 4)),
                        Span.of(10, 19));
        PruningResult result =
                new PruningPipelineService(
                                new StimProtocolFilterService(),
                                new InvalidSpanDetectorService(),
                                new EventRelocationService(),
                                new SegmentExcisionService(),
                                new SleepStageSpanService(),
                                new ProtocolCountService(),
                                new ReconciliationReportService(),
                                new EventFilterService())
                        .run(recording, PruningOptions.defaults());

        PruningResultDTO withoutData = mapper.toResponse(result, false);
        assertThat(withoutData.channels()).isNull();
        assertThat(withoutData.timestampsMillis()).isNull();
        assertThat(withoutData.originalSampleCount()).isEqualTo(100);
        assertThat(withoutData.sampleCount()).isEqualTo(90);
        assertThat(withoutData.invalidSpans()).hasSize(1);
        assertThat(withoutData.invalidSpans().get(0).length()).isEqualTo(10);
        assertThat(withoutData.report()).hasSize(2);

        PruningResultDTO withData = mapper.toResponse(result, true);
        assertThat(withData.channels()).hasSize(2);
        assertThat(withData.channels().get(0)).hasSize(90).doesNotContainNull();
        assertThat(withData.timestampsMillis()).hasSize(90);
        assertThat(withData.events())
                .filteredOn(e -> "stim start".equals(e.type()))
                .singleElement()
                .satisfies(
                        e -> {
                            assertThat(e.latency()).isEqualTo(11);
                            assertThat(e.originalLatency()).isEqualTo(15);
                            assertThat(e.moved()).isTrue();
                        });
    }
}
