/* (C)2026 */
package com.ammann.eegprune.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.eegprune.enumeration.EventType;
import com.ammann.eegprune.exception.ExcisionRangeException;
import com.ammann.eegprune.model.Event;
import com.ammann.eegprune.model.ExcisionResult;
import com.ammann.eegprune.model.Recording;
import com.ammann.eegprune.model.Span;
import com.ammann.eegprune.model.SpanSet;
import com.ammann.eegprune.model.Timeline;
import com.ammann.eegprune.support.TestRecordings;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SegmentExcisionServiceTest {

    private SegmentExcisionService exciser;

    @BeforeEach
    void setUp() {
        exciser = new SegmentExcisionService();
    }

    @Test
    void removesExactlyTheSpanSamplesFromDataAndTimeline() {
        Recording recording = TestRecordings.recording("r1", 1000, 10.0, List.of());

        ExcisionResult result =
                exciser.excise(recording, spans(recording, Span.of(100, 199), Span.of(500, 549)));

        Recording pruned = result.recording();
        assertThat(result.samplesRemoved()).isEqualTo(150);
        assertThat(pruned.sampleCount()).isEqualTo(850);
        assertThat(pruned.timeline().sampleCount()).isEqualTo(850);
        assertThat(pruned.samples().value(0, 99)).isEqualTo(99.0);
        assertThat(pruned.samples().value(0, 100)).isEqualTo(200.0);
        assertThat(pruned.samples().value(1, 400)).isEqualTo(-550.0);
        assertThat(pruned.timeline().originalIndexAt(100)).isEqualTo(200);
        assertThat(pruned.timeline().wallClockAt(100))
                .isEqualTo(recording.timeline().wallClockAt(200));
    }

    @Test
    void shiftsSurvivorsDropsInsidersAndMarksSeams() {
        Recording recording =
                TestRecordings.recording(
                        "r1",
                        1000,
                        10.0,
                        List.of(
                                TestRecordings.stimStart(1, 50, 4),
                                TestRecordings.stimStart(2, 150, 4),
                                TestRecordings.stimEnd(3, 300, 4),
                                Event.of(4, EventType.GENERIC, 600)));

        ExcisionResult result =
                exciser.excise(recording, spans(recording, Span.of(100, 199), Span.of(500, 549)));
        Timeline timeline = result.recording().timeline();

        assertThat(TestRecordings.eventById(timeline, 1).latency()).isEqualTo(50);
        assertThat(TestRecordings.eventById(timeline, 3).latency()).isEqualTo(200);
        assertThat(TestRecordings.eventById(timeline, 4).latency()).isEqualTo(450);
        assertThat(result.droppedEvents()).extracting(Event::id).containsExactly(2L);

        List<Event> boundaries = timeline.eventsOfType(EventType.BOUNDARY);
        assertThat(boundaries).extracting(Event::latency).containsExactly(100, 400);
        assertThat(boundaries).extracting(Event::duration).containsExactly(100, 50);
        assertThat(result.insertedBoundaries()).hasSize(2);

        int before = recording.timeline().events().size();
        assertThat(timeline.events().size())
                .isEqualTo(before - result.droppedEvents().size() + result.insertedBoundaries().size());
    }

    @Test
    void boundaryInsideLaterSpanMergesIntoNewSeam() {
        Recording recording = TestRecordings.recording("r1", 1000, 10.0, List.of());
        Recording once = exciser.excise(recording, spans(recording, Span.of(100, 199))).recording();

        ExcisionResult twice =
                exciser.excise(once, spans(once, Span.of(90, 110)));

        List<Event> boundaries = twice.recording().timeline().eventsOfType(EventType.BOUNDARY);
        assertThat(boundaries).hasSize(1);
        assertThat(boundaries.get(0).latency()).isEqualTo(90);
        assertThat(boundaries.get(0).duration()).isEqualTo(121);
        assertThat(twice.droppedEvents()).isEmpty();
        assertThat(twice.recording().sampleCount()).isEqualTo(879);
        assertThat(twice.recording().timeline().excisedOriginalSpans().spans())
                .containsExactly(Span.of(90, 210));
    }

    @Test
    void boundaryAtRecordingEndIsDropped() {
        Recording recording =
                TestRecordings.recording(
                        "r1", 1000, 10.0, List.of(TestRecordings.stimEnd(1, 950, 4)));

        ExcisionResult result = exciser.excise(recording, spans(recording, Span.of(900, 1000)));

        assertThat(result.recording().sampleCount()).isEqualTo(899);
        assertThat(result.recording().timeline().events()).isEmpty();
        assertThat(result.insertedBoundaries()).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void emptySpanSetReturnsSameRecording() {
        Recording recording = TestRecordings.recording("r1", 100, 10.0, List.of());

        ExcisionResult result = exciser.excise(recording, SpanSet.empty());

        assertThat(result.recording()).isSameAs(recording);
        assertThat(result.samplesRemoved()).isZero();
    }

    @Test
    void rejectsSpanPastRecordingEnd() {
        Recording recording = TestRecordings.recording("r1", 1000, 10.0, List.of());

        assertThatThrownBy(() -> exciser.excise(recording, spans(recording, Span.of(990, 1005))))
                .isInstanceOf(ExcisionRangeException.class);
    }

    @Test
    void rejectsSpanSetComputedBeforeEarlierExcision() {
        Recording recording =
                TestRecordings.recording("r1", 1000, 10.0, List.of(), Span.of(100, 199));
        SpanSet detected = new InvalidSpanDetectorService().detect(recording);
        Recording pruned = exciser.excise(recording, detected).recording();

        assertThatThrownBy(() -> exciser.excise(pruned, detected))
                .isInstanceOf(ExcisionRangeException.class)
                .hasMessageContaining("revision");
    }

    @Test
    void rejectsUnboundSpanSet() {
        Recording recording = TestRecordings.recording("r1", 1000, 10.0, List.of());

        assertThatThrownBy(() -> exciser.excise(recording, SpanSet.of(Span.of(100, 199))))
                .isInstanceOf(ExcisionRangeException.class)
                .hasMessageContaining("not bound");
    }

    @Test
    void rejectsSameSpansReusedAgainstShrunkTimeline() {
        Recording recording = TestRecordings.recording("r1", 1000, 10.0, List.of());
        SpanSet first = spans(recording, Span.of(100, 199));
        Recording pruned = exciser.excise(recording, first).recording();

        assertThatThrownBy(() -> exciser.excise(pruned, first))
                .isInstanceOf(ExcisionRangeException.class)
                .hasMessageContaining("revision 0");
        assertThatThrownBy(() -> exciser.excise(pruned, SpanSet.of(Span.of(100, 199))))
                .isInstanceOf(ExcisionRangeException.class);
        assertThat(pruned.sampleCount()).isEqualTo(900);
        assertThat(pruned.timeline().excisedOriginalSpans().spans())
                .containsExactly(Span.of(100, 199));
    }

    @Test
    void incrementsRevisionAndRecordsOriginalCoordinates() {
        Recording recording = TestRecordings.recording("r1", 1000, 10.0, List.of());

        Recording once = exciser.excise(recording, spans(recording, Span.of(100, 199))).recording();
        Recording twice = exciser.excise(once, spans(once, Span.of(300, 309))).recording();

        assertThat(twice.timeline().revision()).isEqualTo(2);
        assertThat(twice.timeline().excisedOriginalSpans().spans())
                .containsExactly(Span.of(100, 199), Span.of(400, 409));
    }

    private static SpanSet spans(Recording recording, Span... spans) {
        return SpanSet.of(spans).boundTo(recording.timeline().revision());
    }
}
