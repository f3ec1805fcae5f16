/* (C)2026 */
package com.ammann.eegprune.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.eegprune.model.Recording;
import com.ammann.eegprune.model.SampleMatrix;
import com.ammann.eegprune.model.Span;
import com.ammann.eegprune.model.SpanSet;
import com.ammann.eegprune.support.TestRecordings;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InvalidSpanDetectorServiceTest {

    private InvalidSpanDetectorService detector;

    @BeforeEach
    void setUp() {
        detector = new InvalidSpanDetectorService();
    }

    @Test
    void cleanRecordingHasNoSpans() {
        assertThat(detector.detect(TestRecordings.matrix(500)).isEmpty()).isTrue();
    }

    @Test
    void findsMaximalRunsIncludingEdges() {
        SampleMatrix matrix =
                TestRecordings.matrix(100, Span.of(1, 3), Span.of(40, 49), Span.of(95, 100));

        SpanSet spans = detector.detect(matrix);

        assertThat(spans.spans())
                .containsExactly(Span.of(1, 3), Span.of(40, 49), Span.of(95, 100));
    }

    @Test
    void entirelyInvalidRecordingIsOneSpan() {
        SpanSet spans = detector.detect(TestRecordings.matrix(20, Span.of(1, 20)));

        assertThat(spans.spans()).containsExactly(Span.of(1, 20));
    }

    @Test
    void runsSeparatedByOneValidSampleStayApart() {
        SampleMatrix matrix = TestRecordings.matrix(20, Span.of(5, 6), Span.of(8, 8));

        assertThat(detector.detect(matrix).spans()).containsExactly(Span.of(5, 6), Span.of(8, 8));
    }

    @Test
    void invalidValueInAnyChannelMarksColumn() {
        SampleMatrix matrix =
                new SampleMatrix(new double[][] {{1, 2, 3, 4}, {1, 2, Double.NaN, 4}});

        assertThat(detector.detect(matrix).spans()).containsExactly(Span.of(3, 3));
    }

    @Test
    void detectionOnRecordingIsBoundToTimelineRevision() {
        Recording recording = TestRecordings.recording("r1", 100, 10.0, List.of(), Span.of(10, 20));

        SpanSet spans = detector.detect(recording);

        assertThat(spans.isBound()).isTrue();
        assertThat(spans.baselineRevision()).isEqualTo(recording.timeline().revision());
    }
}
