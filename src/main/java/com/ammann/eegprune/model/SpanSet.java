/* (C)2026 */
package com.ammann.eegprune.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.jboss.logging.Logger;

/**
 * Normalized, immutable collection of removal spans.
 *
 * <p>Spans are sorted by start, pairwise non-overlapping and never contiguous: two spans
 * are merged whenever {@code next.start <= current.end + contiguityGap}. The default gap
 * of 1 merges touching and overlapping spans.
 *
 * <p>A span set may be bound to the timeline revision it was computed against. The exciser
 * only accepts bound sets whose revision matches the timeline, so a set reused after an
 * earlier excision shrank the timeline is rejected.
 */
public final class SpanSet implements Iterable<Span> {

    private static final Logger LOG = Logger.getLogger(SpanSet.class);

    public static final int DEFAULT_CONTIGUITY_GAP = 1;

    /** Marker for span sets not tied to a timeline revision. */
    public static final int UNBOUND = -1;

    private static final SpanSet EMPTY = new SpanSet(List.of(), DEFAULT_CONTIGUITY_GAP, UNBOUND);

    private final List<Span> spans;
    private final int contiguityGap;
    private final int baselineRevision;

    private SpanSet(List<Span> spans, int contiguityGap, int baselineRevision) {
        this.spans = spans;
        this.contiguityGap = contiguityGap;
        this.baselineRevision = baselineRevision;
    }

    public static SpanSet empty() {
        return EMPTY;
    }

    public static SpanSet of(Span... spans) {
        return normalize(List.of(spans));
    }

    public static SpanSet normalize(Collection<Span> rawSpans) {
        return normalize(rawSpans, DEFAULT_CONTIGUITY_GAP);
    }

    /**
     * Sorts the raw spans by start and merges overlapping or near spans.
     *
     * @param rawSpans      spans in any order, possibly overlapping
     * @param contiguityGap spans whose start is at most {@code end + contiguityGap} merge
     * @return normalized, unbound span set
     */
    public static SpanSet normalize(Collection<Span> rawSpans, int contiguityGap) {
        return normalize(rawSpans, contiguityGap, UNBOUND);
    }

    private static SpanSet normalize(
            Collection<Span> rawSpans, int contiguityGap, int baselineRevision) {
        if (contiguityGap < 0) {
            throw new IllegalArgumentException(
                    "Contiguity gap must not be negative, got " + contiguityGap);
        }
        if (rawSpans == null || rawSpans.isEmpty()) {
            return baselineRevision == UNBOUND && contiguityGap == DEFAULT_CONTIGUITY_GAP
                    ? EMPTY
                    : new SpanSet(List.of(), contiguityGap, baselineRevision);
        }

        List<Span> sorted = new ArrayList<>(rawSpans);
        sorted.sort(Comparator.comparingInt(Span::start).thenComparingInt(Span::end));

        List<Span> merged = new ArrayList<>(sorted.size());
        Span current = sorted.get(0);
        for (int i = 1; i < sorted.size(); i++) {
            Span next = sorted.get(i);
            if ((long) next.start() <= (long) current.end() + contiguityGap) {
                current = new Span(current.start(), Math.max(current.end(), next.end()));
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);

        if (merged.size() < sorted.size()) {
            LOG.infof(
                    "Merged %d overlapping or contiguous spans into %d",
                    sorted.size(), merged.size());
        }

        return new SpanSet(Collections.unmodifiableList(merged), contiguityGap, baselineRevision);
    }

    /**
     * Returns a new set containing this set's spans plus the given one, re-normalized.
     * The baseline revision is kept.
     */
    public SpanSet insert(Span span) {
        List<Span> union = new ArrayList<>(spans.size() + 1);
        union.addAll(spans);
        union.add(span);
        return normalize(union, contiguityGap, baselineRevision);
    }

    /** Union of both sets, normalized with this set's gap; the result is unbound. */
    public SpanSet union(SpanSet other) {
        List<Span> union = new ArrayList<>(spans.size() + other.spans.size());
        union.addAll(spans);
        union.addAll(other.spans);
        return normalize(union, contiguityGap, UNBOUND);
    }

    /** Ties this span set to the timeline revision its indices refer to. */
    public SpanSet boundTo(int timelineRevision) {
        return new SpanSet(spans, contiguityGap, timelineRevision);
    }

    public boolean isBound() {
        return baselineRevision != UNBOUND;
    }

    public int baselineRevision() {
        return baselineRevision;
    }

    public int contiguityGap() {
        return contiguityGap;
    }

    public boolean isEmpty() {
        return spans.isEmpty();
    }

    public int size() {
        return spans.size();
    }

    public Span get(int index) {
        return spans.get(index);
    }

    /** Spans in ascending order. */
    public List<Span> spans() {
        return spans;
    }

    public Stream<Span> stream() {
        return spans.stream();
    }

    @Override
    public Iterator<Span> iterator() {
        return spans.iterator();
    }

    /** Total number of samples covered by all spans. */
    public long totalLength() {
        long total = 0;
        for (Span span : spans) {
            total += span.length();
        }
        return total;
    }

    /**
     * Finds the span that contains the given sample index (binary search).
     *
     * @param sampleIndex 1-based sample index
     * @return the containing span, empty when the index lies between or outside all spans
     */
    public Optional<Span> findContaining(int sampleIndex) {
        int low = 0;
        int high = spans.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            Span span = spans.get(mid);
            if (sampleIndex < span.start()) {
                high = mid - 1;
            } else if (sampleIndex > span.end()) {
                low = mid + 1;
            } else {
                return Optional.of(span);
            }
        }
        return Optional.empty();
    }

    public boolean contains(int sampleIndex) {
        return findContaining(sampleIndex).isPresent();
    }

    /** Whether any span of this set shares at least one sample with the given span. */
    public boolean overlaps(Span span) {
        int low = 0;
        int high = spans.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            Span candidate = spans.get(mid);
            if (candidate.end() < span.start()) {
                low = mid + 1;
            } else if (candidate.start() > span.end()) {
                high = mid - 1;
            } else {
                return true;
            }
        }
        return false;
    }

    /** Equality considers the spans only, not the gap or the revision binding. */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SpanSet other)) {
            return false;
        }
        return spans.equals(other.spans);
    }

    @Override
    public int hashCode() {
        return spans.hashCode();
    }

    @Override
    public String toString() {
        return "SpanSet" + spans + (isBound() ? "@r" + baselineRevision : "");
    }
}
