/* (C)2026 */
package com.ammann.eegprune.dto;

import com.ammann.eegprune.model.Span;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Closed range of removed samples")
/**
 * Closed interval of 1-based sample indices.
 *
 * @param start  first sample in the span
 * @param end    last sample in the span
 * @param length number of samples in the closed interval
 */
public record SpanDTO(
        @Schema(description = "First sample of the span (1-based)") Integer start,
        @Schema(description = "Last sample of the span (1-based)") Integer end,
        @Schema(description = "Number of samples in the span") Integer length) {

    public static SpanDTO from(Span span) {
        return new SpanDTO(span.start(), span.end(), span.length());
    }
}
