/* (C)2026 */
package com.ammann.eegprune.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Amount of data removed for one removal category.
 *
 * @param category       {@code invalid-data} or {@code sleep-stage:<code>}
 * @param spanCount      number of spans removed
 * @param samplesRemoved total samples removed
 * @param secondsRemoved total seconds removed
 */
@Schema(description = "Data removed per category")
public record RemovalSummaryDTO(
        @Schema(description = "Removal category") String category,
        @Schema(description = "Number of removed spans") Integer spanCount,
        @Schema(description = "Removed samples") Long samplesRemoved,
        @Schema(description = "Removed seconds") Double secondsRemoved) {

    public static final String INVALID_DATA = "invalid-data";
    public static final String SLEEP_STAGE_PREFIX = "sleep-stage:";
}
