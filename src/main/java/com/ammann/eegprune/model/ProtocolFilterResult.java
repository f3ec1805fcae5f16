/* (C)2026 */
package com.ammann.eegprune.model;

import com.ammann.eegprune.dto.PipelineWarningDTO;
import java.util.List;

/**
 * Timeline after dropping stimulation protocols that began in unwanted sleep stages.
 *
 * @param timeline         timeline without the removed protocols
 * @param protocolsFound   complete start/end pairs found
 * @param protocolsRemoved pairs removed
 * @param warnings         incomplete protocols
 */
public record ProtocolFilterResult(
        Timeline timeline, int protocolsFound, int protocolsRemoved, List<PipelineWarningDTO> warnings) {

    public ProtocolFilterResult {
        warnings = List.copyOf(warnings);
    }
}
