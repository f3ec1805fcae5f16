/* (C)2026 */
package com.ammann.eegprune.exception;

import com.ammann.eegprune.enumeration.PipelineStep;

/**
 * Wraps a fatal error with the recording and the pipeline step it aborted.
 *
 * <p>Mapped to HTTP 422 by {@link GlobalExceptionHandler}. Batch runs catch it per
 * recording so sibling recordings are unaffected.
 */
public class PipelineStepException extends PruningException
{
    private final String recordingId;
    private final PipelineStep step;

    public PipelineStepException(String recordingId, PipelineStep step, Throwable cause)
    {
        super(
                String.format(
                        "Recording '%s' failed at step '%s': %s",
                        recordingId, step.label(), cause.getMessage()),
                cause);
        this.recordingId = recordingId;
        this.step = step;
    }

    public String getRecordingId()
    {
        return recordingId;
    }

    public PipelineStep getStep()
    {
        return step;
    }
}
