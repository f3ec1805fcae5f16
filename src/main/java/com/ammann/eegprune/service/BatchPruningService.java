/* (C)2026 */
package com.ammann.eegprune.service;

import com.ammann.eegprune.exception.PipelineStepException;
import com.ammann.eegprune.model.BatchOutcome;
import com.ammann.eegprune.model.PruningOptions;
import com.ammann.eegprune.model.Recording;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Prunes several recordings one after another. A recording whose pipeline fails is recorded
 * as a failed outcome; the remaining recordings are still processed.
 */
@ApplicationScoped
public class BatchPruningService {

    private static final Logger LOG = Logger.getLogger(BatchPruningService.class);

    private final PruningPipelineService pipeline;

    @Inject
    public BatchPruningService(PruningPipelineService pipeline) {
        this.pipeline = pipeline;
    }

    public List<BatchOutcome> runAll(List<Recording> recordings, PruningOptions options) {
        List<BatchOutcome> outcomes = new ArrayList<>(recordings.size());
        for (Recording recording : recordings) {
            try {
                outcomes.add(BatchOutcome.success(pipeline.run(recording, options)));
            } catch (PipelineStepException e) {
                LOG.errorf(
                        "Recording '%s' failed at step '%s': %s",
                        e.getRecordingId(), e.getStep().label(), e.getCause().getMessage());
                outcomes.add(
                        BatchOutcome.failure(
                                e.getRecordingId(), e.getStep(), e.getCause().getMessage()));
            }
        }

        long failed = outcomes.stream().filter(o -> !o.succeeded()).count();
        LOG.infof(
                "Batch finished: %d recordings, %d succeeded, %d failed",
                outcomes.size(), outcomes.size() - failed, failed);
        return outcomes;
    }
}
