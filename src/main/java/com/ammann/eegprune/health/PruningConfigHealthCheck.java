/* (C)2026 */
package com.ammann.eegprune.health;

import com.ammann.eegprune.config.PruningConfig;
import com.ammann.eegprune.exception.PruningException;
import com.ammann.eegprune.model.PruningOptions;
import com.ammann.eegprune.service.SleepStageSpanService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

/**
 * Readiness check verifying that the configured pruning options are usable.
 *
 * <p>Reports DOWN when the options cannot be built (negative buffer or gap, unknown zone)
 * or when an unwanted stage code lies outside the valid sleep-stage range.
 */
@Readiness
@ApplicationScoped
public class PruningConfigHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(PruningConfigHealthCheck.class);

    private static final String HEALTH_CHECK_NAME = "pruning-configuration";

    @Inject PruningConfig config;

    public PruningConfigHealthCheck() {}

    PruningConfigHealthCheck(PruningConfig config) {
        this.config = config;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named(HEALTH_CHECK_NAME);

        PruningOptions options;
        try {
            options = config.toOptions();
        } catch (PruningException e) {
            LOG.warnf("Pruning configuration invalid: %s", e.getMessage());
            return builder.down().withData("error", e.getMessage()).build();
        }

        for (Integer stage : options.unwantedStages()) {
            if (stage == null || !SleepStageSpanService.isValidStage(stage)) {
                String message = "Unwanted stage " + stage + " is not a valid sleep stage code";
                LOG.warn(message);
                return builder.down().withData("error", message).build();
            }
        }

        return builder.up()
                .withData("buffer-samples", options.bufferSamples())
                .withData("contiguity-gap", options.contiguityGap())
                .withData("unwanted-stages", options.unwantedStages().toString())
                .withData("report-zone", options.reportZone().getId())
                .build();
    }
}
