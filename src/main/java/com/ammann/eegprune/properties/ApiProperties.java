/* (C)2026 */
package com.ammann.eegprune.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used by the JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Recording pruning endpoints
     */
    public static final class Recordings {
        private Recordings() {}

        public static final String BASE = "/recordings";
        public static final String PRUNE = BASE + "/prune";
        public static final String PRUNE_REPORT_CSV = PRUNE + "/report.csv";
    }
}
