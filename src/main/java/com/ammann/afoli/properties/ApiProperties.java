/* (C)2026 */
package com.ammann.afoli.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Continuum estimation endpoints
     */
    public static final class Continuum {
        private Continuum() {}

        public static final String BASE = "/continuum";
        public static final String AFOLI = "/afoli";
        public static final String BATCH = "/batch";
        public static final String RANGES = "/ranges";
    }
}
