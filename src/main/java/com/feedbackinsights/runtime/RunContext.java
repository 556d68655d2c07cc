package com.feedbackinsights.runtime;

import java.time.Instant;
import java.util.UUID;

/**
 * Explicit per-call context passed through every pipeline stage.
 */
public record RunContext(String tenantId, String runId, Instant requestedAt) {

    public static final String DEFAULT_TENANT = "default";

    public RunContext {
        tenantId = tenantId == null || tenantId.isBlank() ? DEFAULT_TENANT : tenantId;
        runId = runId == null || runId.isBlank() ? UUID.randomUUID().toString() : runId;
        requestedAt = requestedAt == null ? Instant.now() : requestedAt;
    }

    public static RunContext forTenant(String tenantId) {
        return new RunContext(tenantId, null, null);
    }
}
