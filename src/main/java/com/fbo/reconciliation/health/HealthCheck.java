package com.fbo.reconciliation.health;

/**
 * A single health check of one part of the engine (remote sync, local store).
 */
public interface HealthCheck {

    String getName();

    /**
     * Runs the check. Implementations must not throw; a failing check reports {@code DOWN}.
     */
    HealthStatus check();
}
