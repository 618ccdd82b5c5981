package com.property.reconciliation.health;

/**
 * Check for one dependency of the engine.
 */
public interface HealthCheck {

    String getName();

    /**
     * Runs the check. Implementations report failures as a status rather than throwing.
     */
    HealthStatus check();
}
