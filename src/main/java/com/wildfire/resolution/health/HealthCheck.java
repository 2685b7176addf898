package com.wildfire.resolution.health;

/**
 * A check of one component (cache store, upstream source) reporting a {@link HealthStatus}.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
