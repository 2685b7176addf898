package com.wildfire.resolution.health;

import com.wildfire.resolution.source.RiskIndexSource;

import java.util.Objects;

/**
 * Reports the reachability of an upstream risk source. An unavailable source is DEGRADED,
 * since the fallback chain still produces a result.
 */
public class RiskSourceHealthCheck implements HealthCheck {

    private final RiskIndexSource source;
    private final String role;

    public RiskSourceHealthCheck(RiskIndexSource source, String role) {
        this.source = Objects.requireNonNull(source, "source is required");
        this.role = Objects.requireNonNull(role, "role is required");
    }

    @Override
    public String getName() {
        return "riskSource." + role;
    }

    @Override
    public HealthStatus check() {
        HealthStatus base = source.isAvailable()
                ? HealthStatus.up()
                : HealthStatus.degraded(source.name() + " unavailable");
        return base.withDetail("source", source.name());
    }
}
