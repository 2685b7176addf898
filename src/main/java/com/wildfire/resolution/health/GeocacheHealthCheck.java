package com.wildfire.resolution.health;

import com.wildfire.resolution.cache.CacheStats;
import com.wildfire.resolution.cache.Geocache;

import java.util.Objects;

/**
 * Reports whether the geocache store is reachable, with size and hit-rate details.
 * An unreachable store is DEGRADED rather than DOWN: resolution still succeeds without it.
 */
public class GeocacheHealthCheck implements HealthCheck {

    private final Geocache geocache;

    public GeocacheHealthCheck(Geocache geocache) {
        this.geocache = Objects.requireNonNull(geocache, "geocache is required");
    }

    @Override
    public String getName() {
        return "geocache";
    }

    @Override
    public HealthStatus check() {
        CacheStats stats = geocache.stats();
        HealthStatus base = geocache.isStoreReachable()
                ? HealthStatus.up()
                : HealthStatus.degraded("Cache store unreachable");
        return base
                .withDetail("entries", stats.size())
                .withDetail("capacity", geocache.getConfig().capacity())
                .withDetail("hitRate", Math.round(stats.hitRate() * 1000.0) / 1000.0)
                .withDetail("evictions", stats.evictionCount());
    }
}
