package com.wildfire.resolution.tracing;

/**
 * Span and attribute names emitted by the resolvers.
 */
public final class SpanNames {

    public static final String RESOLVE_RISK = "wildfire.risk.resolve";
    public static final String RESOLVE_LOCATION = "wildfire.location.resolve";

    public static final String ATTR_LOCATION = "wildfire.location";
    public static final String ATTR_RISK_SOURCE = "wildfire.risk.source";
    public static final String ATTR_RISK_LEVEL = "wildfire.risk.level";
    public static final String ATTR_ALLOW_DEFAULT = "wildfire.allowDefault";
    public static final String ATTR_LOCATION_SOURCE = "wildfire.location.source";
    public static final String ATTR_DEGRADED = "wildfire.degraded";

    private SpanNames() {
    }
}
