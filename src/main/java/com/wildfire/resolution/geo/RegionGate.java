package com.wildfire.resolution.geo;

import com.wildfire.resolution.core.model.GeoCoordinate;

import java.util.Objects;

/**
 * Fixed bounding region deciding whether a region-specific source applies to a coordinate.
 */
public final class RegionGate {

    /**
     * Scotland including St Kilda, Orkney and Shetland: 54.6..60.9 N, 9.0 W..1.0 E.
     */
    public static final RegionGate SCOTLAND = new RegionGate("scotland", new GeoBounds(54.6, -9.0, 60.9, 1.0));

    private final String name;
    private final GeoBounds bounds;

    public RegionGate(String name, GeoBounds bounds) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.bounds = Objects.requireNonNull(bounds, "bounds is required");
    }

    public boolean contains(GeoCoordinate coordinate) {
        return bounds.contains(coordinate);
    }

    /**
     * Raw-value variant; invalid coordinates are never inside the region.
     */
    public boolean contains(double latitude, double longitude) {
        return GeoCoordinate.isValid(latitude, longitude) && bounds.contains(latitude, longitude);
    }

    public String getName() {
        return name;
    }

    public GeoBounds getBounds() {
        return bounds;
    }

    @Override
    public String toString() {
        return "RegionGate{" + name + " " + bounds + '}';
    }
}
