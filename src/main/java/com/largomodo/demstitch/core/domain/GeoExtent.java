package com.largomodo.demstitch.core.domain;

import java.util.Collection;

/**
 * Geographic bounding box in degrees.
 */
public record GeoExtent(double minLat, double maxLat, double minLon, double maxLon) {

    public GeoExtent {
        if (!(minLat < maxLat) || !(minLon < maxLon)) {
            throw new IllegalArgumentException("Degenerate extent: lat " + minLat + ".." + maxLat +
                    ", lon " + minLon + ".." + maxLon);
        }
    }

    /**
     * Union of the bounding boxes of all given tiles.
     *
     * @throws IllegalArgumentException if tiles is empty
     */
    public static GeoExtent union(Collection<TileRecord> tiles) {
        if (tiles == null || tiles.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute the extent of no tiles");
        }
        double minLat = Double.POSITIVE_INFINITY;
        double maxLat = Double.NEGATIVE_INFINITY;
        double minLon = Double.POSITIVE_INFINITY;
        double maxLon = Double.NEGATIVE_INFINITY;
        for (TileRecord tile : tiles) {
            minLat = Math.min(minLat, tile.latMin());
            maxLat = Math.max(maxLat, tile.latMax());
            minLon = Math.min(minLon, tile.lonMin());
            maxLon = Math.max(maxLon, tile.lonMax());
        }
        return new GeoExtent(minLat, maxLat, minLon, maxLon);
    }

    public double latSpan() {
        return maxLat - minLat;
    }

    public double lonSpan() {
        return maxLon - minLon;
    }

    public double midLat() {
        return (minLat + maxLat) / 2.0;
    }
}
