package com.largomodo.demstitch.core.domain;

import java.nio.file.Path;

/**
 * Immutable decoded elevation tile.
 * <p>
 * Carries the tile's geographic bounding box (degrees) and its dense row-major sample grid.
 * Missing samples hold {@link #SENTINEL}; a record is only built once the grid has been
 * padded or truncated to exactly {@code rows * cols} values, so downstream stages never
 * check the length again.
 * </p>
 *
 * @param source         Where the tile was read from (used for logging only)
 * @param discoveryIndex Position of the source in collection order, used as stable sort key
 * @param latMin         South edge
 * @param latMax         North edge
 * @param lonMin         West edge
 * @param lonMax         East edge
 * @param rows           Sample rows (north to south)
 * @param cols           Sample columns (west to east)
 * @param samples        Row-major grid of {@code rows * cols} values
 */
public record TileRecord(Path source, int discoveryIndex,
                         double latMin, double latMax, double lonMin, double lonMax,
                         int rows, int cols, float[] samples) {

    /**
     * Canonical missing-sample marker. Doubles as background ("sea level / no data").
     */
    public static final float SENTINEL = 0.0f;

    /**
     * Compact constructor validating bounding box and grid invariants.
     *
     * @throws IllegalArgumentException if any invariant is violated
     */
    public TileRecord {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        if (!(latMin < latMax)) {
            throw new IllegalArgumentException("latMin must be < latMax, got " + latMin + " / " + latMax);
        }
        if (!(lonMin < lonMax)) {
            throw new IllegalArgumentException("lonMin must be < lonMax, got " + lonMin + " / " + lonMax);
        }
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive, got " + rows + "x" + cols);
        }
        if (samples == null || samples.length != rows * cols) {
            throw new IllegalArgumentException("samples must hold exactly rows*cols = " + (rows * cols) +
                    " values, got " + (samples == null ? "null" : samples.length));
        }
    }

    public TileShape shape() {
        return new TileShape(rows, cols);
    }

    /**
     * Sample at (row, col) of this tile's own grid.
     */
    public float sampleAt(int row, int col) {
        return samples[row * cols + col];
    }

    public String displayName() {
        Path fileName = source.getFileName();
        return fileName != null ? fileName.toString() : source.toString();
    }
}
