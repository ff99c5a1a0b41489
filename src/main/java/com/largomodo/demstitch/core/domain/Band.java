package com.largomodo.demstitch.core.domain;

import java.util.List;

/**
 * One row or column of the tile grid.
 * <p>
 * Tiles belong to a band when their representative corner (north edge for rows, west edge
 * for columns) rounds to {@link #key()}. The band's pixel extent is the largest tile
 * extent among its members, and its offset is the cumulative extent of all bands before it.
 * </p>
 *
 * @param key    Rounded coordinate shared by all members (degrees)
 * @param size   Pixel extent: max rows (row band) or max cols (column band) of members
 * @param offset Pixel offset of the band's first row/column in the mosaic
 * @param tiles  Member tiles (unmodifiable)
 */
public record Band(double key, int size, int offset, List<TileRecord> tiles) {

    public Band {
        if (size <= 0) {
            throw new IllegalArgumentException("Band size must be positive, got: " + size);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Band offset must not be negative, got: " + offset);
        }
        tiles = List.copyOf(tiles);
    }

    /**
     * First pixel after this band.
     */
    public int end() {
        return offset + size;
    }
}
