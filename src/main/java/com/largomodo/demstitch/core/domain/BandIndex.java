package com.largomodo.demstitch.core.domain;

import java.util.List;

/**
 * Ordered row and column bands for one run, plus the tile-to-cell mapping.
 * <p>
 * Row bands run north to south (descending key), column bands west to east (ascending key).
 * {@link #locate(TileRecord)} never fails: an exact rounded-key match is tried first and the
 * numerically closest band is used otherwise.
 * </p>
 *
 * @param rowBands         Row bands, index 0 is the northernmost
 * @param colBands         Column bands, index 0 is the westernmost
 * @param roundingDecimals Decimal precision used to build the keys
 */
public record BandIndex(List<Band> rowBands, List<Band> colBands, int roundingDecimals) {

    public BandIndex {
        rowBands = List.copyOf(rowBands);
        colBands = List.copyOf(colBands);
        if (rowBands.isEmpty() || colBands.isEmpty()) {
            throw new IllegalArgumentException("Band index needs at least one row band and one column band");
        }
    }

    /**
     * Mosaic height: sum of row band heights.
     */
    public int height() {
        return rowBands.get(rowBands.size() - 1).end();
    }

    /**
     * Mosaic width: sum of column band widths.
     */
    public int width() {
        return colBands.get(colBands.size() - 1).end();
    }

    public Band rowBand(int index) {
        return rowBands.get(index);
    }

    public Band colBand(int index) {
        return colBands.get(index);
    }

    /**
     * Resolves the grid cell of a tile by its north edge (row) and west edge (column).
     */
    public BandPosition locate(TileRecord tile) {
        int row = BandIndexer.resolveIndex(rowBands, BandIndexer.roundKey(tile.latMax(), roundingDecimals));
        int col = BandIndexer.resolveIndex(colBands, BandIndexer.roundKey(tile.lonMin(), roundingDecimals));
        return new BandPosition(row, col);
    }
}
