package com.largomodo.demstitch.generators;

import com.largomodo.demstitch.core.domain.TileRecord;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * In-memory tiles laid out on a regular geographic grid.
 * <p>
 * Cell (row, col) spans {@link #LAT_STEP} degrees south of {@code ORIGIN_LAT - row * LAT_STEP}
 * and {@link #LON_STEP} degrees east of {@code ORIGIN_LON + col * LON_STEP}, matching the
 * 1/120 x 1/80 degree extent of a GSI 5 m tile.
 */
public final class TileRecordFactory {

    public static final double ORIGIN_LAT = 36.0;
    public static final double ORIGIN_LON = 139.0;
    public static final double LAT_STEP = 1.0 / 120.0;
    public static final double LON_STEP = 1.0 / 80.0;

    private TileRecordFactory() {
    }

    /**
     * Tile at grid cell (row, col), every sample {@code value}.
     */
    public static TileRecord cell(int row, int col, int rows, int cols, float value, int discoveryIndex) {
        float[] samples = new float[rows * cols];
        Arrays.fill(samples, value);
        return cell(row, col, rows, cols, samples, discoveryIndex);
    }

    public static TileRecord cell(int row, int col, int rows, int cols, float[] samples, int discoveryIndex) {
        double latMax = ORIGIN_LAT - row * LAT_STEP;
        double lonMin = ORIGIN_LON + col * LON_STEP;
        return new TileRecord(Path.of("tile_" + row + "_" + col + ".xml"), discoveryIndex,
                latMax - LAT_STEP, latMax, lonMin, lonMin + LON_STEP, rows, cols, samples);
    }

    /**
     * Full {@code gridRows x gridCols} grid of equally sized tiles, row-major discovery order.
     * Tile (r, c) holds the value {@code 1 + r * gridCols + c}.
     */
    public static List<TileRecord> grid(int gridRows, int gridCols, int rows, int cols) {
        List<TileRecord> tiles = new ArrayList<>(gridRows * gridCols);
        for (int r = 0; r < gridRows; r++) {
            for (int c = 0; c < gridCols; c++) {
                int index = r * gridCols + c;
                tiles.add(cell(r, c, rows, cols, 1.0f + index, index));
            }
        }
        return tiles;
    }
}
