package com.largomodo.demstitch.core.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;
import java.util.function.ToIntFunction;

/**
 * Clusters tiles into row and column bands by their rounded corner coordinates.
 * <p>
 * Tiles carry no reliable grid index, so geographic coordinates are the only ground truth.
 * Rounding to a fixed number of decimals absorbs the jitter between independently computed
 * tile corners; comparing raw doubles would split tiles that sit in the same row.
 * <p>
 * Stateless; safe for concurrent use.
 */
public class BandIndexer {

    private static final Logger log = LoggerFactory.getLogger(BandIndexer.class);

    private final int roundingDecimals;

    public BandIndexer(int roundingDecimals) {
        if (roundingDecimals < 0 || roundingDecimals > 15) {
            throw new IllegalArgumentException("roundingDecimals must be in [0, 15], got: " + roundingDecimals);
        }
        this.roundingDecimals = roundingDecimals;
    }

    /**
     * Builds row bands keyed by {@code latMax} (descending) and column bands keyed by
     * {@code lonMin} (ascending), sized by the largest member tile and offset cumulatively.
     *
     * @param tiles accepted tiles, must not be empty
     * @return the band index for this tile set
     * @throws IllegalArgumentException if tiles is null or empty
     */
    public BandIndex index(Collection<TileRecord> tiles) {
        if (tiles == null || tiles.isEmpty()) {
            throw new IllegalArgumentException("Cannot index an empty tile set");
        }

        List<Band> rowBands = buildBands(tiles, TileRecord::latMax, TileRecord::rows, Comparator.reverseOrder());
        List<Band> colBands = buildBands(tiles, TileRecord::lonMin, TileRecord::cols, Comparator.naturalOrder());

        log.debug("Indexed {} tiles into {} row bands x {} column bands",
                tiles.size(), rowBands.size(), colBands.size());
        return new BandIndex(rowBands, colBands, roundingDecimals);
    }

    private List<Band> buildBands(Collection<TileRecord> tiles,
                                  ToDoubleFunction<TileRecord> corner,
                                  ToIntFunction<TileRecord> extent,
                                  Comparator<Double> order) {
        Map<Double, List<TileRecord>> grouped = new TreeMap<>(order);
        for (TileRecord tile : tiles) {
            double key = roundKey(corner.applyAsDouble(tile), roundingDecimals);
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(tile);
        }

        List<Band> bands = new ArrayList<>(grouped.size());
        int offset = 0;
        for (Map.Entry<Double, List<TileRecord>> entry : grouped.entrySet()) {
            int size = entry.getValue().stream().mapToInt(extent).max().orElseThrow();
            bands.add(new Band(entry.getKey(), size, offset, entry.getValue()));
            offset += size;
        }
        return bands;
    }

    /**
     * Rounds a coordinate half-even to the given number of decimals.
     */
    public static double roundKey(double value, int decimals) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * Two-step lookup: exact key match, otherwise the closest band.
     */
    static int resolveIndex(List<Band> bands, double roundedKey) {
        OptionalInt exact = exactIndex(bands, roundedKey);
        if (exact.isPresent()) {
            return exact.getAsInt();
        }
        int nearest = nearestIndex(bands, roundedKey);
        log.debug("No band with key {}, falling back to nearest band {} (key {})",
                roundedKey, nearest, bands.get(nearest).key());
        return nearest;
    }

    /**
     * Index of the band whose key equals {@code roundedKey}, if any.
     */
    public static OptionalInt exactIndex(List<Band> bands, double roundedKey) {
        for (int i = 0; i < bands.size(); i++) {
            if (Double.compare(bands.get(i).key(), roundedKey) == 0) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Index of the band with minimum absolute key distance; the first one wins ties.
     *
     * @throws IllegalArgumentException if bands is empty
     */
    public static int nearestIndex(List<Band> bands, double key) {
        if (bands.isEmpty()) {
            throw new IllegalArgumentException("No bands to search");
        }
        int best = 0;
        double bestDistance = Math.abs(bands.get(0).key() - key);
        for (int i = 1; i < bands.size(); i++) {
            double distance = Math.abs(bands.get(i).key() - key);
            if (distance < bestDistance) {
                best = i;
                bestDistance = distance;
            }
        }
        return best;
    }
}
