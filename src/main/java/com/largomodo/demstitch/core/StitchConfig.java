package com.largomodo.demstitch.core;

import com.largomodo.demstitch.core.domain.TileShape;

/**
 * Run-wide settings handed explicitly to every stage.
 *
 * @param roundingDecimals  Decimal precision for band keys (coordinate clustering tolerance)
 * @param missingThreshold  Samples at or below this value decode as missing
 * @param interpCapPixels   Skip hole filling when more pixels than this are missing
 * @param interpRadius      Probe radius for hole filling (pixels)
 * @param interpMaxProbes   Random probes per hole per pass
 * @param interpMaxPasses   Maximum hole-filling passes
 * @param seed              Random seed for hole filling; null draws a fresh one per run
 * @param ingestThreads     Decode worker threads
 * @param standardTileShape Expected tile shape; null auto-detects from the first decodable tile
 * @param enforceTileShape  Reject tiles whose shape differs from the standard shape
 * @param flipVertical      Reverse sample row order after decoding
 * @param interpolate       Run hole filling
 * @param aspectCorrection  Run west-east aspect correction
 */
public record StitchConfig(int roundingDecimals,
                           double missingThreshold,
                           int interpCapPixels,
                           int interpRadius,
                           int interpMaxProbes,
                           int interpMaxPasses,
                           Long seed,
                           int ingestThreads,
                           TileShape standardTileShape,
                           boolean enforceTileShape,
                           boolean flipVertical,
                           boolean interpolate,
                           boolean aspectCorrection) {

    public static final int DEFAULT_ROUNDING_DECIMALS = 10;
    public static final double DEFAULT_MISSING_THRESHOLD = -9990.0;
    public static final int DEFAULT_INTERP_CAP_PIXELS = 1_000_000;
    public static final int DEFAULT_INTERP_RADIUS = 5;
    public static final int DEFAULT_INTERP_MAX_PROBES = 20;
    public static final int DEFAULT_INTERP_MAX_PASSES = 30;

    public StitchConfig {
        if (roundingDecimals < 0 || roundingDecimals > 15) {
            throw new IllegalArgumentException("roundingDecimals must be in [0, 15], got: " + roundingDecimals);
        }
        if (Double.isNaN(missingThreshold)) {
            throw new IllegalArgumentException("missingThreshold must be a number");
        }
        if (interpCapPixels < 0) {
            throw new IllegalArgumentException("interpCapPixels must not be negative, got: " + interpCapPixels);
        }
        if (interpRadius <= 0 || interpMaxProbes <= 0 || interpMaxPasses <= 0) {
            throw new IllegalArgumentException("Interpolation radius, probes and passes must be positive");
        }
        if (ingestThreads <= 0) {
            throw new IllegalArgumentException("ingestThreads must be positive, got: " + ingestThreads);
        }
    }

    public static StitchConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .roundingDecimals(roundingDecimals)
                .missingThreshold(missingThreshold)
                .interpCapPixels(interpCapPixels)
                .interpRadius(interpRadius)
                .interpMaxProbes(interpMaxProbes)
                .interpMaxPasses(interpMaxPasses)
                .seed(seed)
                .ingestThreads(ingestThreads)
                .standardTileShape(standardTileShape)
                .enforceTileShape(enforceTileShape)
                .flipVertical(flipVertical)
                .interpolate(interpolate)
                .aspectCorrection(aspectCorrection);
    }

    /**
     * Mutable builder; every setting starts at its default.
     */
    public static final class Builder {
        private int roundingDecimals = DEFAULT_ROUNDING_DECIMALS;
        private double missingThreshold = DEFAULT_MISSING_THRESHOLD;
        private int interpCapPixels = DEFAULT_INTERP_CAP_PIXELS;
        private int interpRadius = DEFAULT_INTERP_RADIUS;
        private int interpMaxProbes = DEFAULT_INTERP_MAX_PROBES;
        private int interpMaxPasses = DEFAULT_INTERP_MAX_PASSES;
        private Long seed;
        private int ingestThreads = Runtime.getRuntime().availableProcessors();
        private TileShape standardTileShape;
        private boolean enforceTileShape = true;
        private boolean flipVertical;
        private boolean interpolate = true;
        private boolean aspectCorrection = true;

        private Builder() {
        }

        public Builder roundingDecimals(int value) {
            this.roundingDecimals = value;
            return this;
        }

        public Builder missingThreshold(double value) {
            this.missingThreshold = value;
            return this;
        }

        public Builder interpCapPixels(int value) {
            this.interpCapPixels = value;
            return this;
        }

        public Builder interpRadius(int value) {
            this.interpRadius = value;
            return this;
        }

        public Builder interpMaxProbes(int value) {
            this.interpMaxProbes = value;
            return this;
        }

        public Builder interpMaxPasses(int value) {
            this.interpMaxPasses = value;
            return this;
        }

        public Builder seed(Long value) {
            this.seed = value;
            return this;
        }

        public Builder ingestThreads(int value) {
            this.ingestThreads = value;
            return this;
        }

        public Builder standardTileShape(TileShape value) {
            this.standardTileShape = value;
            return this;
        }

        public Builder enforceTileShape(boolean value) {
            this.enforceTileShape = value;
            return this;
        }

        public Builder flipVertical(boolean value) {
            this.flipVertical = value;
            return this;
        }

        public Builder interpolate(boolean value) {
            this.interpolate = value;
            return this;
        }

        public Builder aspectCorrection(boolean value) {
            this.aspectCorrection = value;
            return this;
        }

        public StitchConfig build() {
            return new StitchConfig(roundingDecimals, missingThreshold, interpCapPixels, interpRadius,
                    interpMaxProbes, interpMaxPasses, seed, ingestThreads, standardTileShape,
                    enforceTileShape, flipVertical, interpolate, aspectCorrection);
        }
    }
}
