package com.largomodo.demstitch.core.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Best-effort fill of missing pixels by random neighbour sampling.
 * <p>
 * Each pass visits the pixels that were missing when the pass began. For each one, up to
 * {@code maxProbes} random offsets within {@code radius} are tried; the first two that hit
 * a valid pixel are averaged into the hole. A pixel filled earlier in a pass is already
 * valid for the pixels after it, so fills propagate inward within one pass.
 * <p>
 * Runs stop after {@code maxPasses}, after a pass that fills nothing, or when no holes are
 * left. Holes that survive keep the sentinel value. When the number of holes exceeds
 * {@code capPixels} the canvas is returned untouched: large gaps are background, not noise.
 * <p>
 * Stateless apart from its settings; the random source is passed per call so tests and
 * replays can fix the seed.
 */
public class HoleInterpolator {

    private static final Logger log = LoggerFactory.getLogger(HoleInterpolator.class);

    private final int capPixels;
    private final int radius;
    private final int maxProbes;
    private final int maxPasses;

    /**
     * @param capPixels Skip the run entirely when more pixels than this are missing
     * @param radius    Maximum probe offset on each axis (pixels)
     * @param maxProbes Random probes per missing pixel per pass
     * @param maxPasses Upper bound on passes
     */
    public HoleInterpolator(int capPixels, int radius, int maxProbes, int maxPasses) {
        if (capPixels < 0) {
            throw new IllegalArgumentException("capPixels must not be negative, got: " + capPixels);
        }
        if (radius <= 0 || maxProbes <= 0 || maxPasses <= 0) {
            throw new IllegalArgumentException("radius, maxProbes and maxPasses must be positive, got: " +
                    radius + ", " + maxProbes + ", " + maxPasses);
        }
        this.capPixels = capPixels;
        this.radius = radius;
        this.maxProbes = maxProbes;
        this.maxPasses = maxPasses;
    }

    /**
     * Fills holes of {@code mosaic} in place.
     *
     * @param mosaic canvas to fill
     * @param mask   validity mask from assembly (non-zero = real sample); not modified
     * @param random random source for probe offsets
     * @return counts describing the run
     */
    public InterpolationResult fill(Mosaic mosaic, Mosaic mask, Random random) {
        if (mosaic == null || mask == null || random == null) {
            throw new IllegalArgumentException("mosaic, mask and random must not be null");
        }
        if (mask.height() != mosaic.height() || mask.width() != mosaic.width()) {
            throw new IllegalArgumentException("Mask " + mask + " does not match " + mosaic);
        }

        int height = mosaic.height();
        int width = mosaic.width();
        boolean[] valid = new boolean[height * width];
        int missing = 0;
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                boolean isValid = mask.get(r, c) != 0.0f;
                valid[r * width + c] = isValid;
                if (!isValid) {
                    missing++;
                }
            }
        }

        int missingBefore = missing;
        if (missing > capPixels) {
            log.warn("Skipping hole interpolation: {} missing pixels exceed cap of {}", missing, capPixels);
            return InterpolationResult.skipped(missingBefore);
        }

        int totalFilled = 0;
        int passes = 0;
        int[] holes = new int[missing];
        int span = 2 * radius + 1;

        while (passes < maxPasses && missing > 0) {
            int holeCount = 0;
            for (int i = 0; i < valid.length; i++) {
                if (!valid[i]) {
                    holes[holeCount++] = i;
                }
            }

            int filledThisPass = 0;
            for (int h = 0; h < holeCount; h++) {
                int row = holes[h] / width;
                int col = holes[h] % width;

                int found = 0;
                double sum = 0.0;
                for (int probe = 0; probe < maxProbes && found < 2; probe++) {
                    int nr = row + random.nextInt(span) - radius;
                    int nc = col + random.nextInt(span) - radius;
                    if (nr < 0 || nr >= height || nc < 0 || nc >= width) {
                        continue;
                    }
                    if (valid[nr * width + nc]) {
                        sum += mosaic.get(nr, nc);
                        found++;
                    }
                }

                if (found >= 2) {
                    mosaic.set(row, col, (float) (sum / found));
                    valid[holes[h]] = true;
                    filledThisPass++;
                }
            }

            passes++;
            missing -= filledThisPass;
            totalFilled += filledThisPass;
            log.debug("Interpolation pass {}: filled {}, {} still missing", passes, filledThisPass, missing);

            if (filledThisPass == 0) {
                break;
            }
        }

        log.info("Hole interpolation: filled {}/{} pixels in {} pass(es), {} left as background",
                totalFilled, missingBefore, passes, missing);
        return new InterpolationResult(missingBefore, totalFilled, passes, false);
    }
}
