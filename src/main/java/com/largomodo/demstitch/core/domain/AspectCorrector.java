package com.largomodo.demstitch.core.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Corrects the west-east stretch of a latitude/longitude grid.
 * <p>
 * A degree of longitude covers {@code cos(lat)} times the ground distance of a degree of
 * latitude, so a mosaic with equal angular pixel counts looks too wide away from the
 * equator. The width is rescaled by a factor derived from the per-pixel angular size on
 * each axis at the mosaic's mid latitude; height never changes.
 * <p>
 * The raw ratio {@code (dLat / dLon) / cos(midLat)} is inverted before it is applied. This
 * is the fixed contract for output dimensions and must not be replaced by the raw ratio.
 */
public class AspectCorrector {

    private static final Logger log = LoggerFactory.getLogger(AspectCorrector.class);

    /**
     * Resamples data and mask to the corrected width.
     *
     * @param mosaic assembled (and possibly interpolated) raster
     * @param mask   validity mask aligned with {@code mosaic}
     * @param extent union of all input tiles' bounding boxes
     */
    public AspectCorrection correct(Mosaic mosaic, Mosaic mask, GeoExtent extent) {
        if (mosaic == null || mask == null || extent == null) {
            throw new IllegalArgumentException("mosaic, mask and extent must not be null");
        }
        if (mask.height() != mosaic.height() || mask.width() != mosaic.width()) {
            throw new IllegalArgumentException("Mask " + mask + " does not match " + mosaic);
        }

        double scale = appliedScale(extent, mosaic.height(), mosaic.width());
        int newWidth = correctedWidth(mosaic.width(), scale);
        log.info("Aspect correction: mid latitude {}, scale {}, width {} -> {}",
                String.format("%.6f", extent.midLat()), String.format("%.6f", scale), mosaic.width(), newWidth);

        return new AspectCorrection(resampleWidth(mosaic, newWidth), resampleWidth(mask, newWidth), scale);
    }

    /**
     * Width multiplier: {@code 1 / ((dLat / dLon) * (1 / cos(midLat)))}.
     *
     * @param extent union extent of the tiles
     * @param height mosaic height in pixels
     * @param width  mosaic width in pixels
     */
    public static double appliedScale(GeoExtent extent, int height, int width) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Mosaic dimensions must be positive, got " + height + "x" + width);
        }
        double dLat = extent.latSpan() / height;
        double dLon = extent.lonSpan() / width;
        double rawScale = (dLat / dLon) * (1.0 / Math.cos(Math.toRadians(extent.midLat())));
        return 1.0 / rawScale;
    }

    /**
     * {@code max(1, round(width * scale))}, rounding half to even.
     */
    public static int correctedWidth(int width, double scale) {
        double target = Math.rint(width * scale);
        if (Double.isNaN(target) || target < 1.0) {
            return 1;
        }
        if (target > Integer.MAX_VALUE) {
            throw new IllegalStateException("Corrected width overflows: " + width + " * " + scale);
        }
        return (int) target;
    }

    /**
     * Piecewise-linear resample of every row from {@code width} evenly spaced positions in
     * [0, 1] to {@code newWidth} evenly spaced positions in [0, 1], endpoints included.
     * Returns a copy when the width is unchanged.
     */
    public static Mosaic resampleWidth(Mosaic source, int newWidth) {
        if (newWidth <= 0) {
            throw new IllegalArgumentException("newWidth must be positive, got: " + newWidth);
        }
        int width = source.width();
        if (newWidth == width) {
            return source.copy();
        }

        Mosaic target = Mosaic.filled(source.height(), newWidth, 0.0f);
        float[] in = new float[width];
        float[] out = new float[newWidth];

        // Source index and weight per target column are the same for every row
        int[] left = new int[newWidth];
        double[] frac = new double[newWidth];
        for (int j = 0; j < newWidth; j++) {
            double pos = newWidth == 1 ? 0.0 : (double) j * (width - 1) / (newWidth - 1);
            int i0 = (int) Math.floor(pos);
            if (i0 >= width - 1) {
                i0 = Math.max(0, width - 2);
            }
            left[j] = i0;
            frac[j] = width == 1 ? 0.0 : pos - i0;
        }

        for (int r = 0; r < source.height(); r++) {
            source.copyRow(r, in);
            for (int j = 0; j < newWidth; j++) {
                if (width == 1) {
                    out[j] = in[0];
                    continue;
                }
                int i0 = left[j];
                double t = frac[j];
                out[j] = (float) (in[i0] + (in[i0 + 1] - (double) in[i0]) * t);
            }
            target.setRow(r, out);
        }
        return target;
    }
}
