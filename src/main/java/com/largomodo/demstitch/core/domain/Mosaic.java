package com.largomodo.demstitch.core.domain;

import java.util.Arrays;

/**
 * Dense row-major float32 raster of {@code height x width} pixels.
 * <p>
 * Used both for elevation data and for the validity mask (1 = real sample, 0 = filled or
 * never covered), which keeps the two pixel-aligned through every resample.
 * Mutable: the assembler and the interpolator write into it in place. Not thread-safe.
 */
public final class Mosaic {

    private final int height;
    private final int width;
    private final float[] data;

    private Mosaic(int height, int width, float[] data) {
        this.height = height;
        this.width = width;
        this.data = data;
    }

    /**
     * Allocates a raster with every pixel set to {@code value}.
     *
     * @throws IllegalArgumentException if a dimension is not positive or the raster is too large
     */
    public static Mosaic filled(int height, int width, float value) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Mosaic dimensions must be positive, got " + height + "x" + width);
        }
        long pixels = (long) height * width;
        if (pixels > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Mosaic too large for a single array: " + height + "x" + width);
        }
        float[] data = new float[(int) pixels];
        if (value != 0.0f) {
            Arrays.fill(data, value);
        }
        return new Mosaic(height, width, data);
    }

    /**
     * Wraps a copy of the given row-major samples.
     */
    public static Mosaic of(int height, int width, float[] samples) {
        Mosaic mosaic = filled(height, width, 0.0f);
        if (samples.length != mosaic.data.length) {
            throw new IllegalArgumentException("Expected " + mosaic.data.length + " samples, got " + samples.length);
        }
        System.arraycopy(samples, 0, mosaic.data, 0, samples.length);
        return mosaic;
    }

    public int height() {
        return height;
    }

    public int width() {
        return width;
    }

    public int pixelCount() {
        return data.length;
    }

    public float get(int row, int col) {
        return data[row * width + col];
    }

    public void set(int row, int col, float value) {
        data[row * width + col] = value;
    }

    public boolean contains(int row, int col) {
        return row >= 0 && row < height && col >= 0 && col < width;
    }

    /**
     * Copies a row-major {@code sourceRows x sourceCols} block into this raster with its
     * top-left corner at the given pixel offset.
     */
    void paste(float[] source, int sourceRows, int sourceCols, int rowOffset, int colOffset) {
        if (rowOffset + sourceRows > height || colOffset + sourceCols > width) {
            throw new IllegalArgumentException("Block " + sourceRows + "x" + sourceCols + " at (" +
                    rowOffset + "," + colOffset + ") exceeds mosaic " + height + "x" + width);
        }
        for (int r = 0; r < sourceRows; r++) {
            System.arraycopy(source, r * sourceCols, data, (rowOffset + r) * width + colOffset, sourceCols);
        }
    }

    /**
     * Copies row {@code row} into {@code dest}, which must hold at least {@link #width()} values.
     */
    public void copyRow(int row, float[] dest) {
        System.arraycopy(data, row * width, dest, 0, width);
    }

    /**
     * Overwrites row {@code row} with the first {@link #width()} values of {@code source}.
     */
    public void setRow(int row, float[] source) {
        System.arraycopy(source, 0, data, row * width, width);
    }

    /**
     * Number of pixels exactly equal to {@code value}.
     */
    public int count(float value) {
        int n = 0;
        for (float v : data) {
            if (Float.compare(v, value) == 0) {
                n++;
            }
        }
        return n;
    }

    /**
     * 0/1 mask with 1 wherever this raster differs from {@code sentinel}.
     */
    public Mosaic validityMask(float sentinel) {
        float[] mask = new float[data.length];
        for (int i = 0; i < data.length; i++) {
            mask[i] = Float.compare(data[i], sentinel) == 0 ? 0.0f : 1.0f;
        }
        return new Mosaic(height, width, mask);
    }

    public Mosaic copy() {
        return new Mosaic(height, width, data.clone());
    }

    /**
     * Bitwise pixel equality (NaN equals NaN, -0.0 differs from 0.0).
     */
    public boolean contentEquals(Mosaic other) {
        if (other == null || other.height != height || other.width != width) {
            return false;
        }
        for (int i = 0; i < data.length; i++) {
            if (Float.floatToRawIntBits(data[i]) != Float.floatToRawIntBits(other.data[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "Mosaic[" + height + "x" + width + "]";
    }
}
