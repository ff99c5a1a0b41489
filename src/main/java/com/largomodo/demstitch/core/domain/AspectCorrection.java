package com.largomodo.demstitch.core.domain;

/**
 * Horizontally resampled data and mask plus the scale that produced them.
 *
 * @param mosaic       Resampled elevation raster
 * @param mask         Validity mask resampled with the same width (fractional at edges)
 * @param appliedScale Width multiplier actually applied
 */
public record AspectCorrection(Mosaic mosaic, Mosaic mask, double appliedScale) {
}
