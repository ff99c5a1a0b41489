package com.largomodo.demstitch.core.domain;

/**
 * Output of mosaic assembly.
 *
 * @param mosaic  Assembled canvas, sentinel where no tile contributed a sample
 * @param mask    Validity mask snapshotted right after placement, before any hole filling
 * @param index   Bands the canvas was laid out from
 * @param placed  Tiles written into the canvas
 * @param skipped Tiles rejected because their shape did not match their band
 */
public record AssemblyResult(Mosaic mosaic, Mosaic mask, BandIndex index, int placed, int skipped) {
}
