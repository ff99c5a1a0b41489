package com.largomodo.demstitch.core;

import java.nio.file.Path;
import java.util.List;

/**
 * Audit record of one stitching run.
 *
 * @param tilesFound      Tile sources collected from the inputs
 * @param tilesDecoded    Tiles accepted by ingestion
 * @param decodeFailed    Sources that failed to decode (any kind)
 * @param placed          Tiles written into the mosaic
 * @param skippedIrregular Tiles dropped because their shape did not match their band
 * @param rowBands        Row band count (Ty)
 * @param colBands        Column band count (Tx)
 * @param height          Assembled height in pixels
 * @param width           Assembled width in pixels
 * @param missingBefore   Missing pixels before hole filling
 * @param filled          Pixels filled by hole filling
 * @param passes          Hole-filling passes executed
 * @param interpolationSkipped True when hole filling was disabled or over the cap
 * @param seed            Random seed used for hole filling
 * @param aspectScale     Applied width scale (1.0 when correction is disabled)
 * @param finalWidth      Width after aspect correction
 * @param outputs         Promoted output files
 */
public record StitchReport(int tilesFound, int tilesDecoded, int decodeFailed,
                           int placed, int skippedIrregular,
                           int rowBands, int colBands, int height, int width,
                           int missingBefore, int filled, int passes, boolean interpolationSkipped,
                           long seed, double aspectScale, int finalWidth,
                           List<Path> outputs) {

    public StitchReport {
        outputs = List.copyOf(outputs);
    }

    public int remainingHoles() {
        return missingBefore - filled;
    }

    /**
     * True when some tiles were dropped on the way (the run still produced output).
     */
    public boolean hasSkippedTiles() {
        return decodeFailed > 0 || skippedIrregular > 0;
    }

    public StitchReport withOutputs(List<Path> promoted) {
        return new StitchReport(tilesFound, tilesDecoded, decodeFailed, placed, skippedIrregular,
                rowBands, colBands, height, width, missingBefore, filled, passes, interpolationSkipped,
                seed, aspectScale, finalWidth, promoted);
    }
}
