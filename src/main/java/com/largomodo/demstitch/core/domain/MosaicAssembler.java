package com.largomodo.demstitch.core.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Places tiles into a single canvas sized from their bands.
 * <p>
 * Canvas height is the sum of row band heights and width the sum of column band widths.
 * Each tile lands at the cumulative offset of the bands before it. A tile whose shape
 * differs from its band's size is skipped whole, because a partial write would spill into
 * the padding of its neighbours.
 * <p>
 * Duplicate tiles (same band pair) are resolved last-write-wins in iteration order; callers
 * wanting reproducible results pass tiles in a stable order.
 */
public class MosaicAssembler {

    private static final Logger log = LoggerFactory.getLogger(MosaicAssembler.class);

    /**
     * Assembles the given tiles into a new canvas.
     *
     * @param index band layout built from (at least) these tiles
     * @param tiles tiles in placement order
     * @return canvas, validity mask and placement counts
     */
    public AssemblyResult assemble(BandIndex index, List<TileRecord> tiles) {
        if (index == null || tiles == null) {
            throw new IllegalArgumentException("Band index and tiles must not be null");
        }

        int height = index.height();
        int width = index.width();
        log.info("Tiling grid (Tx,Ty) = ({},{}) -> output shape = ({}, {})",
                index.colBands().size(), index.rowBands().size(), height, width);

        Mosaic canvas = Mosaic.filled(height, width, TileRecord.SENTINEL);

        int placed = 0;
        int skipped = 0;
        for (TileRecord tile : tiles) {
            BandPosition position = index.locate(tile);
            Band rowBand = index.rowBand(position.row());
            Band colBand = index.colBand(position.col());

            if (tile.rows() != rowBand.size() || tile.cols() != colBand.size()) {
                log.warn("Skip irregular tile size: {} ({}x{}, band expects {}x{})",
                        tile.displayName(), tile.rows(), tile.cols(), rowBand.size(), colBand.size());
                skipped++;
                continue;
            }

            canvas.paste(tile.samples(), tile.rows(), tile.cols(), rowBand.offset(), colBand.offset());
            placed++;
        }

        log.info("Placed tiles: {}/{}", placed, tiles.size());

        // Snapshot before interpolation: this is the only record of which pixels are real
        Mosaic mask = canvas.validityMask(TileRecord.SENTINEL);
        return new AssemblyResult(canvas, mask, index, placed, skipped);
    }
}
