package com.largomodo.demstitch.core.domain;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.largomodo.demstitch.generators.TileRecordFactory;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for canvas assembly.
 * <p>
 * Verifies:
 * - Each tile lands at the cumulative offset of its bands
 * - Heterogeneous band sizes are respected
 * - Irregular tiles are skipped whole and logged
 * - Duplicates resolve last-write-wins, assembly is idempotent
 * - The validity mask reflects placement only
 */
class MosaicAssemblerTest {

    private final BandIndexer indexer = new BandIndexer(10);
    private final MosaicAssembler assembler = new MosaicAssembler();

    @Test
    void testThreeBySixGridPlacesEveryTileAtItsOffset() {
        List<TileRecord> tiles = TileRecordFactory.grid(3, 6, 150, 225);

        AssemblyResult result = assembler.assemble(indexer.index(tiles), tiles);

        Mosaic mosaic = result.mosaic();
        assertEquals(450, mosaic.height());
        assertEquals(1350, mosaic.width());
        assertEquals(18, result.placed());
        assertEquals(0, result.skipped());
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 6; c++) {
                float expected = 1.0f + r * 6 + c;
                assertEquals(expected, mosaic.get(r * 150, c * 225), "Top-left of tile " + r + "," + c);
                assertEquals(expected, mosaic.get(r * 150 + 149, c * 225 + 224), "Bottom-right of tile " + r + "," + c);
            }
        }
        assertEquals(0, result.mask().count(0.0f), "All pixels are real samples");
    }

    @Test
    void testHeterogeneousBandSizes() {
        int[] rowSizes = {3, 2};
        int[] colSizes = {4, 5, 1};
        List<TileRecord> tiles = new ArrayList<>();
        for (int r = 0; r < rowSizes.length; r++) {
            for (int c = 0; c < colSizes.length; c++) {
                tiles.add(TileRecordFactory.cell(r, c, rowSizes[r], colSizes[c], 10.0f * r + c + 1, tiles.size()));
            }
        }

        AssemblyResult result = assembler.assemble(indexer.index(tiles), tiles);

        assertEquals(5, result.mosaic().height());
        assertEquals(10, result.mosaic().width());
        assertEquals(6, result.placed());
        assertEquals(3.0f, result.mosaic().get(2, 9), "Row band 0, column band 2");
        assertEquals(12.0f, result.mosaic().get(3, 4), "Row band 1, column band 1 starts at (3, 4)");
    }

    @Test
    void testIrregularTileIsSkippedAndLeavesSentinel() {
        Logger logger = (Logger) LoggerFactory.getLogger(MosaicAssembler.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            TileRecord regular = TileRecordFactory.cell(0, 0, 3, 4, 5.0f, 0);
            TileRecord shortTile = TileRecordFactory.cell(0, 1, 2, 4, 7.0f, 1);
            List<TileRecord> tiles = List.of(regular, shortTile);

            AssemblyResult result = assembler.assemble(indexer.index(tiles), tiles);

            assertEquals(1, result.placed());
            assertEquals(1, result.skipped());
            assertEquals(3, result.mosaic().height());
            assertEquals(8, result.mosaic().width());
            for (int r = 0; r < 3; r++) {
                for (int c = 4; c < 8; c++) {
                    assertEquals(TileRecord.SENTINEL, result.mosaic().get(r, c), "Skipped tile must not be partially written");
                    assertEquals(0.0f, result.mask().get(r, c));
                }
            }
            assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.WARN
                            && e.getFormattedMessage().startsWith("Skip irregular tile size")),
                    "Irregular tile should be logged at WARN");
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void testDuplicateTilesLastWriteWins() {
        TileRecord first = TileRecordFactory.cell(0, 0, 2, 2, 1.0f, 0);
        TileRecord second = TileRecordFactory.cell(0, 0, 2, 2, 2.0f, 1);
        List<TileRecord> tiles = List.of(first, second);

        AssemblyResult result = assembler.assemble(indexer.index(tiles), tiles);

        assertEquals(2, result.placed());
        assertEquals(2.0f, result.mosaic().get(1, 1), "Later tile overwrites the earlier one");
    }

    @Test
    void testMaskMarksSentinelSamplesInsideTiles() {
        float[] samples = {1.0f, TileRecord.SENTINEL, 3.0f, 4.0f};
        TileRecord tile = TileRecordFactory.cell(0, 0, 2, 2, samples, 0);

        AssemblyResult result = assembler.assemble(indexer.index(List.of(tile)), List.of(tile));

        assertEquals(1.0f, result.mask().get(0, 0));
        assertEquals(0.0f, result.mask().get(0, 1), "A missing sample is not valid even inside a placed tile");
        assertEquals(1, result.mask().count(0.0f));
    }

    @Test
    void testMissingGridCellStaysSentinel() {
        List<TileRecord> tiles = new ArrayList<>(TileRecordFactory.grid(2, 2, 2, 2));
        tiles.remove(3);

        AssemblyResult result = assembler.assemble(indexer.index(tiles), tiles);

        assertEquals(4, result.mosaic().height());
        assertEquals(4, result.mosaic().width());
        assertEquals(4, result.mask().count(0.0f), "The absent tile's 2x2 block is background");
        assertEquals(TileRecord.SENTINEL, result.mosaic().get(3, 3));
    }

    @Test
    void testAssemblyIsIdempotent() {
        List<TileRecord> tiles = TileRecordFactory.grid(2, 3, 4, 5);
        BandIndex index = indexer.index(tiles);

        AssemblyResult first = assembler.assemble(index, tiles);
        AssemblyResult second = assembler.assemble(index, tiles);

        assertTrue(first.mosaic().contentEquals(second.mosaic()));
        assertTrue(first.mask().contentEquals(second.mask()));
    }

    @Property
    void testCanvasSizeMatchesBandSums(@ForAll @IntRange(min = 1, max = 5) int gridRows,
                                       @ForAll @IntRange(min = 1, max = 5) int gridCols,
                                       @ForAll @IntRange(min = 1, max = 6) int rows,
                                       @ForAll @IntRange(min = 1, max = 6) int cols,
                                       @ForAll long shuffleSeed) {
        List<TileRecord> tiles = new ArrayList<>(TileRecordFactory.grid(gridRows, gridCols, rows, cols));
        Collections.shuffle(tiles, new Random(shuffleSeed));

        AssemblyResult result = new MosaicAssembler().assemble(new BandIndexer(10).index(tiles), tiles);

        assertEquals(gridRows * rows, result.mosaic().height());
        assertEquals(gridCols * cols, result.mosaic().width());
        assertEquals(tiles.size(), result.placed());
        assertEquals(0, result.mask().count(0.0f));
    }
}
