package com.largomodo.demstitch.core;

import com.largomodo.demstitch.core.domain.AspectCorrection;
import com.largomodo.demstitch.core.domain.AspectCorrector;
import com.largomodo.demstitch.core.domain.AssemblyResult;
import com.largomodo.demstitch.core.domain.BandIndex;
import com.largomodo.demstitch.core.domain.BandIndexer;
import com.largomodo.demstitch.core.domain.GeoExtent;
import com.largomodo.demstitch.core.domain.HoleInterpolator;
import com.largomodo.demstitch.core.domain.InterpolationResult;
import com.largomodo.demstitch.core.domain.Mosaic;
import com.largomodo.demstitch.core.domain.MosaicAssembler;
import com.largomodo.demstitch.core.domain.TileRecord;
import com.largomodo.demstitch.core.workspace.StitchWorkspace;
import com.largomodo.demstitch.service.RasterWriter;
import com.largomodo.demstitch.service.TileDecoder;
import com.largomodo.demstitch.service.archive.TileSourceCollector;
import com.largomodo.demstitch.service.raster.SummaryWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Tile-to-raster pipeline orchestrator.
 * <p>
 * Coordinates the run:
 * 1. Collect tile sources (directories, nested archives) into a scoped workspace
 * 2. Decode them concurrently, isolating per-tile failures
 * 3. Cluster tiles into bands and assemble the canvas (validity mask snapshotted here)
 * 4. Fill small holes
 * 5. Correct the west-east aspect of data and mask
 * 6. Encode every artifact inside the workspace, then promote them into the output directory
 * <p>
 * Outputs only appear once every stage succeeded; a fatal condition or a failed promotion
 * leaves no new artifact in the output directory. The workspace is removed on every exit path.
 */
public class MosaicPipeline {

    private static final Logger log = LoggerFactory.getLogger(MosaicPipeline.class);

    private final StitchConfig config;
    private final TileSourceCollector collector;
    private final TileDecoder decoder;
    private final List<RasterWriter> dataWriters;
    private final RasterWriter maskWriter;
    private final SummaryWriter summaryWriter;

    /**
     * @param config        run settings
     * @param collector     archive traversal
     * @param decoder       tile decoder shared by ingestion workers
     * @param dataWriters   encoders for the elevation raster (at least one)
     * @param maskWriter    encoder for the validity mask, or null to skip the mask artifact
     * @param summaryWriter run summary writer
     */
    public MosaicPipeline(StitchConfig config, TileSourceCollector collector, TileDecoder decoder,
                          List<RasterWriter> dataWriters, RasterWriter maskWriter, SummaryWriter summaryWriter) {
        if (config == null || collector == null || decoder == null || dataWriters == null || summaryWriter == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        if (dataWriters.isEmpty()) {
            throw new IllegalArgumentException("At least one raster writer is required");
        }
        this.config = config;
        this.collector = collector;
        this.decoder = decoder;
        this.dataWriters = List.copyOf(dataWriters);
        this.maskWriter = maskWriter;
        this.summaryWriter = summaryWriter;
    }

    public StitchReport run(List<Path> inputs, Path outputDir, String baseName)
            throws IOException, InterruptedException {
        return run(inputs, outputDir, baseName, null);
    }

    /**
     * Run the whole pipeline.
     *
     * @param inputs    directories, archives or tile files
     * @param outputDir directory receiving the artifacts (created if missing)
     * @param baseName  file name stem of the artifacts
     * @param observer  per-tile decode callbacks, may be null
     * @return audit record including the promoted output paths
     * @throws NoValidTilesException if no tile is found, decoded or placed
     * @throws IOException           if reading inputs or writing outputs fails
     * @throws InterruptedException  if interrupted while waiting for decode workers
     */
    public StitchReport run(List<Path> inputs, Path outputDir, String baseName, IngestionObserver observer)
            throws IOException, InterruptedException {
        if (inputs == null || inputs.isEmpty()) {
            throw new IllegalArgumentException("At least one input is required");
        }

        try (StitchWorkspace workspace = StitchWorkspace.create()) {
            List<Path> sources = collector.collect(inputs, workspace);
            if (sources.isEmpty()) {
                throw new NoValidTilesException(NoValidTilesException.Reason.NO_TILES_FOUND,
                        "no DEM XML in " + inputs);
            }

            IngestionCoordinator coordinator = new IngestionCoordinator(decoder, config.ingestThreads(),
                    config.standardTileShape(), config.enforceTileShape());
            IngestionResult ingestion = coordinator.ingest(sources, observer);

            // Stable order makes last-write-wins among duplicate tiles reproducible
            List<TileRecord> tiles = new ArrayList<>(ingestion.accepted());
            tiles.sort(Comparator.comparingInt(TileRecord::discoveryIndex));

            Path scratch = workspace.newDirectory("out");
            List<Path> artifacts = new ArrayList<>();
            StitchReport report = stitch(tiles, sources.size(), ingestion.failedCount(), scratch, baseName, artifacts);

            Files.createDirectories(outputDir);
            report = report.withOutputs(promoteAll(workspace, artifacts, outputDir));

            if (report.hasSkippedTiles()) {
                log.warn("Completed with skipped tiles: {} failed to decode, {} irregular, {}/{} placed",
                        report.decodeFailed(), report.skippedIrregular(), report.placed(), report.tilesFound());
            } else {
                log.info("Completed: {}/{} tiles placed", report.placed(), report.tilesFound());
            }
            return report;
        }
    }

    /**
     * Moves every artifact into {@code outputDir}. If one move fails, the artifacts already
     * moved are deleted again so a failed run leaves no partial set behind. A file that an
     * artifact replaced is not restored.
     */
    private static List<Path> promoteAll(StitchWorkspace workspace, List<Path> artifacts, Path outputDir)
            throws IOException {
        List<Path> promoted = new ArrayList<>(artifacts.size());
        try {
            for (Path artifact : artifacts) {
                promoted.add(workspace.promoteToFinal(artifact, outputDir));
            }
            return promoted;
        } catch (IOException e) {
            for (Path done : promoted) {
                try {
                    Files.deleteIfExists(done);
                } catch (IOException rollbackEx) {
                    e.addSuppressed(rollbackEx);
                }
            }
            log.error("Promotion into {} failed, removed {} promoted artifact(s)", outputDir, promoted.size());
            throw e;
        }
    }

    /**
     * Assemble, fill, correct and encode; artifacts are written into {@code scratch} and
     * appended to {@code artifacts}.
     */
    StitchReport stitch(List<TileRecord> tiles, int tilesFound, int decodeFailed,
                        Path scratch, String baseName, List<Path> artifacts) throws IOException {
        BandIndex index = new BandIndexer(config.roundingDecimals()).index(tiles);
        AssemblyResult assembly = new MosaicAssembler().assemble(index, tiles);
        if (assembly.placed() == 0) {
            throw new NoValidTilesException(NoValidTilesException.Reason.NO_TILES_PLACED,
                    "all " + tiles.size() + " decoded tiles were irregular");
        }

        Mosaic mosaic = assembly.mosaic();
        Mosaic mask = assembly.mask();

        long seed = config.seed() != null ? config.seed() : new Random().nextLong();
        InterpolationResult interpolation;
        if (config.interpolate()) {
            log.debug("Hole interpolation seed: {}", seed);
            HoleInterpolator interpolator = new HoleInterpolator(config.interpCapPixels(),
                    config.interpRadius(), config.interpMaxProbes(), config.interpMaxPasses());
            interpolation = interpolator.fill(mosaic, mask, new Random(seed));
        } else {
            interpolation = InterpolationResult.skipped(mask.count(0.0f));
        }

        double scale = 1.0;
        if (config.aspectCorrection()) {
            AspectCorrection correction = new AspectCorrector().correct(mosaic, mask, GeoExtent.union(tiles));
            mosaic = correction.mosaic();
            mask = correction.mask();
            scale = correction.appliedScale();
        }

        for (RasterWriter writer : dataWriters) {
            Path target = scratch.resolve(baseName + "." + writer.extension());
            writer.write(mosaic, target);
            artifacts.add(target);
        }
        if (maskWriter != null) {
            Path target = scratch.resolve(baseName + "_mask." + maskWriter.extension());
            maskWriter.write(mask, target);
            artifacts.add(target);
        }

        StitchReport report = new StitchReport(tilesFound, tiles.size(), decodeFailed,
                assembly.placed(), assembly.skipped(),
                index.rowBands().size(), index.colBands().size(), assembly.mosaic().height(), index.width(),
                interpolation.missingBefore(), interpolation.filled(), interpolation.passes(),
                interpolation.skipped(), seed, scale, mosaic.width(), List.of());

        Path summary = scratch.resolve(baseName + "_summary.txt");
        summaryWriter.write(report, summary);
        artifacts.add(summary);

        log.info("Final raster shape: ({}, {})", mosaic.height(), mosaic.width());
        return report;
    }
}
