package com.largomodo.demstitch;

import com.largomodo.demstitch.core.IngestionObserver;
import com.largomodo.demstitch.core.MosaicPipeline;
import com.largomodo.demstitch.core.NoValidTilesException;
import com.largomodo.demstitch.core.StitchConfig;
import com.largomodo.demstitch.core.StitchReport;
import com.largomodo.demstitch.core.domain.TileShape;
import com.largomodo.demstitch.service.RasterWriter;
import com.largomodo.demstitch.service.TileDecoder;
import com.largomodo.demstitch.service.archive.TileSourceCollector;
import com.largomodo.demstitch.service.gml.GmlTileDecoder;
import com.largomodo.demstitch.service.raster.ExrRasterWriter;
import com.largomodo.demstitch.service.raster.MaskPngWriter;
import com.largomodo.demstitch.service.raster.NpyRasterWriter;
import com.largomodo.demstitch.service.raster.SummaryWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * CLI entry point for stitching GSI elevation tiles into one raster.
 * <p>
 * Uses Picocli for argument parsing with automatic help generation and type-safe
 * validation. Accepts any mix of directories, {@code .zip} archives and single tile files.
 * <p>
 * Smart defaults:
 * - Output directory: the first input if it is a directory, its parent otherwise
 * - Base name: {@code stitch_yyyyMMdd_HHmm} at start time
 * - Explicit -o / -n flags override both
 */
@Command(
        name = "demstitch",
        mixinStandardHelpOptions = true,
        resourceBundle = "demstitch.demstitch",
        version = "${bundle:application.version}",
        header = "Stitches GSI elevation tiles into one float raster.",
        description = {
                "Decodes GSI Fundamental Geospatial Data DEM tiles (GML), clusters them into a grid by" +
                        " their corner coordinates and assembles one canvas.",
                "",
                "Small holes are filled by random neighbour sampling, the west-east stretch of the" +
                        " latitude/longitude grid is corrected, and the result is written as a single-channel" +
                        " float32 OpenEXR image plus a key:value summary."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion (some tiles may have been skipped)",
                "1:General execution error (I/O)",
                "2:Invalid command line arguments",
                "3:No usable tiles (none found, decoded or placed)"
        },
        footerHeading = "%nSee Also:%n",
        footer = {
                "GSI Fundamental Geospatial Data download service: https://fgd.gsi.go.jp/download/"
        }
)
public class DemStitch implements Callable<Integer> {

    static final int EXIT_NO_VALID_TILES = 3;

    private static final Logger log = LoggerFactory.getLogger(DemStitch.class);
    private static final DateTimeFormatter DEFAULT_NAME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmm");

    @Parameters(index = "0..*", arity = "1..*", paramLabel = "INPUT",
            description = {
                    "Tile sources: directories (scanned recursively), .zip archives (nested archives",
                    "are expanded) or single DEM .xml files."
            })
    List<File> inputs;

    @Option(names = {"-o", "--output-dir"},
            description = {
                    "The destination directory for the raster and summary.",
                    "Defaults to the first input if it is a directory, otherwise to its parent."
            })
    File outputDir;

    @Option(names = {"-n", "--name"},
            description = "Base file name of the outputs. Default: stitch_yyyyMMdd_HHmm")
    String baseName;

    @Option(names = "--round", defaultValue = "" + StitchConfig.DEFAULT_ROUNDING_DECIMALS,
            description = "Decimals used to cluster tile corners into bands. Default: ${DEFAULT-VALUE}")
    int roundingDecimals;

    @Option(names = "--missing-threshold", defaultValue = "" + StitchConfig.DEFAULT_MISSING_THRESHOLD,
            description = "Samples at or below this value are missing. Default: ${DEFAULT-VALUE}")
    double missingThreshold;

    @Option(names = "--interp-cap", defaultValue = "" + StitchConfig.DEFAULT_INTERP_CAP_PIXELS,
            description = "Skip hole filling when more pixels are missing. Default: ${DEFAULT-VALUE}")
    int interpCap;

    @Option(names = "--interp-radius", defaultValue = "" + StitchConfig.DEFAULT_INTERP_RADIUS,
            description = "Neighbour probe radius in pixels. Default: ${DEFAULT-VALUE}")
    int interpRadius;

    @Option(names = "--interp-probes", defaultValue = "" + StitchConfig.DEFAULT_INTERP_MAX_PROBES,
            description = "Random probes per hole and pass. Default: ${DEFAULT-VALUE}")
    int interpProbes;

    @Option(names = "--interp-passes", defaultValue = "" + StitchConfig.DEFAULT_INTERP_MAX_PASSES,
            description = "Maximum hole-filling passes. Default: ${DEFAULT-VALUE}")
    int interpPasses;

    @Option(names = "--seed",
            description = "Random seed for hole filling. A fresh seed is drawn and reported when omitted.")
    Long seed;

    @Option(names = "--threads",
            description = "Decode worker threads. Default: number of available processors")
    Integer threads;

    @Option(names = "--tile-size", paramLabel = "ROWSxCOLS", converter = TileShapeConverter.class,
            description = "Expected tile grid size. Auto-detected from the first decodable tile when omitted.")
    TileShape tileSize;

    @Option(names = "--mixed-sizes",
            description = "Accept tiles of differing sizes (bands take the size of their largest tile).")
    boolean mixedSizes;

    @Option(names = "--flip-y", description = "Reverse the row order of every decoded tile.")
    boolean flipY;

    @Option(names = "--no-interpolation", description = "Leave holes unfilled.")
    boolean noInterpolation;

    @Option(names = "--no-aspect-correction", description = "Keep the assembled width.")
    boolean noAspectCorrection;

    @Option(names = "--npy", description = "Also write the raster as a NumPy .npy array.")
    boolean writeNpy;

    @Option(names = "--mask", description = "Also write the validity mask as a grayscale PNG.")
    boolean writeMask;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        CommandLine cmd = new CommandLine(new DemStitch());
        int exitCode = cmd.execute(args);
        System.exit(exitCode);
    }

    /**
     * Wires the production collaborators for the given settings.
     */
    static MosaicPipeline createPipeline(StitchConfig config, boolean npy, boolean mask) {
        TileDecoder decoder = new GmlTileDecoder(config.missingThreshold(), config.flipVertical());
        List<RasterWriter> writers = new ArrayList<>();
        writers.add(new ExrRasterWriter());
        if (npy) {
            writers.add(new NpyRasterWriter());
        }
        return new MosaicPipeline(config, new TileSourceCollector(), decoder, writers,
                mask ? new MaskPngWriter() : null, new SummaryWriter());
    }

    StitchConfig buildConfig() {
        StitchConfig.Builder builder = StitchConfig.builder()
                .roundingDecimals(roundingDecimals)
                .missingThreshold(missingThreshold)
                .interpCapPixels(interpCap)
                .interpRadius(interpRadius)
                .interpMaxProbes(interpProbes)
                .interpMaxPasses(interpPasses)
                .seed(seed)
                .standardTileShape(tileSize)
                .enforceTileShape(!mixedSizes)
                .flipVertical(flipY)
                .interpolate(!noInterpolation)
                .aspectCorrection(!noAspectCorrection);
        if (threads != null) {
            builder.ingestThreads(threads);
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        for (File input : inputs) {
            if (!input.exists()) {
                throw new ParameterException(spec.commandLine(),
                        "Input path does not exist: " + input.getAbsolutePath());
            }
            if (!input.canRead()) {
                throw new ParameterException(spec.commandLine(),
                        "Input path is not readable (check permissions): " + input.getAbsolutePath());
            }
        }

        if (outputDir == null) {
            File first = inputs.get(0).getAbsoluteFile();
            outputDir = first.isDirectory() ? first : first.getParentFile();
        }
        if (outputDir.exists() && !outputDir.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Output path must be a directory, not a file: " + outputDir.getAbsolutePath());
        }
        if (outputDir.exists() && !outputDir.canWrite()) {
            throw new ParameterException(spec.commandLine(),
                    "Output directory is not writable (check permissions): " + outputDir.getAbsolutePath());
        }
        if (baseName == null || baseName.isBlank()) {
            baseName = "stitch_" + LocalDateTime.now().format(DEFAULT_NAME_FORMAT);
        }

        StitchConfig config = buildConfig();
        Files.createDirectories(outputDir.toPath());

        AtomicInteger failed = new AtomicInteger();
        IngestionObserver observer = new IngestionObserver() {
            @Override
            public void onFailure(Path tile, Exception e) {
                failed.incrementAndGet();
            }
        };

        List<Path> inputPaths = inputs.stream().map(File::toPath).toList();
        MosaicPipeline pipeline = createPipeline(config, writeNpy, writeMask);
        try {
            StitchReport report = pipeline.run(inputPaths, outputDir.toPath(), baseName, observer);
            log.info("Stitch complete: {} tiles placed, {} failed, raster {}x{} (seed {})",
                    report.placed(), failed.get(), report.height(), report.finalWidth(), report.seed());
            for (Path output : report.outputs()) {
                log.info("Wrote {}", output);
            }
            return 0;
        } catch (NoValidTilesException e) {
            log.error("ERROR: {}", e.getMessage());
            return EXIT_NO_VALID_TILES;
        }
    }

    /**
     * Parses {@code --tile-size ROWSxCOLS}.
     */
    static class TileShapeConverter implements ITypeConverter<TileShape> {
        @Override
        public TileShape convert(String value) {
            try {
                return TileShape.parse(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
