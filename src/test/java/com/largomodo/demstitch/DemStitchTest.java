package com.largomodo.demstitch;

import com.largomodo.demstitch.core.StitchConfig;
import com.largomodo.demstitch.core.domain.TileShape;
import com.largomodo.demstitch.generators.GmlTileFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import picocli.CommandLine;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for DemStitch CLI argument parsing with Picocli.
 * <p>
 * Focus: positional inputs, option mapping onto StitchConfig, smart output defaults, validation.
 * Tests use CommandLine.parseArgs() to populate DemStitch fields directly.
 */
class DemStitchTest {

    @TempDir
    Path tempDir;

    @Test
    void testMultiplePositionalInputs() throws IOException {
        Path dir = Files.createDirectory(tempDir.resolve("tiles"));
        Path zip = Files.createFile(tempDir.resolve("more.zip"));

        DemStitch app = new DemStitch();
        new CommandLine(app).parseArgs(dir.toString(), zip.toString());

        assertEquals(2, app.inputs.size());
        assertEquals(dir.toFile(), app.inputs.get(0));
        assertEquals(zip.toFile(), app.inputs.get(1));
    }

    @Test
    void testDefaultsMapToDefaultConfig() {
        DemStitch app = new DemStitch();
        new CommandLine(app).parseArgs(tempDir.toString());

        assertEquals(StitchConfig.defaults(), app.buildConfig());
    }

    @Test
    void testOptionsMapOntoConfig() {
        DemStitch app = new DemStitch();
        new CommandLine(app).parseArgs(tempDir.toString(),
                "--round", "6",
                "--missing-threshold", "-500",
                "--interp-cap", "1000",
                "--interp-radius", "3",
                "--interp-probes", "8",
                "--interp-passes", "2",
                "--seed", "1234",
                "--threads", "3",
                "--tile-size", "150x225",
                "--flip-y",
                "--no-interpolation",
                "--no-aspect-correction");

        StitchConfig config = app.buildConfig();

        assertEquals(6, config.roundingDecimals());
        assertEquals(-500.0, config.missingThreshold());
        assertEquals(1000, config.interpCapPixels());
        assertEquals(3, config.interpRadius());
        assertEquals(8, config.interpMaxProbes());
        assertEquals(2, config.interpMaxPasses());
        assertEquals(1234L, config.seed());
        assertEquals(3, config.ingestThreads());
        assertEquals(new TileShape(150, 225), config.standardTileShape());
        assertTrue(config.enforceTileShape());
        assertTrue(config.flipVertical());
        assertFalse(config.interpolate());
        assertFalse(config.aspectCorrection());
    }

    @Test
    void testMixedSizesDisablesShapeEnforcement() {
        DemStitch app = new DemStitch();
        new CommandLine(app).parseArgs(tempDir.toString(), "--mixed-sizes");

        assertFalse(app.buildConfig().enforceTileShape());
    }

    @Test
    void testExplicitOutputAndName() {
        Path out = tempDir.resolve("custom-output");

        DemStitch app = new DemStitch();
        new CommandLine(app).parseArgs(tempDir.toString(), "-o", out.toString(), "-n", "kanto");

        assertEquals(out.toFile(), app.outputDir);
        assertEquals("kanto", app.baseName);
    }

    @Test
    void testSmartDefaultsForDirectoryInput() throws Exception {
        Path in = tempDir.resolve("tiles");
        GmlTileFactory.writeGrid(in, 1, 2, 3, 4);

        DemStitch app = new DemStitch();
        int exitCode = new CommandLine(app).execute(in.toString(), "--seed", "1");

        assertEquals(0, exitCode);
        assertEquals(in.toFile().getCanonicalPath(), app.outputDir.getCanonicalPath(),
                "Directory input should default outputDir to the directory itself");
        assertTrue(app.baseName.matches("stitch_\\d{8}_\\d{4}"), "Default name is stitch_yyyyMMdd_HHmm");
        assertTrue(Files.exists(in.resolve(app.baseName + ".exr")));
    }

    @Test
    void testSmartDefaultOutputForFileInput() throws Exception {
        Path in = tempDir.resolve("tiles");
        GmlTileFactory.writeGrid(in, 1, 1, 3, 4);
        File tile = in.resolve(GmlTileFactory.fileName(0, 0)).toFile();

        DemStitch app = new DemStitch();
        int exitCode = new CommandLine(app).execute(tile.getPath(), "-n", "single");

        assertEquals(0, exitCode);
        assertEquals(in.toFile().getCanonicalPath(), app.outputDir.getCanonicalPath(),
                "File input should default outputDir to its parent");
    }

    @Test
    void testMissingInputIsUsageError() {
        int exitCode = new CommandLine(new DemStitch()).execute(tempDir.resolve("absent").toString());

        assertEquals(2, exitCode);
    }

    @Test
    void testNoInputIsUsageError() {
        assertEquals(2, new CommandLine(new DemStitch()).execute());
    }

    @Test
    void testOutputPathThatIsAFileIsUsageError() throws IOException {
        Path file = Files.createFile(tempDir.resolve("occupied"));

        int exitCode = new CommandLine(new DemStitch()).execute(tempDir.toString(), "-o", file.toString());

        assertEquals(2, exitCode);
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "150", "0x225", "150x"})
    void testMalformedTileSizeIsUsageError(String value) {
        int exitCode = new CommandLine(new DemStitch()).execute(tempDir.toString(), "--tile-size", value);

        assertEquals(2, exitCode);
    }

    @ParameterizedTest
    @ValueSource(strings = {"--threads=0", "--interp-radius=0", "--round=16", "--interp-cap=-1"})
    void testInvalidSettingIsUsageError(String option) {
        int exitCode = new CommandLine(new DemStitch()).execute(tempDir.toString(), option);

        assertEquals(2, exitCode);
    }

    @Test
    void testVersionComesFromBundle() {
        CommandLine cmd = new CommandLine(new DemStitch());

        String[] version = cmd.getCommandSpec().version();

        assertEquals(1, version.length);
        assertFalse(version[0].isBlank());
    }
}
