package com.largomodo.demstitch;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.read.ListAppender;
import com.largomodo.demstitch.generators.GmlTileFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for logging infrastructure integration.
 * <p>
 * Verifies:
 * - Verbose flag enables DEBUG level logging
 * - MDC context carries the tile file name into skip warnings
 * - Fatal runs log a single ERROR naming the reason
 */
class DemStitchLoggingTest {

    private static final String BROKEN_TILE = "FG-GML-5339-45-99-DEM5A-20161001.xml";

    @TempDir
    Path tempDir;

    private ListAppender<ILoggingEvent> listAppender;
    private FileAppender<ILoggingEvent> testFileAppender;
    private Logger rootLogger;
    private Level originalLevel;
    private Path testLogFile;

    @BeforeEach
    void setUp() {
        LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLogger = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);
        originalLevel = rootLogger.getLevel();

        testLogFile = tempDir.resolve("test-mdc.log");

        // Same pattern as logback.xml so the MDC slot is rendered
        testFileAppender = new FileAppender<>();
        testFileAppender.setContext(loggerContext);
        testFileAppender.setFile(testLogFile.toString());

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(loggerContext);
        encoder.setPattern("%d{HH:mm:ss.SSS} [%thread] [%X{tile}] %-5level %logger{36} - %msg%n");
        encoder.start();

        testFileAppender.setEncoder(encoder);
        testFileAppender.start();

        listAppender = new ListAppender<>();
        listAppender.setContext(loggerContext);
        listAppender.start();

        rootLogger.addAppender(listAppender);
        rootLogger.addAppender(testFileAppender);
        rootLogger.setLevel(Level.INFO);
    }

    @AfterEach
    void tearDown() {
        if (listAppender != null) {
            listAppender.stop();
            rootLogger.detachAppender(listAppender);
        }
        if (testFileAppender != null) {
            testFileAppender.stop();
            rootLogger.detachAppender(testFileAppender);
        }
        rootLogger.setLevel(originalLevel);
    }

    @Test
    void testVerboseFlagEnablesDebug() {
        DemStitch demStitch = new DemStitch();
        CommandLine cmd = new CommandLine(demStitch);
        cmd.parseArgs("-v", tempDir.resolve("absent").toString());

        assertEquals(Level.INFO, rootLogger.getLevel());

        // Fails on the missing input, after the level has been switched
        assertThrows(CommandLine.ParameterException.class, demStitch::call);

        assertEquals(Level.DEBUG, rootLogger.getLevel(),
                "Verbose flag should set root logger to DEBUG level");
    }

    @Test
    void testMdcContextOnSkippedTile() throws IOException {
        Path inputDir = tempDir.resolve("input");
        GmlTileFactory.writeGrid(inputDir, 1, 2, 4, 4);
        GmlTileFactory.write(inputDir.resolve(BROKEN_TILE), "<DEM not closed");

        int exitCode = new CommandLine(new DemStitch()).execute(
                inputDir.toString(), "--output-dir", tempDir.resolve("output").toString(), "--threads", "2");

        assertEquals(0, exitCode);

        testFileAppender.stop();
        String logContent = Files.readString(testLogFile);

        assertTrue(logContent.contains("[" + BROKEN_TILE + "] WARN"),
                "Skip warning should carry the tile MDC context. Log content:\n" + logContent);
        assertTrue(logContent.contains("Skip " + BROKEN_TILE),
                "Log should name the skipped tile. Log content:\n" + logContent);
    }

    @Test
    void testNoTilesLogsSingleError() throws IOException {
        Path inputDir = Files.createDirectories(tempDir.resolve("empty"));

        int exitCode = new CommandLine(new DemStitch()).execute(
                inputDir.toString(), "--output-dir", tempDir.resolve("output").toString());

        assertEquals(DemStitch.EXIT_NO_VALID_TILES, exitCode);

        List<ILoggingEvent> errorEvents = listAppender.list.stream()
                .filter(event -> event.getLevel() == Level.ERROR)
                .toList();

        assertEquals(1, errorEvents.size(), "Fatal run should log exactly one ERROR");
        assertTrue(errorEvents.get(0).getFormattedMessage().contains("No tiles found"),
                "ERROR should name the reason, got: " + errorEvents.get(0).getFormattedMessage());
    }
}
