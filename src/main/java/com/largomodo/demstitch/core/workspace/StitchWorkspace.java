package com.largomodo.demstitch.core.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Scoped scratch directory for one stitching run.
 * <p>
 * Created before any ingestion task is scheduled; holds extracted archive entries and
 * output files until they are promoted. AutoCloseable so try-with-resources removes the
 * whole tree on every exit path (success, partial failure, fatal abort).
 * <p>
 * Thread interruption: the interrupt flag is cleared while the tree is deleted and restored
 * afterwards, so an interrupted run still leaves no scratch files behind.
 */
public class StitchWorkspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StitchWorkspace.class);

    private final Path workDir;
    private int nextChild;

    private StitchWorkspace(Path workDir) {
        this.workDir = workDir;
    }

    /**
     * Creates a fresh workspace under the system temp directory.
     */
    public static StitchWorkspace create() throws IOException {
        return new StitchWorkspace(Files.createTempDirectory("demstitch-"));
    }

    /**
     * Creates a fresh workspace under {@code parent}.
     */
    public static StitchWorkspace createIn(Path parent) throws IOException {
        Files.createDirectories(parent);
        return new StitchWorkspace(Files.createTempDirectory(parent, "demstitch-"));
    }

    public Path getWorkDir() {
        return workDir;
    }

    /**
     * Creates a new, uniquely named subdirectory. The counter prefix keeps inputs with equal
     * names apart.
     *
     * @param name readable name component (e.g. an archive's base name)
     */
    public synchronized Path newDirectory(String name) throws IOException {
        String safe = name.replaceAll("[^A-Za-z0-9._-]", "_");
        Path dir = workDir.resolve(String.format("%03d_%s", nextChild++, safe));
        return Files.createDirectories(dir);
    }

    /**
     * Move a finished artifact from the workspace into {@code finalDestinationDir}.
     * <p>
     * Atomic move preferred so no half-written output is ever visible; falls back to
     * copy + delete when the target is on another filesystem.
     *
     * @param sourceArtifact      file inside the workspace
     * @param finalDestinationDir target directory (file keeps its name)
     * @return path of the promoted file
     * @throws IOException if move/copy operations fail
     */
    public Path promoteToFinal(Path sourceArtifact, Path finalDestinationDir) throws IOException {
        Path targetPath = finalDestinationDir.resolve(sourceArtifact.getFileName());

        if (Files.exists(targetPath)) {
            log.warn("Overwriting existing file: {}", targetPath);
        }

        try {
            Files.move(sourceArtifact, targetPath,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.copy(sourceArtifact, targetPath, StandardCopyOption.REPLACE_EXISTING);
            try {
                Files.delete(sourceArtifact);
            } catch (IOException deleteEx) {
                IOException compositeEx = new IOException(
                        "Atomic move unsupported and cleanup failed for: " + sourceArtifact, e);
                compositeEx.addSuppressed(deleteEx);
                throw compositeEx;
            }
        }
        return targetPath;
    }

    /**
     * Deletes the workspace tree, deepest entries first. Runs even when the calling thread
     * has been interrupted; the interrupt status is preserved.
     *
     * @throws CleanupException if any entry could not be deleted
     */
    @Override
    public void close() throws CleanupException {
        boolean interrupted = Thread.interrupted();
        try {
            deleteTree();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void deleteTree() {
        if (!Files.exists(workDir)) {
            return;
        }

        List<IOException> failures = new ArrayList<>();
        try (Stream<Path> stream = Files.walk(workDir)) {
            stream.sorted(Comparator.reverseOrder())
                    .forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException e) {
                            failures.add(e);
                            log.warn("Cleanup failed for artifact: {}", path, e);
                        }
                    });
        } catch (UncheckedIOException e) {
            // Directory listing failed mid-walk
            failures.add(e.getCause());
        } catch (IOException e) {
            failures.add(e);
        }

        if (!failures.isEmpty()) {
            throw new CleanupException(workDir, failures);
        }
        log.debug("Removed workspace {}", workDir);
    }
}
