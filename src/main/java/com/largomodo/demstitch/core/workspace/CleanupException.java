package com.largomodo.demstitch.core.workspace;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * A stitching workspace could not be removed completely.
 * <p>
 * Carries the workspace root so the leftover scratch tree can be located, and every
 * deletion failure as a suppressed exception.
 */
public class CleanupException extends RuntimeException {

    private final Path workDir;

    /**
     * @param workDir  root of the workspace being removed
     * @param failures deletion failures, in the order they occurred (must not be empty)
     */
    public CleanupException(Path workDir, List<IOException> failures) {
        super("Workspace cleanup encountered " + failures.size() + " failure(s) in: " + workDir);
        this.workDir = workDir;
        failures.forEach(this::addSuppressed);
    }

    public Path getWorkDir() {
        return workDir;
    }

    public int getFailureCount() {
        return getSuppressed().length;
    }
}
