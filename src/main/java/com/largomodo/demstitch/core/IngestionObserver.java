package com.largomodo.demstitch.core;

import com.largomodo.demstitch.core.domain.TileRecord;

import java.nio.file.Path;

/**
 * Observer for per-tile decode lifecycle events.
 * <p>
 * Callbacks run on ingestion worker threads (or on the submitting thread when the work
 * queue is full), so implementations must be thread-safe. All methods default to no-ops.
 *
 * @see IngestionCoordinator
 */
public interface IngestionObserver {

    /**
     * Called when decoding of a tile source begins.
     *
     * @param source the tile file being decoded
     */
    default void onStart(Path source) {}

    /**
     * Called when a tile decoded successfully.
     *
     * @param source the tile file
     * @param tile   the decoded record
     */
    default void onSuccess(Path source, TileRecord tile) {}

    /**
     * Called when a tile failed to decode and was excluded.
     *
     * @param source the tile file
     * @param e      the failure
     */
    default void onFailure(Path source, Exception e) {}
}
