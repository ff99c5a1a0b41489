package com.largomodo.demstitch.core;

import com.largomodo.demstitch.core.domain.TileRecord;
import com.largomodo.demstitch.core.domain.TileShape;
import com.largomodo.demstitch.service.TileDecodeException;

import java.util.List;
import java.util.Map;

/**
 * Tiles accepted by ingestion plus per-kind failure counts.
 *
 * @param accepted      Decoded tiles in discovery order (unmodifiable, never empty)
 * @param sourceCount   Tile sources handed to ingestion
 * @param failures      Failure count per decode failure kind (kinds with no failure are absent)
 * @param standardShape Shape enforced during decoding, or null if shapes were not checked
 */
public record IngestionResult(List<TileRecord> accepted, int sourceCount,
                              Map<TileDecodeException.Kind, Integer> failures, TileShape standardShape) {

    public IngestionResult {
        accepted = List.copyOf(accepted);
        failures = Map.copyOf(failures);
    }

    public int failedCount() {
        return failures.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int failures(TileDecodeException.Kind kind) {
        return failures.getOrDefault(kind, 0);
    }
}
