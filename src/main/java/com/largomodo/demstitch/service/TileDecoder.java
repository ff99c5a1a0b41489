package com.largomodo.demstitch.service;

import com.largomodo.demstitch.core.domain.TileRecord;
import com.largomodo.demstitch.core.domain.TileShape;

import java.nio.file.Path;

/**
 * Decodes one tile source into a well-formed {@link TileRecord}.
 * <p>
 * Implementations are shared by all ingestion workers and must be safe for concurrent use.
 * On success the record's sample count always equals {@code rows * cols}; partial sources
 * are padded or truncated by the implementation.
 */
public interface TileDecoder {

    /**
     * Decode a tile.
     *
     * @param source         Tile file
     * @param discoveryIndex Position of the source in collection order
     * @param expected       Required grid shape, or null to accept any
     * @return the decoded tile
     * @throws TileDecodeException if the source is malformed, unreadable or the wrong size
     */
    TileRecord decode(Path source, int discoveryIndex, TileShape expected) throws TileDecodeException;
}
