package com.largomodo.demstitch.service;

import com.largomodo.demstitch.core.domain.Mosaic;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Encodes a raster to a file.
 * <p>
 * Callers write into a scratch location and promote the file afterwards, so implementations
 * may leave a partial file behind on failure.
 */
public interface RasterWriter {

    /**
     * File extension (without dot) the format is conventionally stored under.
     */
    String extension();

    /**
     * Write {@code raster} to {@code target}, replacing any existing file.
     *
     * @throws IOException if encoding or writing fails
     */
    void write(Mosaic raster, Path target) throws IOException;
}
