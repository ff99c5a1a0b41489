package com.largomodo.demstitch.service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Typed per-tile decode failure. Never fatal to a run on its own.
 */
public class TileDecodeException extends IOException {

    public enum Kind {
        /** Markup could not be parsed or lacks a required element. */
        MALFORMED_SOURCE,
        /** Grid dimensions disagree with the run's standard tile shape. */
        SIZE_MISMATCH,
        /** The file could not be read. */
        UNREADABLE
    }

    private final Kind kind;
    private final Path source;

    public TileDecodeException(Kind kind, Path source, String message) {
        super(message);
        this.kind = kind;
        this.source = source;
    }

    public TileDecodeException(Kind kind, Path source, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.source = source;
    }

    public Kind getKind() {
        return kind;
    }

    public Path getSource() {
        return source;
    }
}
