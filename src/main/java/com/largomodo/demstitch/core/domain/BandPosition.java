package com.largomodo.demstitch.core.domain;

/**
 * Grid cell of a tile: row band index (0 = northernmost) and column band index (0 = westernmost).
 */
public record BandPosition(int row, int col) {
}
