package com.largomodo.demstitch.core.domain;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sample-grid dimensions of a tile ({@code rows x cols}).
 *
 * @param rows Sample rows (must be > 0)
 * @param cols Sample columns (must be > 0)
 */
public record TileShape(int rows, int cols) {

    private static final Pattern TEXT_FORM = Pattern.compile("^\\s*(\\d+)\\s*[xX]\\s*(\\d+)\\s*$");

    public TileShape {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Tile shape must be positive, got " + rows + "x" + cols);
        }
    }

    /**
     * Parses the {@code ROWSxCOLS} form used on the command line, e.g. {@code 150x225}.
     *
     * @throws IllegalArgumentException if the text is not in that form
     */
    public static TileShape parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Tile shape must not be null");
        }
        Matcher m = TEXT_FORM.matcher(text);
        if (!m.matches()) {
            throw new IllegalArgumentException("Tile shape must look like ROWSxCOLS, got: " + text);
        }
        return new TileShape(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }

    @Override
    public String toString() {
        return rows + "x" + cols;
    }
}
