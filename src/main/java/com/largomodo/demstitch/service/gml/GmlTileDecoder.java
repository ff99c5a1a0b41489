package com.largomodo.demstitch.service.gml;

import com.largomodo.demstitch.core.domain.TileRecord;
import com.largomodo.demstitch.core.domain.TileShape;
import com.largomodo.demstitch.service.TileDecodeException;
import com.largomodo.demstitch.service.TileDecodeException.Kind;
import com.largomodo.demstitch.service.TileDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Set;

/**
 * Decoder for GSI Fundamental Geospatial Data DEM tiles (GML 3.2).
 * <p>
 * Reads, in one streaming pass:
 * <ul>
 *   <li>{@code gml:boundedBy/gml:Envelope} lower/upper corners, ordered "lat lon"</li>
 *   <li>{@code gml:GridEnvelope} low/high, ordered "x y" (cols = hx - lx + 1)</li>
 *   <li>optional {@code gml:startPoint} "x y": the first value's grid cell</li>
 *   <li>{@code gml:tupleList}: one {@code type,value} line per sample, x fastest</li>
 * </ul>
 * Missing tokens, unparsable values and values at or below the missing threshold become
 * {@link TileRecord#SENTINEL}. Short value lists (tiles that end in sea) are padded with the
 * sentinel and long ones truncated, so every decoded record is well-formed.
 * <p>
 * Stateless; a new StAX reader is created per call, so instances are safe for concurrent use.
 */
public class GmlTileDecoder implements TileDecoder {

    private static final Logger log = LoggerFactory.getLogger(GmlTileDecoder.class);

    private static final Set<String> MISSING_TOKENS = Set.of("", "-9999", "-9999.0", "-9999.00");

    private final double missingThreshold;
    private final boolean flipVertical;

    /**
     * @param missingThreshold values at or below this decode as missing
     * @param flipVertical     reverse row order (for sources scanned south to north)
     */
    public GmlTileDecoder(double missingThreshold, boolean flipVertical) {
        this.missingThreshold = missingThreshold;
        this.flipVertical = flipVertical;
    }

    @Override
    public TileRecord decode(Path source, int discoveryIndex, TileShape expected) throws TileDecodeException {
        ParsedTile parsed;
        try (InputStream in = Files.newInputStream(source)) {
            parsed = parse(in, source);
        } catch (XMLStreamException e) {
            throw new TileDecodeException(Kind.MALFORMED_SOURCE, source, "XML parse failed: " + e.getMessage(), e);
        } catch (TileDecodeException e) {
            throw e;
        } catch (IOException e) {
            throw new TileDecodeException(Kind.UNREADABLE, source, "Cannot read tile: " + e.getMessage(), e);
        }

        int cols = parsed.highX - parsed.lowX + 1;
        int rows = parsed.highY - parsed.lowY + 1;
        if (rows <= 0 || cols <= 0) {
            throw new TileDecodeException(Kind.MALFORMED_SOURCE, source,
                    "Invalid grid envelope: (" + rows + "," + cols + ")");
        }
        if (expected != null && (rows != expected.rows() || cols != expected.cols())) {
            throw new TileDecodeException(Kind.SIZE_MISMATCH, source,
                    "Grid size mismatch: (" + rows + "," + cols + "), expected (" +
                            expected.rows() + "," + expected.cols() + ")");
        }

        float[] samples = layOut(parsed, rows, cols, source);
        if (flipVertical) {
            flipRows(samples, rows, cols);
        }

        try {
            return new TileRecord(source, discoveryIndex,
                    parsed.latMin, parsed.latMax, parsed.lonMin, parsed.lonMax,
                    rows, cols, samples);
        } catch (IllegalArgumentException e) {
            throw new TileDecodeException(Kind.MALFORMED_SOURCE, source, e.getMessage(), e);
        }
    }

    private ParsedTile parse(InputStream in, Path source) throws XMLStreamException, TileDecodeException {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);

        ParsedTile tile = new ParsedTile();
        XMLStreamReader reader = factory.createXMLStreamReader(in);
        try {
            boolean inBoundedBy = false;
            while (reader.hasNext()) {
                int event = reader.next();
                if (event == XMLStreamConstants.END_ELEMENT && "boundedBy".equals(reader.getLocalName())) {
                    inBoundedBy = false;
                    continue;
                }
                if (event != XMLStreamConstants.START_ELEMENT) {
                    continue;
                }
                switch (reader.getLocalName()) {
                    case "boundedBy" -> inBoundedBy = true;
                    case "lowerCorner" -> {
                        if (inBoundedBy && !tile.hasLower) {
                            double[] latLon = parsePair(reader.getElementText(), "lowerCorner", source);
                            tile.latMin = latLon[0];
                            tile.lonMin = latLon[1];
                            tile.hasLower = true;
                        }
                    }
                    case "upperCorner" -> {
                        if (inBoundedBy && !tile.hasUpper) {
                            double[] latLon = parsePair(reader.getElementText(), "upperCorner", source);
                            tile.latMax = latLon[0];
                            tile.lonMax = latLon[1];
                            tile.hasUpper = true;
                        }
                    }
                    case "low" -> {
                        int[] xy = parseIntPair(reader.getElementText(), "low", source);
                        tile.lowX = xy[0];
                        tile.lowY = xy[1];
                        tile.hasLow = true;
                    }
                    case "high" -> {
                        int[] xy = parseIntPair(reader.getElementText(), "high", source);
                        tile.highX = xy[0];
                        tile.highY = xy[1];
                        tile.hasHigh = true;
                    }
                    case "startPoint" -> {
                        int[] xy = parseIntPair(reader.getElementText(), "startPoint", source);
                        tile.startX = xy[0];
                        tile.startY = xy[1];
                    }
                    case "tupleList" -> tile.values = parseTuples(reader.getElementText());
                    default -> {
                        // not needed
                    }
                }
            }
        } finally {
            reader.close();
        }

        if (!tile.hasLower || !tile.hasUpper) {
            throw new TileDecodeException(Kind.MALFORMED_SOURCE, source, "Missing gml:Envelope corners");
        }
        if (!tile.hasLow || !tile.hasHigh) {
            throw new TileDecodeException(Kind.MALFORMED_SOURCE, source, "Missing gml:GridEnvelope");
        }
        if (tile.values == null) {
            throw new TileDecodeException(Kind.MALFORMED_SOURCE, source, "Missing gml:tupleList");
        }
        return tile;
    }

    /**
     * Places the parsed values into a full grid starting at the start point.
     */
    private float[] layOut(ParsedTile parsed, int rows, int cols, Path source) throws TileDecodeException {
        int total = rows * cols;
        long start = (long) parsed.startY * cols + parsed.startX;
        if (parsed.startX < 0 || parsed.startY < 0 || start > total) {
            throw new TileDecodeException(Kind.MALFORMED_SOURCE, source,
                    "Start point (" + parsed.startX + "," + parsed.startY + ") outside grid (" + rows + "," + cols + ")");
        }

        float[] samples = new float[total];
        if (TileRecord.SENTINEL != 0.0f) {
            Arrays.fill(samples, TileRecord.SENTINEL);
        }
        int available = total - (int) start;
        int count = Math.min(parsed.values.length, available);
        System.arraycopy(parsed.values, 0, samples, (int) start, count);

        if (start > 0 || parsed.values.length != available) {
            log.debug("Partial tile {}: start offset {}, {} values for {} cells ({} padded, {} dropped)",
                    source.getFileName(), start, parsed.values.length, available,
                    Math.max(0, available - parsed.values.length),
                    Math.max(0, parsed.values.length - available));
        }
        return samples;
    }

    private float[] parseTuples(String text) {
        String[] lines = text.split("\\R");
        float[] values = new float[lines.length];
        int n = 0;
        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty()) {
                continue;
            }
            int comma = line.lastIndexOf(',');
            String token = (comma >= 0 ? line.substring(comma + 1) : line).strip();
            values[n++] = toSample(token);
        }
        return Arrays.copyOf(values, n);
    }

    float toSample(String token) {
        if (MISSING_TOKENS.contains(token)) {
            return TileRecord.SENTINEL;
        }
        double value;
        try {
            value = Double.parseDouble(token);
        } catch (NumberFormatException e) {
            return TileRecord.SENTINEL;
        }
        if (Double.isNaN(value) || value <= missingThreshold) {
            return TileRecord.SENTINEL;
        }
        return (float) value;
    }

    private static void flipRows(float[] samples, int rows, int cols) {
        float[] tmp = new float[cols];
        for (int top = 0, bottom = rows - 1; top < bottom; top++, bottom--) {
            System.arraycopy(samples, top * cols, tmp, 0, cols);
            System.arraycopy(samples, bottom * cols, samples, top * cols, cols);
            System.arraycopy(tmp, 0, samples, bottom * cols, cols);
        }
    }

    private static double[] parsePair(String text, String element, Path source) throws TileDecodeException {
        String[] parts = text.strip().split("\\s+");
        if (parts.length < 2) {
            throw new TileDecodeException(Kind.MALFORMED_SOURCE, source, "Malformed " + element + ": '" + text + "'");
        }
        try {
            return new double[]{Double.parseDouble(parts[0]), Double.parseDouble(parts[1])};
        } catch (NumberFormatException e) {
            throw new TileDecodeException(Kind.MALFORMED_SOURCE, source, "Malformed " + element + ": '" + text + "'", e);
        }
    }

    private static int[] parseIntPair(String text, String element, Path source) throws TileDecodeException {
        String[] parts = text.strip().split("\\s+");
        if (parts.length < 2) {
            throw new TileDecodeException(Kind.MALFORMED_SOURCE, source, "Malformed " + element + ": '" + text + "'");
        }
        try {
            return new int[]{Integer.parseInt(parts[0]), Integer.parseInt(parts[1])};
        } catch (NumberFormatException e) {
            throw new TileDecodeException(Kind.MALFORMED_SOURCE, source, "Malformed " + element + ": '" + text + "'", e);
        }
    }

    /**
     * Mutable accumulator for one streaming pass.
     */
    private static final class ParsedTile {
        double latMin;
        double lonMin;
        double latMax;
        double lonMax;
        boolean hasLower;
        boolean hasUpper;
        int lowX;
        int lowY;
        int highX;
        int highY;
        boolean hasLow;
        boolean hasHigh;
        int startX;
        int startY;
        float[] values;
    }
}
