package com.largomodo.demstitch.service.raster;

import com.largomodo.demstitch.core.StitchReport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Writes the human-readable run summary as {@code key: value} lines.
 * Not load-bearing for correctness; kept for audit.
 */
public class SummaryWriter {

    public String format(StitchReport report) {
        StringBuilder sb = new StringBuilder();
        line(sb, "tiles_found", Integer.toString(report.tilesFound()));
        line(sb, "tiles_in", Integer.toString(report.tilesDecoded()));
        line(sb, "decode_failed", Integer.toString(report.decodeFailed()));
        line(sb, "placed", Integer.toString(report.placed()));
        line(sb, "skipped_irregular", Integer.toString(report.skippedIrregular()));
        line(sb, "grid", "Tx=" + report.colBands() + ", Ty=" + report.rowBands());
        line(sb, "shape", "H=" + report.height() + ", W=" + report.width());
        line(sb, "interpolation", "filled=" + report.filled() + ", remaining=" + report.remainingHoles() +
                ", passes=" + report.passes() + ", skipped=" + report.interpolationSkipped());
        line(sb, "seed", Long.toString(report.seed()));
        line(sb, "aspect_scale", String.format(Locale.ROOT, "%.6f", report.aspectScale()));
        line(sb, "final_shape", "H=" + report.height() + ", W=" + report.finalWidth());
        return sb.toString();
    }

    public void write(StitchReport report, Path target) throws IOException {
        Files.writeString(target, format(report), StandardCharsets.UTF_8);
    }

    private static void line(StringBuilder sb, String key, String value) {
        sb.append(key).append(": ").append(value).append('\n');
    }
}
