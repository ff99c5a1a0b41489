package com.largomodo.demstitch.service.raster;

import com.largomodo.demstitch.core.domain.Mosaic;
import com.largomodo.demstitch.service.RasterWriter;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes a validity mask as an 8-bit grayscale PNG: 255 = real sample, 0 = filled or no data.
 * Fractional values from resampling are scaled and rounded.
 */
public class MaskPngWriter implements RasterWriter {

    @Override
    public String extension() {
        return "png";
    }

    @Override
    public void write(Mosaic raster, Path target) throws IOException {
        BufferedImage image = new BufferedImage(raster.width(), raster.height(), BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster pixels = image.getRaster();
        float[] row = new float[raster.width()];
        int[] gray = new int[raster.width()];
        for (int y = 0; y < raster.height(); y++) {
            raster.copyRow(y, row);
            for (int x = 0; x < row.length; x++) {
                float clamped = Math.max(0.0f, Math.min(1.0f, row[x]));
                gray[x] = Math.round(clamped * 255.0f);
            }
            pixels.setPixels(0, y, raster.width(), 1, gray);
        }
        if (!ImageIO.write(image, "png", target.toFile())) {
            throw new IOException("No PNG writer available for " + target);
        }
    }
}
