package com.largomodo.demstitch.service.raster;

import com.largomodo.demstitch.core.domain.Mosaic;
import com.largomodo.demstitch.service.RasterWriter;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes a raster as a NumPy {@code .npy} (format 1.0) little-endian float32 array of
 * shape {@code (H, W)}, C order.
 */
public class NpyRasterWriter implements RasterWriter {

    private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y', 1, 0};

    @Override
    public String extension() {
        return "npy";
    }

    @Override
    public void write(Mosaic raster, Path target) throws IOException {
        byte[] header = buildHeader(raster.height(), raster.width());

        try (FileChannel channel = FileChannel.open(target, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            ByteBuffer head = ByteBuffer.wrap(header);
            while (head.hasRemaining()) {
                channel.write(head);
            }

            float[] row = new float[raster.width()];
            ByteBuffer buffer = ByteBuffer.allocate(raster.width() * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
            for (int y = 0; y < raster.height(); y++) {
                raster.copyRow(y, row);
                buffer.clear();
                buffer.asFloatBuffer().put(row);
                buffer.position(0).limit(buffer.capacity());
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
            }
        }
    }

    /**
     * Magic, version, uint16 header length, then the dict padded with spaces and a newline
     * so the data starts on a 64-byte boundary.
     */
    static byte[] buildHeader(int height, int width) {
        String dict = "{'descr': '<f4', 'fortran_order': False, 'shape': (" + height + ", " + width + "), }";
        int unpadded = MAGIC.length + 2 + dict.length() + 1;
        int padding = (64 - unpadded % 64) % 64;
        String text = dict + " ".repeat(padding) + "\n";

        ByteBuffer buffer = ByteBuffer.allocate(MAGIC.length + 2 + text.length()).order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(MAGIC);
        buffer.putShort((short) text.length());
        buffer.put(text.getBytes(StandardCharsets.US_ASCII));
        return buffer.array();
    }
}
