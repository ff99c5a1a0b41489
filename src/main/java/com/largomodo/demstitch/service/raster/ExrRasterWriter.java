package com.largomodo.demstitch.service.raster;

import com.largomodo.demstitch.core.domain.Mosaic;
import com.largomodo.demstitch.service.RasterWriter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Native writer for single-channel 32-bit float OpenEXR images.
 * <p>
 * Layout (all little-endian):
 * <ul>
 *   <li>magic {@code 20000630}, version 2 (single-part scanline, no flags)</li>
 *   <li>header attributes: one FLOAT channel named {@code R}, no compression,
 *       data/display window {@code (0,0)-(W-1,H-1)}, increasing-Y line order</li>
 *   <li>offset table: one uint64 file offset per scanline</li>
 *   <li>scanline chunks: int y, int byte count, W floats</li>
 * </ul>
 * Uncompressed output needs no codec library and is read by every EXR consumer.
 */
public class ExrRasterWriter implements RasterWriter {

    static final int MAGIC = 20000630;
    static final int VERSION = 2;
    static final int PIXEL_TYPE_FLOAT = 2;
    static final byte NO_COMPRESSION = 0;
    static final byte INCREASING_Y = 0;
    static final String CHANNEL = "R";

    @Override
    public String extension() {
        return "exr";
    }

    @Override
    public void write(Mosaic raster, Path target) throws IOException {
        int width = raster.width();
        int height = raster.height();
        byte[] header = buildHeader(width, height);

        int rowBytes = width * Float.BYTES;
        long chunkBytes = 8L + rowBytes;
        long firstChunk = header.length + 8L * height;

        try (FileChannel channel = FileChannel.open(target, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            writeFully(channel, ByteBuffer.wrap(header));

            ByteBuffer offsets = ByteBuffer.allocate(8 * height).order(ByteOrder.LITTLE_ENDIAN);
            for (int y = 0; y < height; y++) {
                offsets.putLong(firstChunk + y * chunkBytes);
            }
            offsets.flip();
            writeFully(channel, offsets);

            float[] row = new float[width];
            ByteBuffer chunk = ByteBuffer.allocate((int) chunkBytes).order(ByteOrder.LITTLE_ENDIAN);
            for (int y = 0; y < height; y++) {
                raster.copyRow(y, row);
                chunk.clear();
                chunk.putInt(y);
                chunk.putInt(rowBytes);
                chunk.asFloatBuffer().put(row);
                chunk.position(0).limit((int) chunkBytes);
                writeFully(channel, chunk);
            }
        }
    }

    static byte[] buildHeader(int width, int height) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(512);
        ByteBuffer prefix = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN);
        prefix.putInt(MAGIC).putInt(VERSION);
        out.writeBytes(prefix.array());

        ByteBuffer channels = ByteBuffer.allocate(CHANNEL.length() + 1 + 16 + 1).order(ByteOrder.LITTLE_ENDIAN);
        channels.put(CHANNEL.getBytes(StandardCharsets.US_ASCII)).put((byte) 0);
        channels.putInt(PIXEL_TYPE_FLOAT);
        channels.put((byte) 0);                 // pLinear
        channels.put(new byte[3]);              // reserved
        channels.putInt(1).putInt(1);           // x/y sampling
        channels.put((byte) 0);                 // end of channel list
        attribute(out, "channels", "chlist", channels.array());

        attribute(out, "compression", "compression", new byte[]{NO_COMPRESSION});

        byte[] window = box(0, 0, width - 1, height - 1);
        attribute(out, "dataWindow", "box2i", window);
        attribute(out, "displayWindow", "box2i", window);
        attribute(out, "lineOrder", "lineOrder", new byte[]{INCREASING_Y});
        attribute(out, "pixelAspectRatio", "float", floats(1.0f));
        attribute(out, "screenWindowCenter", "v2f", floats(0.0f, 0.0f));
        attribute(out, "screenWindowWidth", "float", floats(1.0f));

        out.write(0);                           // end of header
        return out.toByteArray();
    }

    private static void attribute(ByteArrayOutputStream out, String name, String type, byte[] value) {
        out.writeBytes(name.getBytes(StandardCharsets.US_ASCII));
        out.write(0);
        out.writeBytes(type.getBytes(StandardCharsets.US_ASCII));
        out.write(0);
        ByteBuffer size = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(value.length);
        out.writeBytes(size.array());
        out.writeBytes(value);
    }

    private static byte[] box(int xMin, int yMin, int xMax, int yMax) {
        return ByteBuffer.allocate(16).order(ByteOrder.LITTLE_ENDIAN)
                .putInt(xMin).putInt(yMin).putInt(xMax).putInt(yMax).array();
    }

    private static byte[] floats(float... values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * 4).order(ByteOrder.LITTLE_ENDIAN);
        for (float v : values) {
            buffer.putFloat(v);
        }
        return buffer.array();
    }

    private static void writeFully(FileChannel channel, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }
}
