package com.example.photoindex.extract;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Converts float vectors to and from the raw little-endian float32 layout used for persisted records.
 */
public final class FeatureEncoding {
    private FeatureEncoding() {}

    public static byte[] floatsToBytes(float[] values) {
        if (values == null || values.length == 0) {
            return new byte[0];
        }
        ByteBuffer buffer = ByteBuffer.allocate(values.length * 4).order(ByteOrder.LITTLE_ENDIAN);
        for (float v : values) {
            buffer.putFloat(v);
        }
        return buffer.array();
    }

    public static float[] bytesToFloats(byte[] data) {
        if (data == null || data.length == 0) {
            return new float[0];
        }
        if (data.length % 4 != 0) {
            throw new IllegalArgumentException("float32 data length must be a multiple of 4, got " + data.length);
        }
        ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        float[] out = new float[data.length / 4];
        for (int i = 0; i < out.length; i++) {
            out[i] = buffer.getFloat();
        }
        return out;
    }
}
