package com.embedcache.repository.converter;

import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Converts embedding vectors to and from their stored byte form.
 *
 * Layout (big-endian):
 * <pre>
 *   byte   format version (1)
 *   int32  dimension
 *   int32  raw IEEE-754 bits, one per component
 * </pre>
 */
@Component
public class VectorConverter {

    public static final byte FORMAT_VERSION = 1;

    private static final int HEADER_SIZE = Byte.BYTES + Integer.BYTES;

    public byte[] encode(float[] vector) {
        Objects.requireNonNull(vector, "vector");
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_SIZE + vector.length * Float.BYTES)
                .order(ByteOrder.BIG_ENDIAN);
        buffer.put(FORMAT_VERSION);
        buffer.putInt(vector.length);
        for (float component : vector) {
            // raw bits keep NaN payloads intact
            buffer.putInt(Float.floatToRawIntBits(component));
        }
        return buffer.array();
    }

    /**
     * @throws VectorDecodeException if the blob is not a version 1 vector of consistent length
     */
    public float[] decode(byte[] data) {
        if (data == null) {
            throw new VectorDecodeException("No data to decode");
        }
        if (data.length < HEADER_SIZE) {
            throw new VectorDecodeException("Blob too short for header: " + data.length + " bytes");
        }

        ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.BIG_ENDIAN);
        byte version = buffer.get();
        if (version != FORMAT_VERSION) {
            throw new VectorDecodeException("Unsupported vector format version: " + version);
        }

        int dimension = buffer.getInt();
        if (dimension < 0) {
            throw new VectorDecodeException("Negative dimension: " + dimension);
        }
        long expected = (long) dimension * Float.BYTES;
        if (buffer.remaining() != expected) {
            throw new VectorDecodeException("Dimension " + dimension + " needs " + expected
                    + " bytes, found " + buffer.remaining());
        }

        float[] vector = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            vector[i] = Float.intBitsToFloat(buffer.getInt());
        }
        return vector;
    }
}
