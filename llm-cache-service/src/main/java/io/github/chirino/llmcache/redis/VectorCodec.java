package io.github.chirino.llmcache.redis;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/** FLOAT32 little-endian blobs, the vector encoding RediSearch expects. */
final class VectorCodec {

    private VectorCodec() {}

    static byte[] toBytes(float[] vector) {
        ByteBuffer buffer =
                ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asFloatBuffer().put(vector);
        return buffer.array();
    }
}
