package io.github.panghy.valkeyvector.codec;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Packs vectors into the binary form expected by KNN query parameters: consecutive little-endian
 * IEEE 754 float32 values, 4 bytes per element.
 */
public final class VectorBytes {
  private VectorBytes() {}

  public static byte[] toFloat32Bytes(float[] vector) {
    ByteBuffer buf = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    buf.asFloatBuffer().put(vector);
    return buf.array();
  }

  /**
   * Inverse of {@link #toFloat32Bytes(float[])}.
   *
   * @throws IllegalArgumentException if the length is not a multiple of 4
   */
  public static float[] fromFloat32Bytes(byte[] bytes) {
    if (bytes.length % Float.BYTES != 0) {
      throw new IllegalArgumentException("length " + bytes.length + " is not a multiple of " + Float.BYTES);
    }
    float[] out = new float[bytes.length / Float.BYTES];
    ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(out);
    return out;
  }
}
