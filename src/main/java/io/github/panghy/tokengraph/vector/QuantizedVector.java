package io.github.panghy.tokengraph.vector;

/**
 * An 8-bit affine-quantized vector: {@code value[i] ~= (q[i] - zero) * scale} with each
 * {@code q[i]} read as an unsigned byte.
 */
public record QuantizedVector(byte[] q, float scale, int zero) {

  public int length() {
    return q.length;
  }

  /** Unsigned code at {@code i}. */
  public int codeAt(int i) {
    return Byte.toUnsignedInt(q[i]);
  }
}
