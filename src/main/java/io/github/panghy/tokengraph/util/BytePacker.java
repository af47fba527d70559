package io.github.panghy.tokengraph.util;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Utility for packing/unpacking floats and longs to little-endian byte arrays.
 *
 * <p>Used for raw embedding payloads and for the token id counter.</p>
 */
public final class BytePacker {
  private BytePacker() {}

  /**
   * Packs a float array into a little-endian byte array (4 bytes per element).
   *
   * @param arr the float array to pack (must not be null)
   * @return a new byte array containing the packed floats
   */
  public static byte[] floatsToBytes(float[] arr) {
    ByteBuffer bb = ByteBuffer.allocate(arr.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    for (float v : arr) bb.putFloat(v);
    return bb.array();
  }

  /**
   * Unpacks a little-endian byte array into a float array.
   *
   * @param bytes the byte array to unpack (length must be a multiple of 4)
   * @return a new float array reconstructed from the bytes
   */
  public static float[] bytesToFloats(byte[] bytes) {
    if (bytes.length % Float.BYTES != 0) {
      throw new IllegalArgumentException("Float payload length " + bytes.length + " is not a multiple of 4");
    }
    ByteBuffer bb = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    int n = bytes.length / Float.BYTES;
    float[] out = new float[n];
    for (int i = 0; i < n; i++) out[i] = bb.getFloat();
    return out;
  }

  public static byte[] longToBytes(long value) {
    return ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).putLong(value).array();
  }

  public static long bytesToLong(byte[] bytes) {
    if (bytes.length != Long.BYTES) {
      throw new IllegalArgumentException("Expected 8 bytes but got " + bytes.length);
    }
    return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).getLong();
  }
}
