package io.github.panghy.tokengraph.vector;

/**
 * 8-bit affine quantization over the range {@code [min, max]} of one vector.
 *
 * <p>{@code scale = (max - min) / 255} (or 1 when the range is degenerate) and
 * {@code zero = round(-min / scale)}. When {@code zero} would not fit an int, which happens for
 * narrow vectors far from the origin, the step widens until it does. Reconstruction error is at
 * most half a step per component for any finite input.</p>
 */
public final class AffineQuantizer {
  private static final int LEVELS = 255;

  private AffineQuantizer() {}

  public static QuantizedVector quantize(float[] v) {
    if (v.length == 0) {
      return new QuantizedVector(new byte[0], 1f, 0);
    }
    float min = Float.POSITIVE_INFINITY;
    float max = Float.NEGATIVE_INFINITY;
    for (float x : v) {
      if (!Float.isFinite(x)) throw new IllegalArgumentException("Cannot quantize non-finite component " + x);
      if (x < min) min = x;
      if (x > max) max = x;
    }
    double range = (double) max - min;
    float scale = range > 0 ? (float) (range / LEVELS) : 1f;
    if (Math.abs(min / (double) scale) > Integer.MAX_VALUE / 2.0) {
      scale = (float) (Math.abs((double) min) / (Integer.MAX_VALUE / 4.0));
    }
    int zero = (int) Math.round(-min / (double) scale);
    byte[] q = new byte[v.length];
    for (int i = 0; i < v.length; i++) {
      long code = Math.round(v[i] / (double) scale + zero);
      q[i] = (byte) Math.max(0, Math.min(LEVELS, code));
    }
    return new QuantizedVector(q, scale, zero);
  }

  public static float[] dequantize(QuantizedVector qv) {
    float[] out = new float[qv.length()];
    for (int i = 0; i < out.length; i++) {
      out[i] = (float) ((qv.codeAt(i) - qv.zero()) * (double) qv.scale());
    }
    return out;
  }
}
