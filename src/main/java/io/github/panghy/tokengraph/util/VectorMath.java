package io.github.panghy.tokengraph.util;

/**
 * Basic similarity utilities for vector comparisons.
 */
public final class VectorMath {
  private VectorMath() {}

  /**
   * Computes dot product between two vectors.
   *
   * @param a vector A
   * @param b vector B (same length as A)
   * @return dot product value
   */
  public static double dot(float[] a, float[] b) {
    double s = 0.0;
    for (int i = 0; i < a.length; i++) s += (double) a[i] * b[i];
    return s;
  }

  /**
   * Computes the L2 norm of a vector.
   */
  public static double norm(float[] a) {
    return Math.sqrt(dot(a, a));
  }

  /**
   * Computes cosine similarity. Returns 0 when either vector has zero norm.
   */
  public static double cosine(float[] a, float[] b) {
    double na = norm(a);
    double nb = norm(b);
    if (na == 0.0 || nb == 0.0) return 0.0;
    return dot(a, b) / (na * nb);
  }

  /**
   * Returns an L2-normalized copy. Vectors with zero or non-finite norm are returned unchanged
   * (as a copy).
   */
  public static float[] normalize(float[] v) {
    double n = norm(v);
    float[] out = v.clone();
    if (n == 0.0 || !Double.isFinite(n)) return out;
    for (int i = 0; i < out.length; i++) out[i] = (float) (out[i] / n);
    return out;
  }

  /** Whether every component is finite. */
  public static boolean isFinite(float[] v) {
    for (float x : v) {
      if (!Float.isFinite(x)) return false;
    }
    return true;
  }
}
