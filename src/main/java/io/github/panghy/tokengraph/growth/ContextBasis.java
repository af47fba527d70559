package io.github.panghy.tokengraph.growth;

import io.github.panghy.tokengraph.util.VectorMath;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * An orthonormal basis spanned by the embeddings of a small set of related tokens.
 *
 * @param anchorId the token the context is built around
 * @param members  every token the context covers, anchor first
 * @param basis    orthonormal vectors, anchor direction first
 */
public record ContextBasis(String anchorId, Set<String> members, List<float[]> basis) {

  private static final double RESIDUAL_EPSILON = 1e-6;

  /**
   * Gram-Schmidt over {@code vectors} in order, keeping at most {@code k} directions and dropping
   * vectors whose residual norm is below 1e-6.
   */
  public static List<float[]> orthonormalize(List<float[]> vectors, int k) {
    List<float[]> out = new ArrayList<>();
    if (vectors.isEmpty()) return out;
    int limit = Math.min(k, vectors.get(0).length);
    for (float[] v : vectors) {
      if (out.size() >= limit) break;
      double[] residual = new double[v.length];
      for (int i = 0; i < v.length; i++) residual[i] = v[i];
      for (float[] b : out) {
        double proj = 0;
        for (int i = 0; i < v.length; i++) proj += residual[i] * b[i];
        for (int i = 0; i < v.length; i++) residual[i] -= proj * b[i];
      }
      double norm = 0;
      for (double r : residual) norm += r * r;
      norm = Math.sqrt(norm);
      if (norm < RESIDUAL_EPSILON) continue;
      float[] unit = new float[v.length];
      for (int i = 0; i < v.length; i++) unit[i] = (float) (residual[i] / norm);
      out.add(unit);
    }
    return out;
  }

  /** Coordinates of {@code vector} on each basis direction. */
  public double[] project(float[] vector) {
    double[] coords = new double[basis.size()];
    for (int i = 0; i < coords.length; i++) coords[i] = VectorMath.dot(vector, basis.get(i));
    return coords;
  }

  /**
   * Largest squared coordinate over the sum of squared coordinates, or 0 when the vector is
   * orthogonal to the context.
   */
  public double peakiness(float[] vector) {
    double[] coords = project(vector);
    double max = 0;
    double sum = 0;
    for (double c : coords) {
      double p = c * c;
      sum += p;
      max = Math.max(max, p);
    }
    return sum <= 0 ? 0 : max / sum;
  }
}
