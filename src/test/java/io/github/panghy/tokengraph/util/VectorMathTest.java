package io.github.panghy.tokengraph.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class VectorMathTest {

  @Test
  void testDotAndNorm() {
    float[] a = {1, 2, 3};
    float[] b = {4, -5, 6};

    assertThat(VectorMath.dot(a, b)).isEqualTo(12.0);
    assertThat(VectorMath.norm(new float[] {3, 4})).isEqualTo(5.0);
  }

  @Test
  void testCosine() {
    assertThat(VectorMath.cosine(new float[] {1, 0}, new float[] {2, 0})).isCloseTo(1.0, within(1e-9));
    assertThat(VectorMath.cosine(new float[] {1, 0}, new float[] {0, 3})).isCloseTo(0.0, within(1e-9));
    assertThat(VectorMath.cosine(new float[] {0, 0}, new float[] {1, 1})).isZero();
  }

  @Test
  void testNormalize() {
    float[] v = {3, 4};
    float[] n = VectorMath.normalize(v);

    assertThat(n[0]).isCloseTo(0.6f, within(1e-6f));
    assertThat(n[1]).isCloseTo(0.8f, within(1e-6f));
    assertThat(v).containsExactly(3f, 4f);
    assertThat(VectorMath.normalize(new float[] {0, 0})).containsExactly(0f, 0f);
  }

  @Test
  void testIsFinite() {
    assertThat(VectorMath.isFinite(new float[] {1, -2})).isTrue();
    assertThat(VectorMath.isFinite(new float[] {1, Float.NaN})).isFalse();
    assertThat(VectorMath.isFinite(new float[] {Float.NEGATIVE_INFINITY})).isFalse();
  }
}
