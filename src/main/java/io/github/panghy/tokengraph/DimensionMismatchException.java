package io.github.panghy.tokengraph;

/**
 * Thrown when a vector's length differs from the dimension the store was initialized with.
 */
public class DimensionMismatchException extends TokenGraphException {
  private final int expected;
  private final int actual;

  public DimensionMismatchException(int expected, int actual) {
    super("Vector dimension mismatch: expected " + expected + " but was " + actual);
    this.expected = expected;
    this.actual = actual;
  }

  public int getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }
}
