package io.github.panghy.tokengraph;

/**
 * Thrown when a store operation is attempted before {@code init()} completed.
 */
public class NotInitializedException extends TokenGraphException {

  public NotInitializedException(String component) {
    super(component + " used before init()");
  }
}
