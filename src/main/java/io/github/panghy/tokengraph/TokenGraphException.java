package io.github.panghy.tokengraph;

/**
 * Base unchecked exception for failures raised by the token graph engine.
 */
public class TokenGraphException extends RuntimeException {

  public TokenGraphException(String message) {
    super(message);
  }

  public TokenGraphException(String message, Throwable cause) {
    super(message, cause);
  }
}
