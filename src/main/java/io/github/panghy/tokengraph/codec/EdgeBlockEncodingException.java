package io.github.panghy.tokengraph.codec;

import io.github.panghy.tokengraph.TokenGraphException;

/**
 * Signals a malformed or truncated edge block. The block should be treated as unreadable.
 */
public class EdgeBlockEncodingException extends TokenGraphException {

  public EdgeBlockEncodingException(String message) {
    super(message);
  }

  public EdgeBlockEncodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
