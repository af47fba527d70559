package io.github.panghy.tokengraph;

/**
 * Raised when the adjacency oracle or embedding provider rejects a request and no synthetic
 * substitute is allowed.
 */
public class OracleFailureException extends TokenGraphException {
  private final String token;

  public OracleFailureException(String token, Throwable cause) {
    this("Adjacency oracle failed for token '" + token + "'", token, cause);
  }

  public OracleFailureException(String message, String token, Throwable cause) {
    super(message, cause);
    this.token = token;
  }

  public String getToken() {
    return token;
  }
}
