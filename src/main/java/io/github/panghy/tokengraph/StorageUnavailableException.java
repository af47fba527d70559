package io.github.panghy.tokengraph;

/**
 * Exception thrown when a durable storage backend cannot be opened.
 *
 * <p>Callers normally do not see this: {@code StorageBackends} catches it and degrades to the
 * in-memory backend once.</p>
 */
public class StorageUnavailableException extends Exception {

  /**
   * Constructs a new storage unavailable exception with the specified detail message.
   *
   * @param message the detail message
   */
  public StorageUnavailableException(String message) {
    super(message);
  }

  /**
   * Constructs a new storage unavailable exception with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause   the cause
   */
  public StorageUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Constructs a new storage unavailable exception with the specified cause.
   *
   * @param cause the cause
   */
  public StorageUnavailableException(Throwable cause) {
    super(cause);
  }
}
