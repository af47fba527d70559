package io.github.panghy.tokengraph.storage;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * An opaque transactional key/value store.
 *
 * <p>Implementations are chosen once by {@link StorageBackends} and never swapped while in use.</p>
 */
public interface StorageBackend extends AutoCloseable {

  /** Short name used in logs and status output. */
  String name();

  /** Whether committed data survives a process restart. */
  boolean isDurable();

  /**
   * Runs {@code body} in a read/write transaction and commits when its future completes normally.
   * A failed body discards all of its writes.
   */
  <T> CompletableFuture<T> runAsync(Function<? super StorageTransaction, ? extends CompletableFuture<T>> body);

  /**
   * Runs {@code body} in a read-only transaction.
   */
  <T> CompletableFuture<T> readAsync(Function<? super StorageTransaction, ? extends CompletableFuture<T>> body);

  @Override
  void close();
}
