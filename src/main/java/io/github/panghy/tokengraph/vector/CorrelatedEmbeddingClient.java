package io.github.panghy.tokengraph.vector;

import io.github.panghy.tokengraph.OracleFailureException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedding provider that talks to a separate execution context by message passing.
 *
 * <p>Each call gets the next correlation id and a pending future; {@link #receive} completes the
 * matching future. Replies with unknown ids are ignored. {@link #close()} fails every pending
 * call.</p>
 */
public final class CorrelatedEmbeddingClient implements EmbeddingProvider, AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(CorrelatedEmbeddingClient.class);

  private final String name;
  private final int dimension;
  private final Consumer<EmbeddingRequest> transport;
  private final AtomicLong sequence = new AtomicLong();
  private final Map<Long, CompletableFuture<List<float[]>>> pending = new ConcurrentHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public CorrelatedEmbeddingClient(String name, int dimension, Consumer<EmbeddingRequest> transport) {
    this.name = Objects.requireNonNull(name);
    this.dimension = dimension;
    this.transport = Objects.requireNonNull(transport);
  }

  /**
   * Runs {@code delegate} behind an {@link EmbeddingWorker} on {@code executor}.
   */
  public static CorrelatedEmbeddingClient local(EmbeddingProvider delegate, Executor executor) {
    EmbeddingWorker worker = new EmbeddingWorker(delegate, executor);
    CorrelatedEmbeddingClient client = new CorrelatedEmbeddingClient(delegate.name(), delegate.dimension(), worker);
    worker.replyTo(client::receive);
    return client;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public CompletableFuture<List<float[]>> embed(List<String> texts) {
    if (closed.get()) {
      return CompletableFuture.failedFuture(new IllegalStateException("Embedding client is closed"));
    }
    long id = sequence.incrementAndGet();
    CompletableFuture<List<float[]>> future = new CompletableFuture<>();
    pending.put(id, future);
    try {
      transport.accept(new EmbeddingRequest(id, List.copyOf(texts)));
    } catch (RuntimeException e) {
      pending.remove(id);
      future.completeExceptionally(e);
    }
    return future;
  }

  /** Completes the pending call matching {@code response}. */
  public void receive(EmbeddingResponse response) {
    CompletableFuture<List<float[]>> future = pending.remove(response.correlationId());
    if (future == null) {
      LOGGER.debug("Ignoring reply for unknown correlation id {}", response.correlationId());
      return;
    }
    if (response.ok()) {
      future.complete(response.vectors());
    } else {
      future.completeExceptionally(new OracleFailureException(
          "Embedding provider " + name + " failed: " + response.error(), null,
          new IllegalStateException(response.error())));
    }
  }

  /** Number of calls awaiting a reply. */
  public int inflight() {
    return pending.size();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    IllegalStateException closedError = new IllegalStateException("Embedding client closed");
    pending.forEach((id, future) -> future.completeExceptionally(closedError));
    pending.clear();
  }
}
