package io.github.panghy.tokengraph.vector;

import static java.util.concurrent.CompletableFuture.completedFuture;

import io.github.panghy.tokengraph.NotInitializedException;
import io.github.panghy.tokengraph.kb.ShardStoreListener;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Front door of the vector subsystem: on-demand embedding, batched ingestion of new tokens and
 * similarity queries.
 *
 * <p>Registered as a {@link ShardStoreListener}, it queues every newly allocated token for
 * embedding.</p>
 */
public class VectorService implements ShardStoreListener {
  private static final Logger LOGGER = LoggerFactory.getLogger(VectorService.class);

  private final VectorStore store;
  private final EmbeddingProvider provider;
  private final EmbeddingQueue queue;
  private final AtomicBoolean configured = new AtomicBoolean(false);

  public VectorService(VectorStore store, EmbeddingProvider provider, FlushScheduler scheduler, int batchSize) {
    this(store, provider, scheduler, batchSize, ForkJoinPool.commonPool());
  }

  public VectorService(
      VectorStore store, EmbeddingProvider provider, FlushScheduler scheduler, int batchSize, Executor executor) {
    this.store = store;
    this.provider = provider;
    this.queue = new EmbeddingQueue(provider, store, scheduler, batchSize, executor);
  }

  /**
   * Initializes the store. Fails if the provider's dimension differs from the store's.
   */
  public CompletableFuture<Void> init() {
    if (provider.dimension() != store.dimension()) {
      return CompletableFuture.failedFuture(new IllegalArgumentException(
          "Provider " + provider.name() + " produces " + provider.dimension() + "-d vectors but the store expects "
              + store.dimension()));
    }
    return store.init().thenRun(() -> {
      configured.set(true);
      LOGGER.info("Vector subsystem ready provider={} dim={}", provider.name(), store.dimension());
    });
  }

  public VectorStore store() {
    return store;
  }

  public EmbeddingQueue queue() {
    return queue;
  }

  /** Queues a token for embedding and schedules a flush. Ignored before init. */
  public void observeToken(long tokenId, String text) {
    if (!configured.get()) return;
    queue.enqueue(tokenId, text);
    queue.scheduleFlush();
  }

  @Override
  public void onTokenObserved(long tokenId, String text, boolean created) {
    if (created) observeToken(tokenId, text);
  }

  /**
   * Embeds {@code text} now and stores it for {@code tokenId}.
   *
   * @return future with the stored vector
   */
  public CompletableFuture<float[]> embedAndStore(long tokenId, String text) {
    if (!configured.get()) return notInitialized();
    return provider.embed(text)
        .thenCompose(vector -> store.put(tokenId, vector))
        .thenCompose(v -> store.get(tokenId));
  }

  /** Returns the stored vector, embedding it first if missing. */
  public CompletableFuture<float[]> ensureEmbedding(long tokenId, String text) {
    if (!configured.get()) return notInitialized();
    return store.get(tokenId).thenCompose(existing -> {
      if (existing != null) return completedFuture(existing);
      return embedAndStore(tokenId, text);
    });
  }

  public CompletableFuture<List<ScoredToken>> similar(long tokenId, int topK) {
    if (!configured.get()) return notInitialized();
    return store.similar(tokenId, topK);
  }

  public CompletableFuture<Integer> flushNow() {
    return queue.flushNow();
  }

  public VectorStatus status() {
    return new VectorStatus(
        configured.get(), provider.name(), store.dimension(), queue.size(), queue.batches(), queue.lastBatchMs());
  }

  private static <T> CompletableFuture<T> notInitialized() {
    return CompletableFuture.failedFuture(new NotInitializedException("VectorService"));
  }
}
