package io.github.panghy.tokengraph.vector;

import static java.util.concurrent.CompletableFuture.completedFuture;

import com.apple.foundationdb.async.AsyncUtil;
import io.github.panghy.tokengraph.util.Metrics;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Batches newly observed tokens for embedding off the caller's path.
 *
 * <p>{@link #flushNow()} drains the queue in groups of {@code batchSize}; {@link #scheduleFlush()}
 * asks the {@link FlushScheduler} to do so later. Entries leave the queue only after their vectors
 * were stored, so a failed batch stays queued and a follow-up flush is scheduled. Flushes never
 * overlap.</p>
 */
public final class EmbeddingQueue {
  private static final Logger LOGGER = LoggerFactory.getLogger(EmbeddingQueue.class);

  private final EmbeddingProvider provider;
  private final VectorStore store;
  private final FlushScheduler scheduler;
  private final int batchSize;
  private final Executor executor;

  private final Map<Long, String> queue = new LinkedHashMap<>();
  private final AtomicBoolean flushScheduled = new AtomicBoolean(false);
  private final AtomicLong batches = new AtomicLong();
  private volatile long lastBatchMs;
  private CompletableFuture<Integer> flushTail = completedFuture(0);

  public EmbeddingQueue(EmbeddingProvider provider, VectorStore store, FlushScheduler scheduler, int batchSize) {
    this(provider, store, scheduler, batchSize, ForkJoinPool.commonPool());
  }

  /** {@code executor} runs the continuations between batches of a flush. */
  public EmbeddingQueue(
      EmbeddingProvider provider, VectorStore store, FlushScheduler scheduler, int batchSize, Executor executor) {
    if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive");
    this.provider = provider;
    this.store = store;
    this.scheduler = scheduler;
    this.batchSize = batchSize;
    this.executor = executor;
  }

  /** Queues {@code text} for {@code tokenId}, replacing any text already queued for it. */
  public void enqueue(long tokenId, String text) {
    if (text == null || text.isBlank()) return;
    synchronized (queue) {
      queue.put(tokenId, text);
    }
  }

  public int size() {
    synchronized (queue) {
      return queue.size();
    }
  }

  /** Completed batches since construction. */
  public long batches() {
    return batches.get();
  }

  /** Wall time of the most recent flush in milliseconds. */
  public long lastBatchMs() {
    return lastBatchMs;
  }

  /**
   * Requests a flush from the scheduler unless one is already pending.
   */
  public void scheduleFlush() {
    if (!flushScheduled.compareAndSet(false, true)) return;
    scheduler.schedule(() -> {
      flushScheduled.set(false);
      flushNow().whenComplete((n, error) -> {
        if (error != null) {
          LOGGER.warn("Scheduled embedding flush failed; {} token(s) stay queued", size(), error);
        }
      });
    });
  }

  /**
   * Embeds and stores everything queued, one batch at a time.
   *
   * @return future with the number of tokens stored by this flush
   */
  public synchronized CompletableFuture<Integer> flushNow() {
    flushTail = flushTail.handle((n, error) -> null).thenCompose(v -> drain());
    return flushTail;
  }

  private CompletableFuture<Integer> drain() {
    long start = System.nanoTime();
    AtomicInteger stored = new AtomicInteger();
    return AsyncUtil.whileTrue(() -> {
          Map<Long, String> batch = nextBatch();
          if (batch.isEmpty()) return completedFuture(false);
          return embedBatch(batch).thenApply(n -> {
            stored.addAndGet(n);
            batches.incrementAndGet();
            Metrics.EMBEDDING_BATCH_COUNT.add(1, Metrics.attrs("provider", provider.name()));
            return true;
          });
        }, executor)
        .whenComplete((v, error) -> {
          lastBatchMs = (System.nanoTime() - start) / 1_000_000;
          Metrics.EMBEDDING_FLUSH_DURATION_MS.record(lastBatchMs);
          if (error != null && size() > 0) {
            LOGGER.warn("Embedding flush failed, re-queueing {} token(s)", size(), error);
            scheduleFlush();
          }
        })
        .thenApply(v -> stored.get());
  }

  private Map<Long, String> nextBatch() {
    Map<Long, String> batch = new LinkedHashMap<>();
    synchronized (queue) {
      Iterator<Map.Entry<Long, String>> it = queue.entrySet().iterator();
      while (it.hasNext() && batch.size() < batchSize) {
        Map.Entry<Long, String> e = it.next();
        batch.put(e.getKey(), e.getValue());
      }
    }
    return batch;
  }

  private CompletableFuture<Integer> embedBatch(Map<Long, String> batch) {
    List<Long> ids = new ArrayList<>(batch.keySet());
    List<String> texts = new ArrayList<>(batch.values());
    CompletableFuture<List<float[]>> embedded;
    try {
      embedded = provider.embed(texts);
    } catch (RuntimeException e) {
      embedded = CompletableFuture.failedFuture(e);
    }
    return embedded.thenCompose(vectors -> {
      if (vectors.size() != ids.size()) {
        throw new IllegalStateException(
            "Provider " + provider.name() + " returned " + vectors.size() + " vectors for " + ids.size() + " texts");
      }
      List<CompletableFuture<Void>> puts = new ArrayList<>(ids.size());
      for (int i = 0; i < ids.size(); i++) puts.add(store.put(ids.get(i), vectors.get(i)));
      return CompletableFuture.allOf(puts.toArray(CompletableFuture[]::new)).thenApply(v -> {
        synchronized (queue) {
          // a newer text queued meanwhile stays queued
          batch.forEach(queue::remove);
        }
        return ids.size();
      });
    });
  }
}
