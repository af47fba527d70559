package io.github.panghy.tokengraph.vector;

import static java.util.concurrent.CompletableFuture.completedFuture;

import com.github.benmanes.caffeine.cache.AsyncLoadingCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.panghy.tokengraph.DimensionMismatchException;
import io.github.panghy.tokengraph.NotInitializedException;
import io.github.panghy.tokengraph.proto.EmbeddingRecord;
import io.github.panghy.tokengraph.storage.GraphKeys;
import io.github.panghy.tokengraph.storage.StorageBackend;
import io.github.panghy.tokengraph.util.VectorMath;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vector store on a {@link StorageBackend} with an in-process read cache.
 *
 * <p>Records are {@link EmbeddingRecord} protobufs keyed by {@code (provider, dim, tokenId)}.
 * The cache holds vectors exactly as a reader would decode them, so hits and misses agree. It may
 * be filled redundantly by concurrent readers.</p>
 */
public class PersistentVectorStore implements VectorStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(PersistentVectorStore.class);

  private final StorageBackend backend;
  private final GraphKeys keys;
  private final VectorStoreConfig config;
  private final SimilarityIndex index;
  private final AtomicBoolean initialized = new AtomicBoolean(false);

  // Cache for decoded vectors
  private final AsyncLoadingCache<VectorCacheKey, float[]> cache;

  public PersistentVectorStore(StorageBackend backend, GraphKeys keys, VectorStoreConfig config) {
    this(backend, keys, config,
        new FlatSimilarityIndex(backend, keys, config.getProvider(), config.getDimension()));
  }

  public PersistentVectorStore(
      StorageBackend backend, GraphKeys keys, VectorStoreConfig config, SimilarityIndex index) {
    this.backend = backend;
    this.keys = keys;
    this.config = config;
    this.index = index;
    this.cache = Caffeine.newBuilder()
        .maximumSize(config.getCacheMaxSize())
        .buildAsync((key, executor) -> load(key));
  }

  @Override
  public CompletableFuture<Void> init() {
    initialized.set(true);
    LOGGER.debug("Vector store ready provider={} dim={} quantize8={} normalize={}",
        config.getProvider(), config.getDimension(), config.isQuantize8(), config.isNormalize());
    return completedFuture(null);
  }

  @Override
  public boolean isInitialized() {
    return initialized.get();
  }

  @Override
  public String provider() {
    return config.getProvider();
  }

  @Override
  public int dimension() {
    return config.getDimension();
  }

  @Override
  public CompletableFuture<Void> put(long tokenId, float[] vector) {
    if (!initialized.get()) return notInitialized();
    if (vector.length != config.getDimension()) {
      return CompletableFuture.failedFuture(new DimensionMismatchException(config.getDimension(), vector.length));
    }
    if (!VectorMath.isFinite(vector)) {
      return CompletableFuture.failedFuture(
          new IllegalArgumentException("Vector for tokenId=" + tokenId + " has non-finite components"));
    }
    float[] prepared = config.isNormalize() ? VectorMath.normalize(vector) : vector.clone();
    EmbeddingRecord record = EmbeddingRecords.toRecord(
        tokenId, config.getProvider(), config.getDimension(), prepared, config.isQuantize8(),
        config.getInstantSource().instant());
    byte[] key = keys.vectorKey(config.getProvider(), config.getDimension(), tokenId);
    return backend.<Void>runAsync(tx -> {
          tx.set(key, record.toByteArray());
          return completedFuture(null);
        })
        .thenRun(() -> cache.put(cacheKey(tokenId), completedFuture(EmbeddingRecords.toVector(record))));
  }

  @Override
  public CompletableFuture<float[]> get(long tokenId) {
    if (!initialized.get()) return notInitialized();
    return cache.get(cacheKey(tokenId)).thenApply(v -> v == null ? null : v.clone());
  }

  @Override
  public CompletableFuture<List<ScoredToken>> similar(long tokenId, int topK) {
    if (!initialized.get()) return notInitialized();
    return get(tokenId).thenCompose(origin -> {
      if (origin == null) return completedFuture(List.of());
      return index.search(tokenId, origin, topK);
    });
  }

  private CompletableFuture<float[]> load(VectorCacheKey key) {
    byte[] storageKey = keys.vectorKey(key.provider(), key.dimension(), key.tokenId());
    return backend.readAsync(tx -> tx.get(storageKey))
        .thenApply(bytes -> bytes == null ? null : EmbeddingRecords.toVector(EmbeddingRecords.parse(bytes)));
  }

  private VectorCacheKey cacheKey(long tokenId) {
    return new VectorCacheKey(config.getProvider(), config.getDimension(), tokenId);
  }

  private static <T> CompletableFuture<T> notInitialized() {
    return CompletableFuture.failedFuture(new NotInitializedException("VectorStore"));
  }
}
