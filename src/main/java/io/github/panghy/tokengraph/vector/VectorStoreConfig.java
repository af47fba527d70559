package io.github.panghy.tokengraph.vector;

import java.time.Duration;
import java.time.InstantSource;
import java.util.Objects;

/**
 * Configuration for the vector store and its ingestion queue.
 *
 * <p>Embeddings are namespaced by {@code (provider, dimension)}: vectors written under one pair
 * are never compared with vectors of another.</p>
 */
public final class VectorStoreConfig {
  private final String provider;
  private final int dimension;
  private final boolean quantize8;
  private final boolean normalize;
  private final int batchSize;
  private final int cacheMaxSize;
  private final Duration flushDelay;
  private final InstantSource instantSource;

  private VectorStoreConfig(Builder b) {
    if (b.provider == null || b.provider.isBlank()) throw new IllegalArgumentException("provider must not be blank");
    this.provider = b.provider;
    if (b.dimension <= 0) throw new IllegalArgumentException("dimension must be positive");
    this.dimension = b.dimension;
    this.quantize8 = b.quantize8;
    this.normalize = b.normalize;
    if (b.batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive");
    this.batchSize = b.batchSize;
    if (b.cacheMaxSize < 0) throw new IllegalArgumentException("cacheMaxSize must be >= 0");
    this.cacheMaxSize = b.cacheMaxSize;
    Objects.requireNonNull(b.flushDelay, "flushDelay must not be null");
    if (b.flushDelay.isNegative()) throw new IllegalArgumentException("flushDelay must not be negative");
    this.flushDelay = b.flushDelay;
    this.instantSource = Objects.requireNonNull(b.instantSource, "instantSource must not be null");
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the embedding provider name. */
  public String getProvider() {
    return provider;
  }

  /** Returns the fixed embedding dimension. */
  public int getDimension() {
    return dimension;
  }

  /** Whether vectors are stored as 8-bit affine-quantized bytes. */
  public boolean isQuantize8() {
    return quantize8;
  }

  /** Whether vectors are L2-normalized before storage. */
  public boolean isNormalize() {
    return normalize;
  }

  /** Returns the maximum number of texts per embedding batch. */
  public int getBatchSize() {
    return batchSize;
  }

  public int getCacheMaxSize() {
    return cacheMaxSize;
  }

  /** Returns the idle delay before a scheduled flush runs. */
  public Duration getFlushDelay() {
    return flushDelay;
  }

  public InstantSource getInstantSource() {
    return instantSource;
  }

  public static final class Builder {
    private String provider = HashingEmbeddingProvider.NAME;
    private int dimension = 384;
    private boolean quantize8 = true;
    private boolean normalize = true;
    private int batchSize = 64;
    private int cacheMaxSize = 10_000;
    private Duration flushDelay = Duration.ofMillis(20);
    private InstantSource instantSource = InstantSource.system();

    private Builder() {}

    public Builder provider(String provider) {
      this.provider = provider;
      return this;
    }

    public Builder dimension(int dimension) {
      this.dimension = dimension;
      return this;
    }

    public Builder quantize8(boolean quantize8) {
      this.quantize8 = quantize8;
      return this;
    }

    public Builder normalize(boolean normalize) {
      this.normalize = normalize;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder cacheMaxSize(int cacheMaxSize) {
      this.cacheMaxSize = cacheMaxSize;
      return this;
    }

    public Builder flushDelay(Duration flushDelay) {
      this.flushDelay = flushDelay;
      return this;
    }

    public Builder instantSource(InstantSource instantSource) {
      this.instantSource = instantSource;
      return this;
    }

    public VectorStoreConfig build() {
      return new VectorStoreConfig(this);
    }
  }
}
