package io.github.panghy.tokengraph;

import io.github.panghy.tokengraph.growth.GrowthConfig;
import io.github.panghy.tokengraph.kb.ShardStoreConfig;
import io.github.panghy.tokengraph.storage.StorageConfig;
import io.github.panghy.tokengraph.vector.EmbeddingProvider;
import io.github.panghy.tokengraph.vector.VectorStoreConfig;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything {@link TokenGraph#open} needs.
 */
public final class TokenGraphConfig {
  private final StorageConfig storage;
  private final ShardStoreConfig shardStore;
  private final VectorStoreConfig vectors;
  private final GrowthConfig growth;
  private final EmbeddingProvider embeddingProvider;
  private final Path exportDirectory;

  private TokenGraphConfig(Builder b) {
    this.storage = Objects.requireNonNull(b.storage, "storage must not be null");
    this.shardStore = Objects.requireNonNull(b.shardStore, "shardStore must not be null");
    this.vectors = Objects.requireNonNull(b.vectors, "vectors must not be null");
    this.growth = Objects.requireNonNull(b.growth, "growth must not be null");
    if (b.embeddingProvider != null) {
      if (b.embeddingProvider.dimension() != b.vectors.getDimension()) {
        throw new IllegalArgumentException("embeddingProvider dimension " + b.embeddingProvider.dimension()
            + " does not match vector dimension " + b.vectors.getDimension());
      }
      if (!b.embeddingProvider.name().equals(b.vectors.getProvider())) {
        throw new IllegalArgumentException("embeddingProvider '" + b.embeddingProvider.name()
            + "' does not match vector provider '" + b.vectors.getProvider() + "'");
      }
    }
    this.embeddingProvider = b.embeddingProvider;
    this.exportDirectory = b.exportDirectory;
  }

  public static Builder builder() {
    return new Builder();
  }

  public StorageConfig getStorage() {
    return storage;
  }

  public ShardStoreConfig getShardStore() {
    return shardStore;
  }

  public VectorStoreConfig getVectors() {
    return vectors;
  }

  public GrowthConfig getGrowth() {
    return growth;
  }

  /** Embedding provider, or null to use the hashing provider. */
  public EmbeddingProvider getEmbeddingProvider() {
    return embeddingProvider;
  }

  /** Directory of the JSON export mirror, or null when disabled. */
  public Path getExportDirectory() {
    return exportDirectory;
  }

  public static final class Builder {
    private StorageConfig storage = StorageConfig.inMemory();
    private ShardStoreConfig shardStore = ShardStoreConfig.defaults();
    private VectorStoreConfig vectors = VectorStoreConfig.builder().build();
    private GrowthConfig growth = GrowthConfig.builder().build();
    private EmbeddingProvider embeddingProvider;
    private Path exportDirectory;

    private Builder() {}

    public Builder storage(StorageConfig storage) {
      this.storage = storage;
      return this;
    }

    public Builder shardStore(ShardStoreConfig shardStore) {
      this.shardStore = shardStore;
      return this;
    }

    public Builder vectors(VectorStoreConfig vectors) {
      this.vectors = vectors;
      return this;
    }

    public Builder growth(GrowthConfig growth) {
      this.growth = growth;
      return this;
    }

    public Builder embeddingProvider(EmbeddingProvider embeddingProvider) {
      this.embeddingProvider = embeddingProvider;
      return this;
    }

    public Builder exportDirectory(Path exportDirectory) {
      this.exportDirectory = exportDirectory;
      return this;
    }

    public TokenGraphConfig build() {
      return new TokenGraphConfig(this);
    }
  }
}
