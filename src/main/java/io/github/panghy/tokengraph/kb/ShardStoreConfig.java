package io.github.panghy.tokengraph.kb;

import java.time.InstantSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Configuration for a {@link ShardStore}.
 */
public final class ShardStoreConfig {
  private final boolean preferCompression;
  private final int maintenanceBatchSize;
  private final int scanPageSize;
  private final Executor backgroundExecutor;
  private final InstantSource instantSource;
  private final List<ShardStoreListener> listeners;

  private ShardStoreConfig(Builder b) {
    this.preferCompression = b.preferCompression;
    if (b.maintenanceBatchSize <= 0) throw new IllegalArgumentException("maintenanceBatchSize must be positive");
    this.maintenanceBatchSize = b.maintenanceBatchSize;
    if (b.scanPageSize <= BlockChunks.MAX_CHUNKS) {
      throw new IllegalArgumentException("scanPageSize must be greater than " + BlockChunks.MAX_CHUNKS);
    }
    this.scanPageSize = b.scanPageSize;
    this.backgroundExecutor = Objects.requireNonNull(b.backgroundExecutor, "backgroundExecutor must not be null");
    this.instantSource = Objects.requireNonNull(b.instantSource, "instantSource must not be null");
    this.listeners = List.copyOf(b.listeners);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ShardStoreConfig defaults() {
    return builder().build();
  }

  /** A builder holding this config's values and listeners. */
  public Builder toBuilder() {
    return builder()
        .preferCompression(preferCompression)
        .maintenanceBatchSize(maintenanceBatchSize)
        .scanPageSize(scanPageSize)
        .backgroundExecutor(backgroundExecutor)
        .instantSource(instantSource)
        .listeners(listeners);
  }

  /** Whether to gzip blocks when the runtime supports it. */
  public boolean isPreferCompression() {
    return preferCompression;
  }

  /**
   * Number of blocks rewritten per transaction by compact and gc. Default 8, which keeps a batch
   * of full blocks under FoundationDB's 10MB transaction limit.
   */
  public int getMaintenanceBatchSize() {
    return maintenanceBatchSize;
  }

  /** Entries read per transaction by store-wide scans. */
  public int getScanPageSize() {
    return scanPageSize;
  }

  /**
   * Executor running continuations of multi-step operations such as gc, compact, prune and bulk
   * import. Default: ForkJoinPool.commonPool().
   */
  public Executor getBackgroundExecutor() {
    return backgroundExecutor;
  }

  public InstantSource getInstantSource() {
    return instantSource;
  }

  public List<ShardStoreListener> getListeners() {
    return listeners;
  }

  public static final class Builder {
    private boolean preferCompression = true;
    private int maintenanceBatchSize = 8;
    private int scanPageSize = 512;
    private Executor backgroundExecutor = ForkJoinPool.commonPool();
    private InstantSource instantSource = InstantSource.system();
    private final List<ShardStoreListener> listeners = new ArrayList<>();

    private Builder() {}

    public Builder preferCompression(boolean preferCompression) {
      this.preferCompression = preferCompression;
      return this;
    }

    public Builder maintenanceBatchSize(int maintenanceBatchSize) {
      this.maintenanceBatchSize = maintenanceBatchSize;
      return this;
    }

    public Builder scanPageSize(int scanPageSize) {
      this.scanPageSize = scanPageSize;
      return this;
    }

    public Builder backgroundExecutor(Executor backgroundExecutor) {
      this.backgroundExecutor = backgroundExecutor;
      return this;
    }

    public Builder instantSource(InstantSource instantSource) {
      this.instantSource = instantSource;
      return this;
    }

    public Builder listener(ShardStoreListener listener) {
      this.listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
      return this;
    }

    public Builder listeners(List<ShardStoreListener> listeners) {
      listeners.forEach(this::listener);
      return this;
    }

    public ShardStoreConfig build() {
      return new ShardStoreConfig(this);
    }
  }
}
