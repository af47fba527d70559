package io.github.panghy.tokengraph.storage;

import java.time.Duration;
import java.util.Objects;

/**
 * Selects and parameterizes the storage backend.
 *
 * <p>Uses a builder, validates inputs, and exposes getters only.</p>
 */
public final class StorageConfig {

  public enum Kind {
    /** Process-lifetime sorted map. */
    MEMORY,
    /** FoundationDB cluster, degrading to {@link #MEMORY} if it cannot be reached. */
    FDB
  }

  private final Kind kind;
  private final String clusterFile;
  private final int apiVersion;
  private final String rootPrefix;
  private final Duration connectTimeout;

  private StorageConfig(Builder b) {
    this.kind = Objects.requireNonNull(b.kind, "kind must not be null");
    this.clusterFile = b.clusterFile;
    if (b.apiVersion <= 0) throw new IllegalArgumentException("apiVersion must be positive");
    this.apiVersion = b.apiVersion;
    if (b.rootPrefix == null || b.rootPrefix.isBlank()) {
      throw new IllegalArgumentException("rootPrefix must not be blank");
    }
    this.rootPrefix = b.rootPrefix;
    Objects.requireNonNull(b.connectTimeout, "connectTimeout must not be null");
    if (b.connectTimeout.isZero() || b.connectTimeout.isNegative()) {
      throw new IllegalArgumentException("connectTimeout must be positive");
    }
    this.connectTimeout = b.connectTimeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** In-memory config with the default root prefix. */
  public static StorageConfig inMemory() {
    return builder().kind(Kind.MEMORY).build();
  }

  public Kind getKind() {
    return kind;
  }

  /** Cluster file path, or null for the default cluster file. */
  public String getClusterFile() {
    return clusterFile;
  }

  public int getApiVersion() {
    return apiVersion;
  }

  /** Root tuple element every key is nested under. */
  public String getRootPrefix() {
    return rootPrefix;
  }

  /** How long opening a FoundationDB backend waits for the cluster before giving up. */
  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public static final class Builder {
    private Kind kind = Kind.MEMORY;
    private String clusterFile;
    private int apiVersion = 730;
    private String rootPrefix = "tokengraph";
    private Duration connectTimeout = Duration.ofSeconds(5);

    private Builder() {}

    public Builder kind(Kind kind) {
      this.kind = kind;
      return this;
    }

    public Builder clusterFile(String clusterFile) {
      this.clusterFile = clusterFile;
      return this;
    }

    public Builder apiVersion(int apiVersion) {
      this.apiVersion = apiVersion;
      return this;
    }

    public Builder rootPrefix(String rootPrefix) {
      this.rootPrefix = rootPrefix;
      return this;
    }

    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public StorageConfig build() {
      return new StorageConfig(this);
    }
  }
}
