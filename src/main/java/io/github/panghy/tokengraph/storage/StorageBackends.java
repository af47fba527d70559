package io.github.panghy.tokengraph.storage;

import io.github.panghy.tokengraph.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the storage backend once, at open time.
 *
 * <p>A durable backend that cannot be opened degrades to {@link InMemoryStorageBackend} with a
 * warning. The choice never changes afterwards.</p>
 */
public final class StorageBackends {
  private static final Logger LOGGER = LoggerFactory.getLogger(StorageBackends.class);

  /** Opens a durable backend for a config. */
  @FunctionalInterface
  public interface DurableOpener {
    StorageBackend open(StorageConfig config) throws StorageUnavailableException;
  }

  private StorageBackends() {}

  public static StorageBackend open(StorageConfig config) {
    return open(config, FdbStorageBackend::open);
  }

  public static StorageBackend open(StorageConfig config, DurableOpener opener) {
    if (config.getKind() == StorageConfig.Kind.MEMORY) {
      return new InMemoryStorageBackend();
    }
    try {
      StorageBackend backend = opener.open(config);
      LOGGER.info("Opened {} storage backend root={}", backend.name(), config.getRootPrefix());
      return backend;
    } catch (StorageUnavailableException e) {
      LOGGER.warn(
          "Durable storage unavailable, continuing with in-memory storage (data lasts for this process only)",
          e);
      return new InMemoryStorageBackend();
    }
  }
}
