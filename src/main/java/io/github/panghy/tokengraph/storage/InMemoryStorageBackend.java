package io.github.panghy.tokengraph.storage;

import static java.util.concurrent.CompletableFuture.completedFuture;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-lifetime key/value backend over a sorted map.
 *
 * <p>Read/write transactions are serialized: each one starts after the previous commit, buffers
 * its writes, and applies them atomically under a write lock. Read-only transactions run
 * immediately against committed state.</p>
 */
public final class InMemoryStorageBackend implements StorageBackend {
  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryStorageBackend.class);

  private final NavigableMap<byte[], byte[]> data = new ConcurrentSkipListMap<>(Arrays::compareUnsigned);
  private final ReadWriteLock commitLock = new ReentrantReadWriteLock();
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final Object tailLock = new Object();
  private CompletableFuture<Void> writeTail = completedFuture(null);

  @Override
  public String name() {
    return "memory";
  }

  @Override
  public boolean isDurable() {
    return false;
  }

  @Override
  public <T> CompletableFuture<T> runAsync(
      Function<? super StorageTransaction, ? extends CompletableFuture<T>> body) {
    ensureOpen();
    CompletableFuture<T> result = new CompletableFuture<>();
    synchronized (tailLock) {
      writeTail = writeTail.thenCompose(ignored -> execute(body, result));
    }
    return result;
  }

  @Override
  public <T> CompletableFuture<T> readAsync(
      Function<? super StorageTransaction, ? extends CompletableFuture<T>> body) {
    ensureOpen();
    try {
      return body.apply(new BufferedTransaction(false));
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /** Number of committed keys, used by tests and status output. */
  public int size() {
    return data.size();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      LOGGER.debug("Closing in-memory backend keys={}", data.size());
    }
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("Storage backend is closed");
    }
  }

  private <T> CompletableFuture<Void> execute(
      Function<? super StorageTransaction, ? extends CompletableFuture<T>> body, CompletableFuture<T> result) {
    BufferedTransaction tx = new BufferedTransaction(true);
    CompletableFuture<T> future;
    try {
      future = body.apply(tx);
    } catch (RuntimeException e) {
      future = CompletableFuture.failedFuture(e);
    }
    return future.handle((value, error) -> {
      if (error != null) {
        result.completeExceptionally(error);
      } else {
        tx.commit();
        result.complete(value);
      }
      return null;
    });
  }

  private final class BufferedTransaction implements StorageTransaction {
    private final boolean writable;
    // A null value marks a cleared key
    private final TreeMap<byte[], byte[]> writes = new TreeMap<>(Arrays::compareUnsigned);

    private BufferedTransaction(boolean writable) {
      this.writable = writable;
    }

    @Override
    public CompletableFuture<byte[]> get(byte[] key) {
      if (writes.containsKey(key)) {
        return completedFuture(copy(writes.get(key)));
      }
      commitLock.readLock().lock();
      try {
        return completedFuture(copy(data.get(key)));
      } finally {
        commitLock.readLock().unlock();
      }
    }

    @Override
    public void set(byte[] key, byte[] value) {
      requireWritable();
      writes.put(key.clone(), value.clone());
    }

    @Override
    public void clear(byte[] key) {
      requireWritable();
      writes.put(key.clone(), null);
    }

    @Override
    public CompletableFuture<Void> scan(byte[] prefix, Predicate<StoredEntry> visitor) {
      TreeMap<byte[], byte[]> view = new TreeMap<>(Arrays::compareUnsigned);
      commitLock.readLock().lock();
      try {
        for (Map.Entry<byte[], byte[]> e : data.tailMap(prefix, true).entrySet()) {
          if (!startsWith(e.getKey(), prefix)) break;
          view.put(e.getKey(), e.getValue());
        }
      } finally {
        commitLock.readLock().unlock();
      }
      for (Map.Entry<byte[], byte[]> e : writes.tailMap(prefix, true).entrySet()) {
        if (!startsWith(e.getKey(), prefix)) break;
        if (e.getValue() == null) {
          view.remove(e.getKey());
        } else {
          view.put(e.getKey(), e.getValue());
        }
      }
      for (Map.Entry<byte[], byte[]> e : view.entrySet()) {
        if (!visitor.test(new StoredEntry(e.getKey().clone(), e.getValue().clone()))) {
          break;
        }
      }
      return completedFuture(null);
    }

    @Override
    public CompletableFuture<List<StoredEntry>> readRange(byte[] prefix, byte[] after, int limit) {
      if (!writes.isEmpty()) {
        return StorageTransaction.super.readRange(prefix, after, limit);
      }
      if (limit <= 0) throw new IllegalArgumentException("limit must be positive");
      boolean fromPrefix = after == null || Arrays.compareUnsigned(after, prefix) < 0;
      List<StoredEntry> entries = new ArrayList<>();
      commitLock.readLock().lock();
      try {
        Map<byte[], byte[]> tail = fromPrefix ? data.tailMap(prefix, true) : data.tailMap(after, false);
        for (Map.Entry<byte[], byte[]> e : tail.entrySet()) {
          if (!startsWith(e.getKey(), prefix) || entries.size() == limit) break;
          entries.add(new StoredEntry(e.getKey().clone(), e.getValue().clone()));
        }
      } finally {
        commitLock.readLock().unlock();
      }
      return completedFuture(entries);
    }

    private void commit() {
      if (writes.isEmpty()) return;
      commitLock.writeLock().lock();
      try {
        for (Map.Entry<byte[], byte[]> e : writes.entrySet()) {
          if (e.getValue() == null) {
            data.remove(e.getKey());
          } else {
            data.put(e.getKey(), e.getValue());
          }
        }
      } finally {
        commitLock.writeLock().unlock();
      }
    }

    private void requireWritable() {
      if (!writable) {
        throw new IllegalStateException("Write attempted in a read-only transaction");
      }
    }
  }

  static boolean startsWith(byte[] key, byte[] prefix) {
    if (key.length < prefix.length) return false;
    return Arrays.equals(key, 0, prefix.length, prefix, 0, prefix.length);
  }

  private static byte[] copy(byte[] value) {
    return value == null ? null : value.clone();
  }
}
