package io.github.panghy.tokengraph.storage;

import com.apple.foundationdb.Database;
import com.apple.foundationdb.FDB;
import com.apple.foundationdb.FDBException;
import com.apple.foundationdb.KeySelector;
import com.apple.foundationdb.KeyValue;
import com.apple.foundationdb.Range;
import com.apple.foundationdb.ReadTransaction;
import com.apple.foundationdb.Transaction;
import com.apple.foundationdb.async.AsyncIterator;
import com.apple.foundationdb.tuple.Tuple;
import io.github.panghy.tokengraph.StorageUnavailableException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable backend on a FoundationDB cluster.
 *
 * <p>Transactions map directly onto {@link Database#runAsync} and {@link Database#readAsync}, so
 * conflicting read/write transactions are retried by the client library.</p>
 */
public final class FdbStorageBackend implements StorageBackend {
  private static final Logger LOGGER = LoggerFactory.getLogger(FdbStorageBackend.class);

  /** Largest value FoundationDB accepts. */
  public static final int MAX_VALUE_BYTES = 100_000;

  private final Database db;

  public FdbStorageBackend(Database db) {
    this.db = db;
  }

  /**
   * Opens the configured cluster and verifies it answers a read within the connect timeout.
   *
   * @param config storage configuration
   * @return an open backend
   * @throws StorageUnavailableException if the native client is missing or the cluster is unreachable
   */
  public static FdbStorageBackend open(StorageConfig config) throws StorageUnavailableException {
    Database db;
    try {
      FDB fdb = FDB.selectAPIVersion(config.getApiVersion());
      db = config.getClusterFile() == null ? fdb.open() : fdb.open(config.getClusterFile());
    } catch (FDBException | UnsatisfiedLinkError | IllegalArgumentException e) {
      throw new StorageUnavailableException("Unable to open FoundationDB client", e);
    }
    FdbStorageBackend backend = new FdbStorageBackend(db);
    try {
      backend.checkReachable(config);
    } catch (StorageUnavailableException e) {
      db.close();
      throw e;
    }
    return backend;
  }

  private void checkReachable(StorageConfig config) throws StorageUnavailableException {
    long timeoutMs = config.getConnectTimeout().toMillis();
    byte[] markerKey = Tuple.from(config.getRootPrefix(), "meta", "schemaVersion").pack();
    try {
      db.runAsync(tr -> {
            tr.options().setTimeout(timeoutMs);
            return tr.get(markerKey);
          })
          .get(timeoutMs * 2, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StorageUnavailableException("Interrupted while connecting to FoundationDB", e);
    } catch (ExecutionException | TimeoutException e) {
      throw new StorageUnavailableException("FoundationDB cluster did not answer the schema marker read", e);
    }
  }

  @Override
  public String name() {
    return "fdb";
  }

  @Override
  public boolean isDurable() {
    return true;
  }

  @Override
  public <T> CompletableFuture<T> runAsync(
      Function<? super StorageTransaction, ? extends CompletableFuture<T>> body) {
    return db.runAsync(tr -> body.apply(new FdbTransaction(tr, tr)));
  }

  @Override
  public <T> CompletableFuture<T> readAsync(
      Function<? super StorageTransaction, ? extends CompletableFuture<T>> body) {
    return db.readAsync(tr -> body.apply(new FdbTransaction(tr, null)));
  }

  @Override
  public void close() {
    LOGGER.debug("Closing FoundationDB backend");
    db.close();
  }

  private static final class FdbTransaction implements StorageTransaction {
    private final ReadTransaction reader;
    private final Transaction writer;

    private FdbTransaction(ReadTransaction reader, Transaction writer) {
      this.reader = reader;
      this.writer = writer;
    }

    @Override
    public CompletableFuture<byte[]> get(byte[] key) {
      return reader.get(key);
    }

    @Override
    public void set(byte[] key, byte[] value) {
      if (value.length > MAX_VALUE_BYTES) {
        throw new IllegalArgumentException(
            "Value of " + value.length + " bytes exceeds the " + MAX_VALUE_BYTES + "-byte limit");
      }
      requireWriter().set(key, value);
    }

    @Override
    public void clear(byte[] key) {
      requireWriter().clear(key);
    }

    @Override
    public CompletableFuture<Void> scan(byte[] prefix, Predicate<StoredEntry> visitor) {
      CompletableFuture<Void> done = new CompletableFuture<>();
      AsyncIterator<KeyValue> iterator = reader.getRange(Range.startsWith(prefix)).iterator();
      visitNext(iterator, visitor, done);
      return done;
    }

    @Override
    public CompletableFuture<List<StoredEntry>> readRange(byte[] prefix, byte[] after, int limit) {
      if (limit <= 0) throw new IllegalArgumentException("limit must be positive");
      Range range = Range.startsWith(prefix);
      KeySelector begin = after == null
          ? KeySelector.firstGreaterOrEqual(range.begin)
          : KeySelector.firstGreaterThan(after);
      return reader.getRange(begin, KeySelector.firstGreaterOrEqual(range.end), limit)
          .asList()
          .thenApply(kvs -> {
            List<StoredEntry> entries = new ArrayList<>(kvs.size());
            for (KeyValue kv : kvs) entries.add(new StoredEntry(kv.getKey(), kv.getValue()));
            return entries;
          });
    }

    /**
     * Recursively visits items from the async iterator until exhausted or the visitor stops.
     */
    private static void visitNext(
        AsyncIterator<KeyValue> iterator, Predicate<StoredEntry> visitor, CompletableFuture<Void> done) {
      iterator.onHasNext()
          .thenAccept(hasNext -> {
            if (!hasNext) {
              done.complete(null);
              return;
            }
            KeyValue kv = iterator.next();
            if (visitor.test(new StoredEntry(kv.getKey(), kv.getValue()))) {
              visitNext(iterator, visitor, done);
            } else {
              iterator.cancel();
              done.complete(null);
            }
          })
          .exceptionally(e -> {
            done.completeExceptionally(e);
            return null;
          });
    }

    private Transaction requireWriter() {
      if (writer == null) {
        throw new IllegalStateException("Write attempted in a read-only transaction");
      }
      return writer;
    }
  }
}
