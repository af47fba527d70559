package io.github.panghy.tokengraph.storage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * The minimal transactional key/value capability set the stores depend on.
 *
 * <p>Reads observe writes made earlier in the same transaction. Writes become visible to other
 * transactions only once the enclosing {@link StorageBackend#runAsync} future completes.</p>
 */
public interface StorageTransaction {

  /**
   * Reads a single key.
   *
   * @param key the key
   * @return future with the value or null if absent
   */
  CompletableFuture<byte[]> get(byte[] key);

  /**
   * Writes a key. Throws {@link IllegalStateException} on a read-only transaction.
   */
  void set(byte[] key, byte[] value);

  /**
   * Deletes a key. Throws {@link IllegalStateException} on a read-only transaction.
   */
  void clear(byte[] key);

  /**
   * Visits every entry whose key starts with {@code prefix}, in unsigned key order.
   *
   * @param prefix  the key prefix
   * @param visitor called per entry; returning {@code false} stops the scan
   * @return future completing once the scan finished or was stopped
   */
  CompletableFuture<Void> scan(byte[] prefix, Predicate<StoredEntry> visitor);

  /**
   * Reads at most {@code limit} entries under {@code prefix} whose keys sort after {@code after}, or
   * from the start of the prefix when {@code after} is null.
   *
   * @param prefix the key prefix
   * @param after  exclusive lower bound, or null
   * @param limit  maximum number of entries
   * @return future with the entries in unsigned key order
   */
  default CompletableFuture<List<StoredEntry>> readRange(byte[] prefix, byte[] after, int limit) {
    if (limit <= 0) throw new IllegalArgumentException("limit must be positive");
    List<StoredEntry> entries = new ArrayList<>();
    return scan(prefix, entry -> {
          if (after != null && Arrays.compareUnsigned(entry.key(), after) <= 0) return true;
          entries.add(entry);
          return entries.size() < limit;
        })
        .thenApply(v -> entries);
  }

  /**
   * Collects every entry under {@code prefix}.
   */
  default CompletableFuture<List<StoredEntry>> scanAll(byte[] prefix) {
    List<StoredEntry> entries = new ArrayList<>();
    return scan(prefix, entry -> {
          entries.add(entry);
          return true;
        })
        .thenApply(v -> entries);
  }
}
