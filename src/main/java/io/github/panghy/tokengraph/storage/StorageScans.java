package io.github.panghy.tokengraph.storage;

import com.apple.foundationdb.async.AsyncUtil;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Scans that span many read transactions, so a large keyspace never has to be read inside a
 * single one.
 */
public final class StorageScans {

  private StorageScans() {}

  /**
   * Visits every entry under {@code prefix} one page at a time. Each page is read in its own
   * transaction and resumes after the last key of the previous page.
   *
   * @param backend  the backend to read from
   * @param prefix   the key prefix
   * @param pageSize entries read per transaction
   * @param executor executor for loop continuations
   * @param consumer called per page; returning {@code false} stops the scan
   * @return future completing once every page was consumed or the consumer stopped
   */
  public static CompletableFuture<Void> forEachPage(
      StorageBackend backend,
      byte[] prefix,
      int pageSize,
      Executor executor,
      Predicate<List<StoredEntry>> consumer) {
    return forEachPage(backend, prefix, pageSize, null, executor, consumer);
  }

  /**
   * Like {@link #forEachPage(StorageBackend, byte[], int, Executor, Predicate)}, but a page never
   * ends inside a run of adjacent keys that map to the same group. A group must fit in one page.
   *
   * @param groupOf maps a key to its group, or null to page on raw entries
   */
  public static CompletableFuture<Void> forEachPage(
      StorageBackend backend,
      byte[] prefix,
      int pageSize,
      Function<byte[], ?> groupOf,
      Executor executor,
      Predicate<List<StoredEntry>> consumer) {
    if (pageSize <= 0) throw new IllegalArgumentException("pageSize must be positive");
    AtomicReference<byte[]> cursor = new AtomicReference<>();
    return AsyncUtil.whileTrue(
        () -> backend.<List<StoredEntry>>readAsync(tx -> tx.readRange(prefix, cursor.get(), pageSize))
            .thenApply(page -> {
              if (page.isEmpty()) return false;
              boolean last = page.size() < pageSize;
              List<StoredEntry> complete = last || groupOf == null ? page : withoutTrailingGroup(page, groupOf);
              if (complete.isEmpty()) {
                throw new IllegalStateException("A key group spans more than " + pageSize + " entries");
              }
              cursor.set(complete.get(complete.size() - 1).key());
              return consumer.test(complete) && !last;
            }),
        executor);
  }

  private static List<StoredEntry> withoutTrailingGroup(List<StoredEntry> page, Function<byte[], ?> groupOf) {
    Object tail = groupOf.apply(page.get(page.size() - 1).key());
    int end = page.size();
    while (end > 0 && Objects.equals(groupOf.apply(page.get(end - 1).key()), tail)) end--;
    return page.subList(0, end);
  }
}
