package io.github.panghy.tokengraph.kb;

import static java.util.concurrent.CompletableFuture.completedFuture;

import com.apple.foundationdb.async.AsyncUtil;
import com.apple.foundationdb.tuple.Tuple;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Timestamp;
import io.github.panghy.tokengraph.NotInitializedException;
import io.github.panghy.tokengraph.TokenGraphException;
import io.github.panghy.tokengraph.codec.EdgeAccumulator;
import io.github.panghy.tokengraph.codec.EdgeBlock;
import io.github.panghy.tokengraph.codec.EdgeBlockCodec;
import io.github.panghy.tokengraph.codec.EdgeBlockCodecs;
import io.github.panghy.tokengraph.codec.EdgeBlockEncodingException;
import io.github.panghy.tokengraph.codec.EdgeRow;
import io.github.panghy.tokengraph.kb.BlockChunks.BlockId;
import io.github.panghy.tokengraph.kb.BlockChunks.StoredBlock;
import io.github.panghy.tokengraph.proto.StoreMeta;
import io.github.panghy.tokengraph.storage.GraphKeys;
import io.github.panghy.tokengraph.storage.StorageBackend;
import io.github.panghy.tokengraph.storage.StorageScans;
import io.github.panghy.tokengraph.storage.StorageTransaction;
import io.github.panghy.tokengraph.storage.StoredEntry;
import io.github.panghy.tokengraph.util.BytePacker;
import io.github.panghy.tokengraph.util.Metrics;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.InstantSource;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keyed persistence of tokens and their sharded edge lists.
 *
 * <p>Each token's edges are stored as contiguous {@link EdgeBlock}s numbered from part 0, each
 * block split into chunks small enough for any backend. All methods return futures and fail with
 * {@link NotInitializedException} until {@link #init()} completed. Store-wide scans read
 * {@code scanPageSize} entries per transaction.</p>
 *
 * <p>Blocks that fail to decode are skipped by reads with a warning and removed by {@link #gc()}.
 * Callers must not upsert the same token concurrently; the last committed write wins.</p>
 */
public class ShardStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(ShardStore.class);

  public static final int SCHEMA_VERSION = 1;

  private static final Comparator<EdgeRow> BY_WEIGHT_DESC =
      Comparator.comparingLong(EdgeRow::weight).reversed();

  private final StorageBackend backend;
  private final GraphKeys keys;
  private final EdgeBlockCodec codec;
  private final InstantSource instantSource;
  private final List<ShardStoreListener> listeners;
  private final int maintenanceBatchSize;
  private final int scanPageSize;
  private final Executor executor;
  private final BlockChunks chunks;
  private final AtomicBoolean initialized = new AtomicBoolean(false);

  public ShardStore(StorageBackend backend, GraphKeys keys, ShardStoreConfig config) {
    this(backend, keys, config, EdgeBlockCodecs.select(config.isPreferCompression()));
  }

  public ShardStore(StorageBackend backend, GraphKeys keys, ShardStoreConfig config, EdgeBlockCodec codec) {
    this.backend = backend;
    this.keys = keys;
    this.codec = codec;
    this.instantSource = config.getInstantSource();
    this.listeners = config.getListeners();
    this.maintenanceBatchSize = config.getMaintenanceBatchSize();
    this.scanPageSize = config.getScanPageSize();
    this.executor = config.getBackgroundExecutor();
    this.chunks = new BlockChunks(keys);
  }

  /**
   * Writes the schema version marker (once) and enables the other operations.
   *
   * @return future completing when the store is ready
   */
  public CompletableFuture<Void> init() {
    byte[] key = keys.schemaVersionKey();
    return backend.<Void>runAsync(tx -> tx.get(key).thenApply(existing -> {
          if (existing == null) {
            tx.set(key, StoreMeta.newBuilder()
                .setSchemaVersion(SCHEMA_VERSION)
                .setCreatedAt(timestamp(instantSource.instant()))
                .build()
                .toByteArray());
            return null;
          }
          int version = parseMeta(existing).getSchemaVersion();
          if (version != SCHEMA_VERSION) {
            throw new TokenGraphException("Unsupported store schema version " + version);
          }
          return null;
        }))
        .thenRun(() -> {
          initialized.set(true);
          LOGGER.debug("ShardStore ready backend={} codec={}", backend.name(), codec.name());
        });
  }

  public boolean isInitialized() {
    return initialized.get();
  }

  /** The codec chosen for writing blocks. */
  public EdgeBlockCodec getCodec() {
    return codec;
  }

  /**
   * Returns the id of the trimmed {@code text}, allocating the next id if it is new. Ids start at
   * 1 and are never reused.
   *
   * @param text token text; blank text is rejected with {@link IllegalArgumentException}
   * @return future with the token id
   */
  public CompletableFuture<Long> ensureToken(String text) {
    if (!initialized.get()) return notInitialized();
    String normalized = text == null ? "" : text.trim();
    if (normalized.isEmpty()) {
      return CompletableFuture.failedFuture(new IllegalArgumentException("Token cannot be empty"));
    }
    byte[] textKey = keys.tokenByTextKey(normalized);
    AtomicBoolean created = new AtomicBoolean(false);
    return backend.<Long>runAsync(tx -> {
          created.set(false);
          return tx.get(textKey).thenCompose(existing -> {
            if (existing != null) {
              return completedFuture(Tuple.fromBytes(existing).getLong(0));
            }
            return tx.get(keys.nextTokenIdKey()).thenApply(counter -> {
              long id = counter == null ? 1L : BytePacker.bytesToLong(counter);
              tx.set(keys.nextTokenIdKey(), BytePacker.longToBytes(id + 1));
              tx.set(textKey, Tuple.from(id).pack());
              tx.set(keys.tokenByIdKey(id), normalized.getBytes(StandardCharsets.UTF_8));
              created.set(true);
              return id;
            });
          });
        })
        .thenApply(id -> {
          if (created.get()) {
            LOGGER.debug("Allocated token id={} text='{}'", id, normalized);
          }
          for (ShardStoreListener listener : listeners) {
            notifySafely(() -> listener.onTokenObserved(id, normalized, created.get()));
          }
          return id;
        });
  }

  /**
   * Returns the text of a token, or the empty string if the id is unknown.
   */
  public CompletableFuture<String> getToken(long tokenId) {
    if (!initialized.get()) return notInitialized();
    return backend.readAsync(tx -> tx.get(keys.tokenByIdKey(tokenId)))
        .thenApply(value -> value == null ? "" : new String(value, StandardCharsets.UTF_8));
  }

  /**
   * Lists every token in id order.
   */
  public CompletableFuture<List<TokenEntry>> listTokens() {
    if (!initialized.get()) return notInitialized();
    List<TokenEntry> tokens = new ArrayList<>();
    return StorageScans.forEachPage(backend, keys.tokenByIdPrefix(), scanPageSize, executor, page -> {
          for (StoredEntry e : page) {
            tokens.add(new TokenEntry(keys.tokenIdFromKey(e.key()), new String(e.value(), StandardCharsets.UTF_8)));
          }
          return true;
        })
        .thenApply(v -> tokens);
  }

  /**
   * Answers an adjacency query.
   *
   * <p>Forward mode reads the token's own blocks. Reverse mode scans every block in the store
   * for rows pointing at the token and stops as soon as {@code limit} matches were found. Rows
   * come back sorted by weight, highest first.</p>
   *
   * @param query the query
   * @return future with matching rows
   */
  public CompletableFuture<List<EdgeRow>> getAdj(AdjacencyQuery query) {
    if (!initialized.get()) return notInitialized();
    if (query.isReverse()) {
      return getReverseAdj(query);
    }
    return backend.readAsync(tx -> loadBlocks(tx, query.getTokenId())).thenApply(blocks -> {
      List<EdgeRow> rows = new ArrayList<>();
      for (EdgeBlock block : blocks) {
        for (int i = 0; i < block.count(); i++) {
          if (query.matches(block.typeAt(i), block.weightAt(i))) {
            rows.add(block.rowAt(i));
          }
        }
      }
      return sortAndLimit(rows, query);
    });
  }

  private CompletableFuture<List<EdgeRow>> getReverseAdj(AdjacencyQuery query) {
    long target = query.getTokenId();
    List<EdgeRow> rows = new ArrayList<>();
    return forEachStoredBlock(page -> {
          for (StoredBlock stored : page) {
            EdgeBlock block = decodeOrNull(stored);
            if (block == null) continue;
            for (int i = 0; i < block.count(); i++) {
              if (block.neighborAt(i) != target) continue;
              if (!query.matches(block.typeAt(i), block.weightAt(i))) continue;
              rows.add(block.rowAt(i).withNeighbor(block.getTokenId()));
              if (query.isFull(rows.size())) return false;
            }
          }
          return true;
        })
        .thenApply(v -> sortAndLimit(rows, query));
  }

  /**
   * Writes the edges of a token.
   *
   * <p>Without {@code merge} the given edges replace the token's edge set. With {@code merge}
   * each edge overwrites any stored edge with the same {@code (neighborId, type)}. The result is
   * re-sharded and stale parts are deleted. An empty result leaves a single empty block that
   * {@link #gc()} removes.</p>
   *
   * @param tokenId the token
   * @param edges   edges to write
   * @param merge   whether to merge into existing edges
   * @return future completing when committed
   */
  public CompletableFuture<Void> upsertAdj(long tokenId, List<EdgeRow> edges, boolean merge) {
    if (!initialized.get()) return notInitialized();
    List<EdgeRow> incoming = List.copyOf(edges);
    return backend.<List<EdgeRow>>runAsync(tx -> tx.scanAll(keys.edgeBlocksPrefix(tokenId)).thenApply(existing -> {
          EdgeAccumulator acc = new EdgeAccumulator();
          if (merge) {
            for (StoredBlock stored : chunks.assemble(existing)) {
              EdgeBlock block = decodeOrNull(stored);
              if (block != null) acc.addBlock(block);
            }
          }
          acc.addAll(incoming);
          writeBlocks(tx, acc.toBlocks(tokenId), existing);
          return acc.rows();
        }))
        .thenApply(rows -> {
          Metrics.SHARD_UPSERT_COUNT.add(1, Metrics.attrs("merge", Boolean.toString(merge)));
          LOGGER.debug("Upserted tokenId={} incoming={} total={} merge={}", tokenId, incoming.size(), rows.size(), merge);
          notifyGraphUpdated(tokenId, rows);
          return null;
        });
  }

  /**
   * Merge-upserts each item in order. Items without a resolvable token are skipped.
   *
   * @param items import records
   * @return future with imported and skipped counts
   */
  public CompletableFuture<BulkImportResult> bulkImport(Iterator<ImportItem> items) {
    if (!initialized.get()) return notInitialized();
    AtomicInteger imported = new AtomicInteger();
    AtomicInteger skipped = new AtomicInteger();
    return AsyncUtil.whileTrue(() -> {
          if (!items.hasNext()) return completedFuture(false);
          ImportItem item = items.next();
          return resolveImportId(item).thenCompose(tokenId -> {
            if (tokenId == null) {
              skipped.incrementAndGet();
              return completedFuture(true);
            }
            List<EdgeRow> edges = item.edges() == null ? List.of() : item.edges();
            return upsertAdj(tokenId, edges, true).thenApply(v -> {
              imported.incrementAndGet();
              return true;
            });
          });
        }, executor)
        .thenApply(v -> {
          LOGGER.info("Bulk import finished imported={} skipped={}", imported.get(), skipped.get());
          return new BulkImportResult(imported.get(), skipped.get());
        });
  }

  public CompletableFuture<BulkImportResult> bulkImport(Iterable<ImportItem> items) {
    return bulkImport(items.iterator());
  }

  private CompletableFuture<Long> resolveImportId(ImportItem item) {
    if (item == null) return completedFuture(null);
    if (item.tokenId() != null) {
      return completedFuture(item.tokenId() > 0 ? item.tokenId() : null);
    }
    if (item.token() == null || item.token().isBlank()) return completedFuture(null);
    return ensureToken(item.token());
  }

  /**
   * Computes store-wide counts by decoding every block. Pages are read in separate transactions,
   * so counts taken during concurrent writes are approximate.
   */
  public CompletableFuture<ShardStats> stats() {
    if (!initialized.get()) return notInitialized();
    // tokens, blocks, edges, bytes
    long[] counts = new long[4];
    return StorageScans.forEachPage(backend, keys.tokenByIdPrefix(), scanPageSize, executor, page -> {
          counts[0] += page.size();
          return true;
        })
        .thenCompose(v -> forEachStoredBlock(page -> {
          for (StoredBlock stored : page) {
            counts[1]++;
            counts[3] += stored.size();
            EdgeBlock block = decodeOrNull(stored);
            if (block != null) counts[2] += block.count();
          }
          return true;
        }))
        .thenApply(v -> new ShardStats(counts[0], counts[1], counts[2], counts[3]));
  }

  /**
   * Rewrites every readable block through the current codec. Edge contents never change.
   *
   * @return future with the number of blocks rewritten
   */
  public CompletableFuture<Integer> compact() {
    if (!initialized.get()) return notInitialized();
    long start = System.nanoTime();
    return forEachBlockBatch(batch -> backend.runAsync(tx -> readBlocks(tx, batch).thenApply(blocks -> {
          int rewritten = 0;
          for (StoredBlock stored : blocks) {
            EdgeBlock block = decodeOrNull(stored);
            if (block == null) continue;
            stored.chunkKeys().forEach(tx::clear);
            chunks.write(tx, block.getTokenId(), block.getPart(), codec.encode(block));
            rewritten++;
          }
          return rewritten;
        })))
        .thenApply(rewritten -> {
          recordMaintenance("compact", start);
          LOGGER.info("Compacted {} edge blocks with codec={}", rewritten, codec.name());
          return rewritten;
        });
  }

  /**
   * Deletes every block with zero edges and every block that cannot be decoded.
   *
   * @return future with the number of blocks removed
   */
  public CompletableFuture<Integer> gc() {
    if (!initialized.get()) return notInitialized();
    long start = System.nanoTime();
    return forEachBlockBatch(batch -> backend.runAsync(tx -> readBlocks(tx, batch).thenApply(blocks -> {
          int removed = 0;
          for (StoredBlock stored : blocks) {
            EdgeBlock block = decodeOrNull(stored);
            if (block == null) {
              LOGGER.warn("Removing unreadable edge block tokenId={} part={}", stored.id().tokenId(),
                  stored.id().part());
            } else if (block.count() != 0) {
              continue;
            }
            stored.chunkKeys().forEach(tx::clear);
            removed++;
          }
          return removed;
        })))
        .thenApply(removed -> {
          Metrics.SHARD_BLOCKS_REMOVED.add(removed);
          recordMaintenance("gc", start);
          LOGGER.info("GC removed {} edge blocks", removed);
          return removed;
        });
  }

  /**
   * Trims decayed edges according to {@code policy} and re-shards every token that lost edges.
   *
   * @param policy decay policy
   * @return future with the number of edges removed
   */
  public CompletableFuture<Integer> prune(GcPolicy policy) {
    if (!initialized.get()) return notInitialized();
    Instant now = instantSource.instant();
    long start = System.nanoTime();
    AtomicInteger trimmed = new AtomicInteger();
    return listBlocks().thenCompose(blocks -> {
          Set<Long> tokenIds = new LinkedHashSet<>();
          for (BlockId id : blocks) tokenIds.add(id.tokenId());
          Iterator<Long> it = tokenIds.iterator();
          return AsyncUtil.whileTrue(() -> {
            if (!it.hasNext()) return completedFuture(false);
            long tokenId = it.next();
            return pruneToken(tokenId, policy, now).thenApply(n -> {
              trimmed.addAndGet(n);
              return true;
            });
          }, executor);
        })
        .thenApply(v -> {
          Metrics.SHARD_EDGES_PRUNED.add(trimmed.get());
          recordMaintenance("prune", start);
          LOGGER.info("Prune removed {} decayed edges", trimmed.get());
          return trimmed.get();
        });
  }

  private CompletableFuture<Integer> pruneToken(long tokenId, GcPolicy policy, Instant now) {
    List<EdgeRow> remaining = new ArrayList<>();
    return backend.<Integer>runAsync(tx -> tx.scanAll(keys.edgeBlocksPrefix(tokenId)).thenApply(existing -> {
          remaining.clear();
          EdgeAccumulator acc = new EdgeAccumulator();
          for (StoredBlock stored : chunks.assemble(existing)) {
            EdgeBlock block = decodeOrNull(stored);
            if (block != null) acc.addBlock(block);
          }
          List<EdgeRow.EdgeKey> drop = new ArrayList<>();
          for (EdgeRow row : acc.rows()) {
            if (policy.shouldTrim(row, now)) drop.add(row.key());
          }
          if (drop.isEmpty()) return 0;
          acc.removeAll(drop);
          writeBlocks(tx, acc.toBlocks(tokenId), existing);
          remaining.addAll(acc.rows());
          return drop.size();
        }))
        .thenApply(n -> {
          if (n > 0) notifyGraphUpdated(tokenId, List.copyOf(remaining));
          return n;
        });
  }

  /** Replaces a token's stored chunks with {@code blocks}. */
  private void writeBlocks(StorageTransaction tx, List<EdgeBlock> blocks, List<StoredEntry> existing) {
    for (StoredEntry entry : existing) tx.clear(entry.key());
    for (EdgeBlock block : blocks) {
      chunks.write(tx, block.getTokenId(), block.getPart(), codec.encode(block));
    }
  }

  private CompletableFuture<List<EdgeBlock>> loadBlocks(StorageTransaction tx, long tokenId) {
    return tx.scanAll(keys.edgeBlocksPrefix(tokenId)).thenApply(entries -> {
      List<EdgeBlock> blocks = new ArrayList<>();
      for (StoredBlock stored : chunks.assemble(entries)) {
        EdgeBlock block = decodeOrNull(stored);
        if (block != null) blocks.add(block);
      }
      return blocks;
    });
  }

  /** Pages through every stored block; a page never splits a block's chunks. */
  private CompletableFuture<Void> forEachStoredBlock(Predicate<List<StoredBlock>> consumer) {
    return StorageScans.forEachPage(backend, keys.allEdgeBlocksPrefix(), scanPageSize, chunks::blockOf, executor,
        page -> consumer.test(chunks.assemble(page)));
  }

  private CompletableFuture<List<BlockId>> listBlocks() {
    Set<BlockId> blocks = new LinkedHashSet<>();
    return StorageScans.forEachPage(backend, keys.allEdgeBlocksPrefix(), scanPageSize, executor, page -> {
          for (StoredEntry e : page) blocks.add(chunks.blockOf(e.key()));
          return true;
        })
        .thenApply(v -> new ArrayList<>(blocks));
  }

  private CompletableFuture<Integer> forEachBlockBatch(Function<List<BlockId>, CompletableFuture<Integer>> fn) {
    AtomicInteger total = new AtomicInteger();
    return listBlocks().thenCompose(blocks -> {
          AtomicInteger offset = new AtomicInteger();
          return AsyncUtil.whileTrue(() -> {
            int from = offset.get();
            if (from >= blocks.size()) return completedFuture(false);
            int to = Math.min(blocks.size(), from + maintenanceBatchSize);
            offset.set(to);
            return fn.apply(blocks.subList(from, to)).thenApply(n -> {
              total.addAndGet(n);
              return true;
            });
          }, executor);
        })
        .thenApply(v -> total.get());
  }

  /** Re-reads {@code batch} inside {@code tx}, dropping blocks deleted since they were listed. */
  private CompletableFuture<List<StoredBlock>> readBlocks(StorageTransaction tx, List<BlockId> batch) {
    List<CompletableFuture<List<StoredEntry>>> reads = new ArrayList<>(batch.size());
    for (BlockId id : batch) reads.add(tx.scanAll(keys.edgeBlockPrefix(id.tokenId(), id.part())));
    return CompletableFuture.allOf(reads.toArray(CompletableFuture[]::new)).thenApply(v -> {
      List<StoredBlock> blocks = new ArrayList<>(batch.size());
      for (CompletableFuture<List<StoredEntry>> read : reads) {
        blocks.addAll(chunks.assemble(read.join()));
      }
      return blocks;
    });
  }

  private EdgeBlock decodeOrNull(StoredBlock stored) {
    BlockId id = stored.id();
    try {
      if (stored.bytes() == null) {
        throw new EdgeBlockEncodingException("Block is missing chunks, found " + stored.chunkKeys().size());
      }
      EdgeBlock block = codec.decode(stored.bytes());
      if (block.getTokenId() != id.tokenId() || block.getPart() != id.part()) {
        throw new EdgeBlockEncodingException("Header names tokenId=" + block.getTokenId() + " part="
            + block.getPart());
      }
      return block;
    } catch (EdgeBlockEncodingException e) {
      Metrics.UNREADABLE_BLOCK_COUNT.add(1);
      LOGGER.warn("Skipping unreadable edge block tokenId={} part={}; run gc() or rewrite the token",
          id.tokenId(), id.part(), e);
      return null;
    }
  }

  private static List<EdgeRow> sortAndLimit(List<EdgeRow> rows, AdjacencyQuery query) {
    rows.sort(BY_WEIGHT_DESC);
    if (query.getLimit() != null && rows.size() > query.getLimit()) {
      return new ArrayList<>(rows.subList(0, query.getLimit()));
    }
    return rows;
  }

  private void notifyGraphUpdated(long tokenId, List<EdgeRow> rows) {
    List<EdgeRow> snapshot = List.copyOf(rows);
    for (ShardStoreListener listener : listeners) {
      notifySafely(() -> listener.onGraphUpdated(tokenId, snapshot));
    }
  }

  private static void notifySafely(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      LOGGER.warn("ShardStore listener failed", e);
    }
  }

  private static void recordMaintenance(String op, long startNanos) {
    double ms = (System.nanoTime() - startNanos) / 1_000_000.0;
    Metrics.SHARD_MAINTENANCE_DURATION_MS.record(ms, Metrics.attrs("op", op));
  }

  private static StoreMeta parseMeta(byte[] bytes) {
    try {
      return StoreMeta.parseFrom(bytes);
    } catch (InvalidProtocolBufferException e) {
      throw new TokenGraphException("Unreadable store metadata", e);
    }
  }

  private static Timestamp timestamp(Instant instant) {
    return Timestamp.newBuilder()
        .setSeconds(instant.getEpochSecond())
        .setNanos(instant.getNano())
        .build();
  }

  private static <T> CompletableFuture<T> notInitialized() {
    return CompletableFuture.failedFuture(new NotInitializedException("ShardStore"));
  }
}
