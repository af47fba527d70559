package io.github.panghy.tokengraph.kb;

import static java.util.concurrent.CompletableFuture.completedFuture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.panghy.tokengraph.NotInitializedException;
import io.github.panghy.tokengraph.TokenGraphException;
import io.github.panghy.tokengraph.codec.EdgeBlock;
import io.github.panghy.tokengraph.codec.EdgeBlockCodecs;
import io.github.panghy.tokengraph.codec.EdgeRow;
import io.github.panghy.tokengraph.codec.GzipEdgeBlockCodec;
import io.github.panghy.tokengraph.codec.RawEdgeBlockCodec;
import io.github.panghy.tokengraph.kb.BlockChunks.StoredBlock;
import io.github.panghy.tokengraph.proto.StoreMeta;
import io.github.panghy.tokengraph.storage.FdbStorageBackend;
import io.github.panghy.tokengraph.storage.GraphKeys;
import io.github.panghy.tokengraph.storage.InMemoryStorageBackend;
import io.github.panghy.tokengraph.storage.RecordingStorageBackend;
import io.github.panghy.tokengraph.storage.StoredEntry;
import java.time.Instant;
import java.time.InstantSource;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ShardStoreTest {
  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
  private static final long NOW_SECONDS = NOW.getEpochSecond();

  private InMemoryStorageBackend backend;
  private GraphKeys keys;
  private ShardStore store;
  private final Map<Long, List<EdgeRow>> updates = new ConcurrentHashMap<>();
  private final List<String> created = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setUp() {
    backend = new InMemoryStorageBackend();
    keys = new GraphKeys("shard-test");
    ShardStoreListener recorder = new ShardStoreListener() {
      @Override
      public void onTokenObserved(long tokenId, String text, boolean isNew) {
        if (isNew) created.add(text);
      }

      @Override
      public void onGraphUpdated(long tokenId, List<EdgeRow> edges) {
        updates.put(tokenId, edges);
      }
    };
    store = new ShardStore(backend, keys, ShardStoreConfig.builder()
        .instantSource(InstantSource.fixed(NOW))
        .maintenanceBatchSize(2)
        .listener(recorder)
        .build());
    store.init().join();
  }

  @Test
  void ensureTokenIsIdempotentAndTrims() {
    long cat = store.ensureToken("cat").join();
    long again = store.ensureToken("  cat ").join();
    long dog = store.ensureToken("dog").join();

    assertThat(cat).isEqualTo(1);
    assertThat(again).isEqualTo(cat);
    assertThat(dog).isEqualTo(2);
    assertThat(created).containsExactly("cat", "dog");
    assertThat(store.getToken(dog).join()).isEqualTo("dog");
    assertThat(store.getToken(999).join()).isEmpty();
    assertThat(store.listTokens().join()).containsExactly(new TokenEntry(1, "cat"), new TokenEntry(2, "dog"));
  }

  @Test
  void blankTokenIsRejected() {
    assertThatThrownBy(() -> store.ensureToken("   ").join()).hasCauseInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> store.ensureToken(null).join()).hasCauseInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void concurrentEnsureTokenAllocatesOnce() {
    List<Long> ids = new ArrayList<>();
    List<CompletableFuture<Long>> futures = new ArrayList<>();
    for (int i = 0; i < 20; i++) futures.add(store.ensureToken("same"));
    futures.forEach(f -> ids.add(f.join()));

    assertThat(ids).containsOnly(1L);
    assertThat(store.ensureToken("next").join()).isEqualTo(2);
  }

  @Test
  void endToEndUpsertReadAndGc() {
    long id = store.ensureToken("cat").join();
    assertThat(store.ensureToken("cat").join()).isEqualTo(id);

    store.upsertAdj(id, List.of(new EdgeRow(2, 0, 500, 100)), false).join();
    assertThat(store.getAdj(AdjacencyQuery.forward(id)).join()).containsExactly(new EdgeRow(2, 0, 500, 100));

    store.upsertAdj(id, List.of(), false).join();
    long shardsBefore = store.stats().join().shards();
    int removed = store.gc().join();

    assertThat(removed).isEqualTo(1);
    assertThat(store.stats().join().shards()).isEqualTo(shardsBefore - 1);
    assertThat(store.getAdj(AdjacencyQuery.forward(id)).join()).isEmpty();
  }

  @Test
  void mergeOverwritesRowWithSameNeighborAndType() {
    long id = store.ensureToken("cat").join();
    store.upsertAdj(id, List.of(new EdgeRow(5, 0, 10, 1)), false).join();
    store.upsertAdj(id, List.of(new EdgeRow(5, 0, 99, 2)), true).join();

    List<EdgeRow> rows = store.getAdj(AdjacencyQuery.forward(id)).join();

    assertThat(rows).containsExactly(new EdgeRow(5, 0, 99, 2));
  }

  @Test
  void mergeKeepsOtherRowsAndOverwritesLastSeenLiterally() {
    long id = store.ensureToken("cat").join();
    store.upsertAdj(id, List.of(new EdgeRow(5, 0, 10, 50), new EdgeRow(6, 1, 20, 50)), false).join();
    store.upsertAdj(id, List.of(new EdgeRow(5, 0, 11, 7)), true).join();

    assertThat(store.getAdj(AdjacencyQuery.forward(id)).join())
        .containsExactly(new EdgeRow(6, 1, 20, 50), new EdgeRow(5, 0, 11, 7));
    assertThat(updates.get(id)).hasSize(2);
  }

  @Test
  void replaceDropsPreviousRows() {
    long id = store.ensureToken("cat").join();
    store.upsertAdj(id, List.of(new EdgeRow(5, 0, 10, 1), new EdgeRow(6, 0, 10, 1)), false).join();
    store.upsertAdj(id, List.of(new EdgeRow(7, 0, 3, 1)), false).join();

    assertThat(store.getAdj(AdjacencyQuery.forward(id)).join()).containsExactly(new EdgeRow(7, 0, 3, 1));
  }

  @Test
  void oneEdgeOverBlockMaxMakesTwoBlocks() {
    long id = store.ensureToken("hub").join();
    List<EdgeRow> edges = new ArrayList<>();
    for (int i = 0; i <= EdgeBlock.BLOCK_MAX; i++) edges.add(new EdgeRow(i + 1, 0, 1, 0));

    store.upsertAdj(id, edges, false).join();

    List<StoredBlock> blocks = storedBlocks(id);
    assertThat(blocks).hasSize(2);
    assertThat(blocks).extracting(b -> store.getCodec().decode(b.bytes()).count())
        .containsExactly(EdgeBlock.BLOCK_MAX, 1);
    assertThat(store.getAdj(AdjacencyQuery.forward(id)).join()).hasSize(EdgeBlock.BLOCK_MAX + 1);

    store.upsertAdj(id, List.of(new EdgeRow(1, 0, 1, 0)), false).join();
    assertThat(storedBlocks(id)).hasSize(1);
    assertThat(backend.readAsync(tx -> tx.scanAll(keys.edgeBlocksPrefix(id))).join()).hasSize(1);
  }

  @Test
  void fullBlocksAreStoredInChunksUnderTheValueLimit() {
    RecordingStorageBackend recording = new RecordingStorageBackend(backend);
    ShardStore raw = new ShardStore(recording, keys, ShardStoreConfig.defaults(), EdgeBlockCodecs.raw());
    raw.init().join();
    long id = raw.ensureToken("hub").join();
    List<EdgeRow> edges = new ArrayList<>();
    for (int i = 0; i <= EdgeBlock.BLOCK_MAX; i++) edges.add(new EdgeRow(i + 1, 1, i, 7, 3));

    raw.upsertAdj(id, edges, false).join();

    assertThat(recording.largestValue()).isLessThanOrEqualTo(FdbStorageBackend.MAX_VALUE_BYTES);
    List<StoredEntry> entries = backend.readAsync(tx -> tx.scanAll(keys.edgeBlockPrefix(id, 0))).join();
    assertThat(entries.size()).isBetween(2, BlockChunks.MAX_CHUNKS);
    assertThat(raw.getAdj(AdjacencyQuery.forward(id)).join())
        .hasSize(EdgeBlock.BLOCK_MAX + 1)
        .first().isEqualTo(new EdgeRow(EdgeBlock.BLOCK_MAX + 1, 1, EdgeBlock.BLOCK_MAX, 7, 3));
    ShardStats stats = raw.stats().join();
    assertThat(stats.shards()).isEqualTo(2);
    assertThat(stats.edges()).isEqualTo(EdgeBlock.BLOCK_MAX + 1);

    assertThat(raw.compact().join()).isEqualTo(2);
    raw.upsertAdj(id, List.of(new EdgeRow(9, 1, 1, 0)), true).join();
    assertThat(recording.largestValue()).isLessThanOrEqualTo(FdbStorageBackend.MAX_VALUE_BYTES);
    assertThat(raw.getAdj(AdjacencyQuery.forward(id)).join()).hasSize(EdgeBlock.BLOCK_MAX + 1);
  }

  @Test
  void blockMissingAChunkIsUnreadableUntilCollected() {
    ShardStore raw = new ShardStore(backend, keys, ShardStoreConfig.defaults(), EdgeBlockCodecs.raw());
    raw.init().join();
    long id = raw.ensureToken("hub").join();
    List<EdgeRow> edges = new ArrayList<>();
    for (int i = 0; i <= EdgeBlock.BLOCK_MAX; i++) edges.add(new EdgeRow(i + 1, 0, 1, 0));
    raw.upsertAdj(id, edges, false).join();
    backend.<Void>runAsync(tx -> {
      tx.clear(keys.edgeChunkKey(id, 0, 1));
      return completedFuture(null);
    }).join();

    assertThat(raw.getAdj(AdjacencyQuery.forward(id)).join()).hasSize(1);

    assertThat(raw.gc().join()).isEqualTo(1);
    assertThat(backend.readAsync(tx -> tx.scanAll(keys.edgeBlockPrefix(id, 0))).join()).isEmpty();
    assertThat(raw.stats().join().shards()).isEqualTo(1);
  }

  @Test
  void storeWideScansReadOnePageAtATime() {
    RecordingStorageBackend recording = new RecordingStorageBackend(backend);
    ShardStore paged = new ShardStore(recording, keys, ShardStoreConfig.builder()
        .scanPageSize(11)
        .maintenanceBatchSize(3)
        .build());
    paged.init().join();
    long target = paged.ensureToken("target").join();
    List<Long> sources = new ArrayList<>();
    for (int i = 0; i < 40; i++) {
      long source = paged.ensureToken("source-" + i).join();
      sources.add(source);
      paged.upsertAdj(source, List.of(new EdgeRow(target, 0, i, 0)), false).join();
    }

    assertThat(paged.listTokens().join()).hasSize(41).extracting(TokenEntry::id).isSorted();
    assertThat(paged.getAdj(AdjacencyQuery.builder(target).reverse(true).build()).join())
        .extracting(EdgeRow::neighborId).containsExactlyInAnyOrderElementsOf(sources);
    ShardStats stats = paged.stats().join();
    assertThat(stats.tokens()).isEqualTo(41);
    assertThat(stats.shards()).isEqualTo(40);
    assertThat(stats.edges()).isEqualTo(40);
    assertThat(paged.compact().join()).isEqualTo(40);
    assertThat(paged.gc().join()).isZero();
    assertThat(recording.largestRead()).isLessThanOrEqualTo(11);

    int before = recording.readTransactions();
    assertThat(paged.getAdj(AdjacencyQuery.builder(target).reverse(true).limit(2).build()).join()).hasSize(2);
    assertThat(recording.readTransactions() - before).isEqualTo(1);
  }

  @Test
  void maintenanceRunsOnTheConfiguredExecutor() {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      ShardStore pooled = new ShardStore(backend, keys, ShardStoreConfig.builder()
          .instantSource(InstantSource.fixed(NOW))
          .backgroundExecutor(executor)
          .maintenanceBatchSize(1)
          .build());
      pooled.init().join();
      long twoYearsAgo = NOW_SECONDS - 2 * 365 * 86_400L;

      BulkImportResult imported = pooled.bulkImport(List.of(
          ImportItem.byText("cat", List.of(new EdgeRow(2, 0, 500, NOW_SECONDS), new EdgeRow(3, 0, 1, twoYearsAgo))),
          ImportItem.byText("dog", List.of()))).join();

      assertThat(imported).isEqualTo(new BulkImportResult(2, 0));
      assertThat(pooled.listTokens().join()).extracting(TokenEntry::text).containsExactly("cat", "dog");
      assertThat(pooled.prune(GcPolicy.builder().build()).join()).isEqualTo(1);
      assertThat(pooled.compact().join()).isEqualTo(2);
      assertThat(pooled.gc().join()).isEqualTo(1);
      assertThat(pooled.stats().join().edges()).isEqualTo(1);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void scanPageSizeMustHoldAWholeBlock() {
    assertThatThrownBy(() -> ShardStoreConfig.builder().scanPageSize(BlockChunks.MAX_CHUNKS).build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ShardStoreConfig.builder().backgroundExecutor(null).build())
        .isInstanceOf(NullPointerException.class);
  }

  @Test
  void forwardQueryFiltersSortsAndLimits() {
    long id = store.ensureToken("cat").join();
    store.upsertAdj(id, List.of(
        new EdgeRow(2, 0, 5, 0),
        new EdgeRow(3, 1, 50, 0),
        new EdgeRow(4, 0, 40, 0),
        new EdgeRow(5, 2, 30, 0)), false).join();

    assertThat(store.getAdj(AdjacencyQuery.forward(id)).join())
        .extracting(EdgeRow::neighborId).containsExactly(3L, 4L, 5L, 2L);
    assertThat(store.getAdj(AdjacencyQuery.builder(id).type(0).build()).join())
        .extracting(EdgeRow::neighborId).containsExactly(4L, 2L);
    assertThat(store.getAdj(AdjacencyQuery.builder(id).types(Set.of(0, 2)).minWeight(10L).build()).join())
        .extracting(EdgeRow::neighborId).containsExactly(4L, 5L);
    assertThat(store.getAdj(AdjacencyQuery.builder(id).limit(2).build()).join())
        .extracting(EdgeRow::neighborId).containsExactly(3L, 4L);
  }

  @Test
  void reverseQueryFindsIncomingEdges() {
    long a = store.ensureToken("a").join();
    long b = store.ensureToken("b").join();
    long c = store.ensureToken("c").join();
    store.upsertAdj(a, List.of(new EdgeRow(c, 0, 5, 11)), false).join();
    store.upsertAdj(b, List.of(new EdgeRow(c, 1, 9, 12), new EdgeRow(a, 0, 1, 0)), false).join();

    List<EdgeRow> incoming = store.getAdj(AdjacencyQuery.builder(c).reverse(true).build()).join();

    assertThat(incoming).containsExactly(new EdgeRow(b, 1, 9, 12), new EdgeRow(a, 0, 5, 11));
    assertThat(store.getAdj(AdjacencyQuery.builder(c).reverse(true).type(0).build()).join())
        .containsExactly(new EdgeRow(a, 0, 5, 11));
  }

  @Test
  void bulkImportSkipsUnresolvableItems() {
    long existing = store.ensureToken("cat").join();
    List<ImportItem> items = Arrays.asList(
        ImportItem.byId(existing, List.of(new EdgeRow(9, 0, 1, 0))),
        ImportItem.byText("dog", List.of(new EdgeRow(existing, 0, 2, 0))),
        null,
        ImportItem.byId(0, List.of()),
        ImportItem.byText(" ", List.of()));

    BulkImportResult result = store.bulkImport(items).join();

    assertThat(result).isEqualTo(new BulkImportResult(2, 3));
    long dog = store.ensureToken("dog").join();
    assertThat(store.getAdj(AdjacencyQuery.forward(dog)).join()).containsExactly(new EdgeRow(existing, 0, 2, 0));
  }

  @Test
  void unreadableBlocksAreSkippedThenCollected() {
    long id = store.ensureToken("cat").join();
    store.upsertAdj(id, List.of(new EdgeRow(2, 0, 5, 0)), false).join();
    backend.<Void>runAsync(tx -> {
      tx.set(keys.edgeChunkKey(77, 0, 0), new byte[] {9, 9, 9, 9, 9});
      // a valid block stored under the wrong key
      tx.set(keys.edgeChunkKey(78, 0, 0), new RawEdgeBlockCodec().encode(EdgeBlock.of(1, 0, List.of())));
      return completedFuture(null);
    }).join();

    assertThat(store.getAdj(AdjacencyQuery.forward(77)).join()).isEmpty();
    assertThat(store.getAdj(AdjacencyQuery.builder(2).reverse(true).build()).join()).hasSize(1);
    assertThat(store.stats().join().shards()).isEqualTo(3);

    assertThat(store.gc().join()).isEqualTo(2);
    ShardStats stats = store.stats().join();
    assertThat(stats.shards()).isEqualTo(1);
    assertThat(stats.edges()).isEqualTo(1);
    assertThat(stats.tokens()).isEqualTo(1);
  }

  @Test
  void pruneTrimsDecayedEdges() {
    long id = store.ensureToken("cat").join();
    long twoYearsAgo = NOW_SECONDS - 2 * 365 * 86_400L;
    store.upsertAdj(id, List.of(
        new EdgeRow(2, 0, 500, NOW_SECONDS),
        new EdgeRow(3, 0, 0, NOW_SECONDS),
        new EdgeRow(4, 0, 5, twoYearsAgo),
        new EdgeRow(5, 0, 100_000, twoYearsAgo)), false).join();

    int trimmed = store.prune(GcPolicy.builder().build()).join();

    assertThat(trimmed).isEqualTo(2);
    assertThat(store.getAdj(AdjacencyQuery.forward(id)).join())
        .extracting(EdgeRow::neighborId).containsExactly(5L, 2L);
    assertThat(updates.get(id)).hasSize(2);
  }

  @Test
  void compactRewritesBlocksWithTheCurrentCodec() {
    ShardStore rawStore = new ShardStore(backend, keys, ShardStoreConfig.defaults(), EdgeBlockCodecs.raw());
    rawStore.init().join();
    long id = rawStore.ensureToken("cat").join();
    rawStore.upsertAdj(id, List.of(new EdgeRow(2, 0, 5, 0), new EdgeRow(3, 0, 6, 0)), false).join();
    GzipEdgeBlockCodec gzip = new GzipEdgeBlockCodec(new RawEdgeBlockCodec());
    ShardStore gzipStore = new ShardStore(backend, keys, ShardStoreConfig.defaults(), gzip);
    gzipStore.init().join();

    int rewritten = gzipStore.compact().join();

    assertThat(rewritten).isEqualTo(1);
    byte[] stored = backend.readAsync(tx -> tx.get(keys.edgeChunkKey(id, 0, 0))).join();
    assertThat(stored[0] & 0xFF).isEqualTo(0x1F);
    assertThat(gzipStore.getAdj(AdjacencyQuery.forward(id)).join()).hasSize(2);
  }

  @Test
  void listenerFailureDoesNotFailTheWrite() {
    ShardStore noisy = new ShardStore(backend, keys, ShardStoreConfig.builder()
        .listener(new ShardStoreListener() {
          @Override
          public void onGraphUpdated(long tokenId, List<EdgeRow> edges) {
            throw new IllegalStateException("listener broke");
          }
        })
        .build());
    noisy.init().join();

    noisy.upsertAdj(1, List.of(new EdgeRow(2, 0, 1, 0)), false).join();

    assertThat(noisy.getAdj(AdjacencyQuery.forward(1)).join()).hasSize(1);
  }

  @Test
  void operationsBeforeInitFail() {
    ShardStore fresh = new ShardStore(new InMemoryStorageBackend(), keys, ShardStoreConfig.defaults());

    assertThat(fresh.isInitialized()).isFalse();
    assertThatThrownBy(() -> fresh.ensureToken("cat").join()).hasCauseInstanceOf(NotInitializedException.class);
    assertThatThrownBy(() -> fresh.getAdj(AdjacencyQuery.forward(1)).join())
        .hasCauseInstanceOf(NotInitializedException.class);
    assertThatThrownBy(() -> fresh.upsertAdj(1, List.of(), false).join())
        .hasCauseInstanceOf(NotInitializedException.class);
    assertThatThrownBy(() -> fresh.gc().join()).hasCauseInstanceOf(NotInitializedException.class);
    assertThatThrownBy(() -> fresh.stats().join()).hasCauseInstanceOf(NotInitializedException.class);
  }

  @Test
  void initRejectsUnknownSchemaVersion() {
    InMemoryStorageBackend other = new InMemoryStorageBackend();
    other.<Void>runAsync(tx -> {
      tx.set(keys.schemaVersionKey(), StoreMeta.newBuilder().setSchemaVersion(99).build().toByteArray());
      return completedFuture(null);
    }).join();
    ShardStore newer = new ShardStore(other, keys, ShardStoreConfig.defaults());

    assertThatThrownBy(() -> newer.init().join()).hasCauseInstanceOf(TokenGraphException.class);
    assertThat(newer.isInitialized()).isFalse();
  }

  private List<StoredBlock> storedBlocks(long tokenId) {
    List<StoredEntry> entries = backend.readAsync(tx -> tx.scanAll(keys.edgeBlocksPrefix(tokenId))).join();
    return new BlockChunks(keys).assemble(entries);
  }

  @Test
  void reopeningAnInitializedStoreKeepsData() {
    long id = store.ensureToken("cat").join();
    ShardStore reopened = new ShardStore(backend, keys, ShardStoreConfig.defaults());
    reopened.init().join();

    assertThat(reopened.ensureToken("cat").join()).isEqualTo(id);
  }
}
