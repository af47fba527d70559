package io.github.panghy.tokengraph.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.panghy.tokengraph.codec.EdgeRow;
import io.github.panghy.tokengraph.kb.AdjacencyQuery;
import io.github.panghy.tokengraph.kb.ShardStore;
import io.github.panghy.tokengraph.kb.ShardStoreListener;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.InstantSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write-behind copy of the store as a tree of JSON files.
 *
 * <p>Layout under the root directory:</p>
 * <ul>
 *   <li>{@code chunks/<prefix>.json}: every known token whose id ends in the three hex digits
 *   {@code prefix}, with its text and edges</li>
 *   <li>{@code metadata.json}: chunk list and totals</li>
 * </ul>
 *
 * <p>Changes arrive as {@link ShardStoreListener} callbacks and mark their chunk dirty; a single
 * writer thread rewrites dirty chunks. A failed write is logged and the chunks stay dirty until the
 * next change or {@link #flush()}.</p>
 */
public class FileTreeExportMirror implements ShardStoreListener, AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(FileTreeExportMirror.class);
  static final int FORMAT_VERSION = 1;
  static final int PREFIX_NIBBLES = 3;

  private static final ObjectMapper MAPPER =
      new ObjectMapper().setSerializationInclusion(JsonInclude.Include.NON_NULL);

  record EdgeExport(long neighborId, int type, long weight, long lastSeen, Integer flags) {
    static EdgeExport of(EdgeRow row) {
      return new EdgeExport(row.neighborId(), row.type(), row.weight(), row.lastSeen(), row.flags());
    }
  }

  record TokenExport(long id, String token, List<EdgeExport> edges) {}

  record ChunkFile(String prefix, @JsonProperty("token_count") int tokenCount, List<TokenExport> tokens) {}

  record ChunkSummary(String prefix, @JsonProperty("token_count") int tokenCount) {}

  record Metadata(
      int version,
      @JsonProperty("generated_at") String generatedAt,
      @JsonProperty("chunk_prefix_length") int chunkPrefixLength,
      List<ChunkSummary> chunks,
      @JsonProperty("total_tokens") long totalTokens,
      @JsonProperty("total_edges") long totalEdges) {}

  private final Path root;
  private final InstantSource clock;
  private final ExecutorService writer;

  private final Map<Long, String> texts = new ConcurrentHashMap<>();
  private final Map<Long, List<EdgeRow>> edges = new ConcurrentHashMap<>();
  private final Map<String, Set<Long>> members = new ConcurrentHashMap<>();
  private final Set<String> dirty = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean writeScheduled = new AtomicBoolean(false);
  private final AtomicLong completedWrites = new AtomicLong();

  public FileTreeExportMirror(Path root) {
    this(root, InstantSource.system());
  }

  public FileTreeExportMirror(Path root, InstantSource clock) {
    this.root = root;
    this.clock = clock;
    this.writer = Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, "tokengraph-export");
      t.setDaemon(true);
      return t;
    });
  }

  static String prefixOf(long tokenId) {
    return String.format("%03x", tokenId & 0xfff);
  }

  public Path getRoot() {
    return root;
  }

  /** Number of successful write passes. */
  public long completedWrites() {
    return completedWrites.get();
  }

  @Override
  public void onTokenObserved(long tokenId, String text, boolean created) {
    texts.put(tokenId, text);
    touch(tokenId);
    scheduleWrite();
  }

  @Override
  public void onGraphUpdated(long tokenId, List<EdgeRow> rows) {
    if (rows.isEmpty()) {
      edges.remove(tokenId);
    } else {
      edges.put(tokenId, List.copyOf(rows));
    }
    touch(tokenId);
    scheduleWrite();
  }

  /**
   * Loads every token and its forward edges from {@code store}, then writes the full tree.
   */
  public CompletableFuture<Void> seed(ShardStore store) {
    return store.listTokens()
        .thenCompose(tokens -> {
          List<CompletableFuture<Void>> reads = new ArrayList<>(tokens.size());
          tokens.forEach(t -> {
            texts.put(t.id(), t.text());
            touch(t.id());
            reads.add(store.getAdj(AdjacencyQuery.forward(t.id())).thenAccept(rows -> {
              if (!rows.isEmpty()) edges.put(t.id(), List.copyOf(rows));
            }));
          });
          return CompletableFuture.allOf(reads.toArray(CompletableFuture[]::new));
        })
        .thenCompose(v -> {
          LOGGER.info("Seeded export mirror at {} with {} token(s)", root, texts.size());
          return flush();
        });
  }

  /**
   * Writes every dirty chunk now. Completes once the writes queued before it and this pass are
   * done; fails if this pass fails.
   */
  public CompletableFuture<Void> flush() {
    return CompletableFuture.runAsync(this::writeDirty, writer);
  }

  private void touch(long tokenId) {
    String prefix = prefixOf(tokenId);
    members.computeIfAbsent(prefix, k -> ConcurrentHashMap.newKeySet()).add(tokenId);
    dirty.add(prefix);
  }

  private void scheduleWrite() {
    if (writer.isShutdown() || !writeScheduled.compareAndSet(false, true)) return;
    writer.execute(() -> {
      writeScheduled.set(false);
      try {
        writeDirty();
      } catch (UncheckedIOException e) {
        LOGGER.warn("Export to {} failed; retrying on the next change", root, e);
      }
    });
  }

  private void writeDirty() {
    List<String> batch = new ArrayList<>(dirty);
    if (batch.isEmpty()) return;
    dirty.removeAll(batch);
    try {
      Path chunks = Files.createDirectories(root.resolve("chunks"));
      for (String prefix : batch) {
        writeJson(chunks.resolve(prefix + ".json"), chunk(prefix));
      }
      writeJson(root.resolve("metadata.json"), metadata());
      completedWrites.incrementAndGet();
      LOGGER.debug("Exported {} chunk(s) to {}", batch.size(), root);
    } catch (IOException e) {
      dirty.addAll(batch);
      throw new UncheckedIOException(e);
    }
  }

  private ChunkFile chunk(String prefix) {
    List<TokenExport> tokens = new ArrayList<>();
    for (long id : new TreeSet<>(members.getOrDefault(prefix, Set.of()))) {
      List<EdgeExport> rows = new ArrayList<>();
      for (EdgeRow row : edges.getOrDefault(id, List.of())) rows.add(EdgeExport.of(row));
      tokens.add(new TokenExport(id, texts.get(id), rows));
    }
    return new ChunkFile(prefix, tokens.size(), tokens);
  }

  private Metadata metadata() {
    List<ChunkSummary> chunks = new ArrayList<>();
    new TreeMap<>(members).forEach((prefix, ids) -> chunks.add(new ChunkSummary(prefix, ids.size())));
    long totalTokens = chunks.stream().mapToLong(ChunkSummary::tokenCount).sum();
    long totalEdges = edges.values().stream().mapToLong(List::size).sum();
    return new Metadata(FORMAT_VERSION, clock.instant().toString(), PREFIX_NIBBLES, chunks, totalTokens,
        totalEdges);
  }

  private static void writeJson(Path target, Object value) throws IOException {
    Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
    MAPPER.writeValue(tmp.toFile(), value);
    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
  }

  /** Stops accepting changes and waits briefly for queued writes. */
  @Override
  public void close() {
    writer.shutdown();
    try {
      if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
        LOGGER.warn("Export writer for {} did not finish within 5s", root);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
