package io.github.panghy.tokengraph;

import static java.util.concurrent.CompletableFuture.completedFuture;

import io.github.panghy.tokengraph.export.FileTreeExportMirror;
import io.github.panghy.tokengraph.growth.AdjacencyOracle;
import io.github.panghy.tokengraph.growth.GrowthEngine;
import io.github.panghy.tokengraph.growth.NodeEmbedder;
import io.github.panghy.tokengraph.growth.ThoughtSink;
import io.github.panghy.tokengraph.kb.ShardStore;
import io.github.panghy.tokengraph.kb.ShardStoreConfig;
import io.github.panghy.tokengraph.rank.HybridQuery;
import io.github.panghy.tokengraph.rank.HybridRanker;
import io.github.panghy.tokengraph.storage.GraphKeys;
import io.github.panghy.tokengraph.storage.StorageBackend;
import io.github.panghy.tokengraph.storage.StorageBackends;
import io.github.panghy.tokengraph.vector.EmbeddingProvider;
import io.github.panghy.tokengraph.vector.ExecutorFlushScheduler;
import io.github.panghy.tokengraph.vector.HashingEmbeddingProvider;
import io.github.panghy.tokengraph.vector.PersistentVectorStore;
import io.github.panghy.tokengraph.vector.ScoredToken;
import io.github.panghy.tokengraph.vector.VectorService;
import io.github.panghy.tokengraph.vector.VectorStoreConfig;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point wiring storage, the shard store, the vector subsystem and the optional export mirror.
 *
 * <pre>{@code
 * TokenGraph graph = TokenGraph.open(TokenGraphConfig.builder().build()).join();
 * long cat = graph.shardStore().ensureToken("cat").join();
 * List<ScoredToken> related = graph.suggestNeighbors(cat, 10).join();
 * }</pre>
 */
public class TokenGraph implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(TokenGraph.class);

  private final TokenGraphConfig config;
  private final StorageBackend backend;
  private final ScheduledExecutorService flushExecutor;
  private final ShardStore shardStore;
  private final VectorService vectors;
  private final HybridRanker ranker;
  private final FileTreeExportMirror mirror;

  private TokenGraph(TokenGraphConfig config, StorageBackend backend) {
    this.config = config;
    this.backend = backend;
    this.flushExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "tokengraph-embedding-flush");
      t.setDaemon(true);
      return t;
    });
    VectorStoreConfig vectorConfig = config.getVectors();
    GraphKeys keys = new GraphKeys(config.getStorage().getRootPrefix());
    EmbeddingProvider provider = config.getEmbeddingProvider() != null
        ? config.getEmbeddingProvider()
        : new HashingEmbeddingProvider(vectorConfig.getDimension());
    PersistentVectorStore vectorStore = new PersistentVectorStore(backend, keys, vectorConfig);
    this.vectors = new VectorService(vectorStore, provider,
        new ExecutorFlushScheduler(flushExecutor, vectorConfig.getFlushDelay()), vectorConfig.getBatchSize(),
        config.getShardStore().getBackgroundExecutor());
    this.mirror = config.getExportDirectory() == null ? null : new FileTreeExportMirror(config.getExportDirectory());

    ShardStoreConfig.Builder shardConfig = config.getShardStore().toBuilder().listener(vectors);
    if (mirror != null) shardConfig.listener(mirror);
    this.shardStore = new ShardStore(backend, keys, shardConfig.build());
    this.ranker = new HybridRanker(shardStore, vectorStore);
  }

  /**
   * Opens the configured backend (degrading to memory if a durable one is unreachable) and
   * initializes every component.
   */
  public static CompletableFuture<TokenGraph> open(TokenGraphConfig config) {
    TokenGraph graph = new TokenGraph(config, StorageBackends.open(config.getStorage()));
    return graph.shardStore.init()
        .thenCompose(v -> graph.vectors.init())
        .thenCompose(v -> graph.seedMirror())
        .handle((v, error) -> {
          if (error != null) {
            graph.close();
            throw new TokenGraphException("Unable to open token graph", error);
          }
          LOGGER.info("Token graph open backend={} durable={} codec={}", graph.backend.name(),
              graph.backend.isDurable(), graph.shardStore.getCodec().name());
          return graph;
        });
  }

  private CompletableFuture<Void> seedMirror() {
    if (mirror == null) return completedFuture(null);
    return mirror.seed(shardStore);
  }

  public ShardStore shardStore() {
    return shardStore;
  }

  public VectorService vectors() {
    return vectors;
  }

  /** The export mirror, or null when disabled. */
  public FileTreeExportMirror exportMirror() {
    return mirror;
  }

  public boolean isDurable() {
    return backend.isDurable();
  }

  /** Hybrid graph and embedding neighbors of a token with default blend weights. */
  public CompletableFuture<List<ScoredToken>> suggestNeighbors(long tokenId, int topK) {
    return ranker.hybrid(HybridQuery.builder(tokenId, topK).build());
  }

  public CompletableFuture<List<ScoredToken>> suggestNeighbors(HybridQuery query) {
    return ranker.hybrid(query);
  }

  /** A growth engine whose new nodes are registered as tokens and embedded through this graph. */
  public GrowthEngine newGrowthEngine(AdjacencyOracle oracle, ThoughtSink sink) {
    return new GrowthEngine(oracle, NodeEmbedder.persistent(shardStore, vectors), sink, config.getGrowth());
  }

  @Override
  public void close() {
    flushExecutor.shutdown();
    try {
      if (!flushExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
        LOGGER.warn("Embedding flush executor did not stop within 5s");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    if (mirror != null) mirror.close();
    backend.close();
  }
}
