package io.github.panghy.tokengraph;

import static java.util.concurrent.CompletableFuture.completedFuture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.panghy.tokengraph.codec.EdgeRow;
import io.github.panghy.tokengraph.growth.AdjacencyDelta;
import io.github.panghy.tokengraph.growth.AdjacencyOracle;
import io.github.panghy.tokengraph.growth.GrowthConfig;
import io.github.panghy.tokengraph.growth.GrowthResult;
import io.github.panghy.tokengraph.growth.ThoughtSink;
import io.github.panghy.tokengraph.kb.AdjacencyQuery;
import io.github.panghy.tokengraph.kb.BulkImportResult;
import io.github.panghy.tokengraph.kb.GcPolicy;
import io.github.panghy.tokengraph.kb.ImportItem;
import io.github.panghy.tokengraph.kb.ShardStore;
import io.github.panghy.tokengraph.kb.ShardStoreConfig;
import io.github.panghy.tokengraph.kb.TokenEntry;
import io.github.panghy.tokengraph.vector.HashingEmbeddingProvider;
import io.github.panghy.tokengraph.vector.ScoredToken;
import io.github.panghy.tokengraph.vector.VectorStoreConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TokenGraphTest {

  @TempDir
  Path dir;

  @Test
  void storesReadsAndRanksNeighbors() {
    try (TokenGraph graph = TokenGraph.open(TokenGraphConfig.builder().build()).join()) {
      assertThat(graph.isDurable()).isFalse();
      long cat = graph.shardStore().ensureToken("cat").join();
      long dog = graph.shardStore().ensureToken("dog").join();
      long cats = graph.shardStore().ensureToken("cats").join();
      assertThat(graph.shardStore().ensureToken("cat").join()).isEqualTo(cat);

      graph.shardStore().upsertAdj(cat, List.of(new EdgeRow(dog, 0, 500, 100)), false).join();
      assertThat(graph.shardStore().getAdj(AdjacencyQuery.forward(cat)).join())
          .containsExactly(new EdgeRow(dog, 0, 500, 100));

      graph.vectors().ensureEmbedding(cat, "cat").join();
      graph.vectors().ensureEmbedding(dog, "dog").join();
      graph.vectors().ensureEmbedding(cats, "cats").join();
      assertThat(graph.vectors().store().get(cats).join()).hasSize(384);

      List<ScoredToken> suggestions = graph.suggestNeighbors(cat, 5).join();
      assertThat(suggestions).extracting(ScoredToken::id).contains(dog, cats).doesNotContain(cat);
    }
  }

  private static AdjacencyOracle oracle() {
    return new AdjacencyOracle() {
      @Override
      public CompletableFuture<AdjacencyDelta> seedAdjacency(String token) {
        return expandAdjacency(token);
      }

      @Override
      public CompletableFuture<AdjacencyDelta> expandAdjacency(String token) {
        return completedFuture(new AdjacencyDelta(
            List.of(AdjacencyDelta.Node.of("ocean", "ocean", 0.9), AdjacencyDelta.Node.of("wave", "wave", 0.8)),
            List.of(AdjacencyDelta.Edge.of("ocean", "wave", 0.9))));
      }
    };
  }

  @Test
  void growthRegistersAndEmbedsNodes() {
    try (TokenGraph graph = TokenGraph.open(TokenGraphConfig.builder().build()).join()) {
      GrowthResult result = graph.newGrowthEngine(oracle(), ThoughtSink.NONE).run("sea").join();

      assertThat(result.hubs()).isNotEmpty();
      assertThat(graph.shardStore().listTokens().join()).extracting(TokenEntry::text)
          .contains("sea", "ocean", "wave");
      long ocean = graph.shardStore().ensureToken("ocean").join();
      assertThat(graph.vectors().store().get(ocean).join()).hasSize(384);
    }
  }

  @Test
  void memoryGraphRunsEveryLoopOnTheConfiguredExecutor() {
    ExecutorService pool = Executors.newFixedThreadPool(2);
    TokenGraphConfig config = TokenGraphConfig.builder()
        .shardStore(ShardStoreConfig.builder().backgroundExecutor(pool).build())
        .growth(GrowthConfig.builder().backgroundExecutor(pool).iterationLimit(2).build())
        .build();
    try (TokenGraph graph = TokenGraph.open(config).join()) {
      ShardStore store = graph.shardStore();
      BulkImportResult imported = store.bulkImport(List.of(
          ImportItem.byText("river", List.of(new EdgeRow(2, 0, 10, 0))),
          ImportItem.byText("delta", List.of()))).join();
      assertThat(imported.imported()).isEqualTo(2);

      assertThat(store.prune(GcPolicy.builder().build()).join()).isEqualTo(1);
      assertThat(store.compact().join()).isEqualTo(2);
      assertThat(store.gc().join()).isEqualTo(2);
      graph.vectors().flushNow().join();

      GrowthResult result = graph.newGrowthEngine(oracle(), ThoughtSink.NONE).run("river").join();
      assertThat(result.iterations()).isPositive();
      assertThat(store.listTokens().join()).extracting(TokenEntry::text).contains("river", "delta", "ocean");
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void exportMirrorFollowsTheStore() {
    TokenGraphConfig config = TokenGraphConfig.builder().exportDirectory(dir).build();
    try (TokenGraph graph = TokenGraph.open(config).join()) {
      long cat = graph.shardStore().ensureToken("cat").join();
      graph.shardStore().upsertAdj(cat, List.of(new EdgeRow(2, 0, 1, 0)), false).join();
      graph.exportMirror().flush().join();

      assertThat(Files.exists(dir.resolve("chunks/001.json"))).isTrue();
      assertThat(Files.exists(dir.resolve("metadata.json"))).isTrue();
    }
  }

  @Test
  void withoutExportDirectoryThereIsNoMirror() {
    try (TokenGraph graph = TokenGraph.open(TokenGraphConfig.builder().build()).join()) {
      assertThat(graph.exportMirror()).isNull();
    }
  }

  @Test
  void providerMustMatchVectorConfig() {
    assertThatThrownBy(() -> TokenGraphConfig.builder()
        .vectors(VectorStoreConfig.builder().dimension(64).build())
        .embeddingProvider(new HashingEmbeddingProvider(32))
        .build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TokenGraphConfig.builder()
        .vectors(VectorStoreConfig.builder().provider("remote").dimension(32).build())
        .embeddingProvider(new HashingEmbeddingProvider(32))
        .build())
        .isInstanceOf(IllegalArgumentException.class);
  }
}
