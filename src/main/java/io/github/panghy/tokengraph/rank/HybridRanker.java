package io.github.panghy.tokengraph.rank;

import io.github.panghy.tokengraph.codec.EdgeRow;
import io.github.panghy.tokengraph.kb.AdjacencyQuery;
import io.github.panghy.tokengraph.kb.ShardStore;
import io.github.panghy.tokengraph.vector.ScoredToken;
import io.github.panghy.tokengraph.vector.VectorStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blends graph adjacency and embedding similarity into one ranking.
 *
 * <p>{@code score = alpha * w / maxW + beta * cosine}, where {@code w} is the candidate's
 * strongest edge weight among the fetched neighbors and {@code maxW} the largest of those
 * weights. A candidate found by only one source gets 0 for the other term. Each source
 * contributes up to {@code 3 * topK} candidates.</p>
 */
public class HybridRanker {
  private static final Logger LOGGER = LoggerFactory.getLogger(HybridRanker.class);
  private static final int OVERSAMPLE = 3;

  private final ShardStore shardStore;
  private final VectorStore vectorStore;

  public HybridRanker(ShardStore shardStore, VectorStore vectorStore) {
    this.shardStore = shardStore;
    this.vectorStore = vectorStore;
  }

  public CompletableFuture<List<ScoredToken>> hybrid(HybridQuery query) {
    int fetch = query.getTopK() * OVERSAMPLE;
    AdjacencyQuery.Builder adj = AdjacencyQuery.builder(query.getTokenId())
        .minWeight(query.getMinWeight())
        .limit(fetch);
    if (query.getTypes() != null && !query.getTypes().isEmpty()) adj.types(query.getTypes());

    CompletableFuture<List<EdgeRow>> graph = shardStore.getAdj(adj.build());
    CompletableFuture<List<ScoredToken>> similar = vectorStore.similar(query.getTokenId(), fetch);
    return graph.thenCombine(similar, (edges, neighbors) -> blend(query, edges, neighbors));
  }

  static List<ScoredToken> blend(HybridQuery query, List<EdgeRow> edges, List<ScoredToken> similar) {
    Map<Long, Long> edgeWeight = new LinkedHashMap<>();
    long maxWeight = 0;
    for (EdgeRow edge : edges) {
      if (edge.neighborId() == query.getTokenId()) continue;
      edgeWeight.merge(edge.neighborId(), edge.weight(), Math::max);
      maxWeight = Math.max(maxWeight, edge.weight());
    }
    double safeMax = maxWeight == 0 ? 1.0 : maxWeight;

    Map<Long, Double> scores = new LinkedHashMap<>();
    edgeWeight.forEach((id, w) -> scores.put(id, query.getAlpha() * (w / safeMax)));
    for (ScoredToken s : similar) {
      if (s.id() == query.getTokenId()) continue;
      scores.merge(s.id(), query.getBeta() * s.score(), Double::sum);
    }

    List<ScoredToken> ranked = new ArrayList<>(scores.size());
    scores.forEach((id, score) -> ranked.add(new ScoredToken(id, score)));
    // stable sort keeps first-seen order among ties
    ranked.sort(Comparator.comparingDouble(ScoredToken::score).reversed());
    List<ScoredToken> top = ranked.size() > query.getTopK() ? ranked.subList(0, query.getTopK()) : ranked;
    LOGGER.debug("Hybrid tokenId={} graph={} vector={} ranked={}", query.getTokenId(), edgeWeight.size(),
        similar.size(), top.size());
    return List.copyOf(top);
  }
}
