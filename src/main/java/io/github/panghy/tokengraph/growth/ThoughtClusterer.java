package io.github.panghy.tokengraph.growth;

import io.github.panghy.tokengraph.util.VectorMath;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups nodes joined by edges at or above an affinity threshold and scores each group.
 */
public final class ThoughtClusterer {
  static final double DEFAULT_SEMANTIC = 0.5;
  static final double SPECTRAL = 0.5;

  private final double affinityThreshold;

  public ThoughtClusterer(double affinityThreshold) {
    this.affinityThreshold = affinityThreshold;
  }

  /** Connected components of size two or more, in order of their first node. */
  public List<ThoughtCluster> clusters(Graph graph) {
    Map<String, List<String>> adjacency = new HashMap<>();
    for (GraphEdge e : graph.edges()) {
      if (e.weight() < affinityThreshold) continue;
      adjacency.computeIfAbsent(e.src(), k -> new ArrayList<>()).add(e.dst());
      adjacency.computeIfAbsent(e.dst(), k -> new ArrayList<>()).add(e.src());
    }
    List<ThoughtCluster> out = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (GraphNode start : graph.nodes()) {
      if (!seen.add(start.getId())) continue;
      List<String> members = new ArrayList<>();
      Deque<String> queue = new ArrayDeque<>();
      queue.add(start.getId());
      while (!queue.isEmpty()) {
        String id = queue.poll();
        members.add(id);
        for (String next : adjacency.getOrDefault(id, List.of())) {
          if (graph.hasNode(next) && seen.add(next)) queue.add(next);
        }
      }
      if (members.size() > 1) out.add(new ThoughtCluster(out.size(), List.copyOf(members)));
    }
    return out;
  }

  public ClusterSignal signal(Graph graph, ThoughtCluster cluster) {
    Map<String, float[]> embeddings = new LinkedHashMap<>();
    for (String id : cluster.nodeIds()) {
      GraphNode n = graph.node(id);
      if (n != null && n.hasEmbedding()) embeddings.put(id, n.getEmbedding());
    }
    double structural = Math.min(1.0, 0.6 + 0.05 * cluster.size());
    return new ClusterSignal(cluster, embeddings, structural, SPECTRAL, semanticCoherence(embeddings));
  }

  /**
   * Mean pairwise cosine similarity clamped to {@code [0, 1]}; 0.5 with fewer than two vectors.
   */
  static double semanticCoherence(Map<String, float[]> embeddings) {
    List<float[]> vectors = new ArrayList<>(embeddings.values());
    double sum = 0;
    int pairs = 0;
    for (int i = 0; i < vectors.size(); i++) {
      for (int j = i + 1; j < vectors.size(); j++) {
        if (vectors.get(i).length != vectors.get(j).length) continue;
        sum += VectorMath.cosine(vectors.get(i), vectors.get(j));
        pairs++;
      }
    }
    if (pairs == 0) return DEFAULT_SEMANTIC;
    return Math.max(0, Math.min(1, sum / pairs));
  }
}
