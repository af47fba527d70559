package io.github.panghy.tokengraph.growth;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Salience that also rewards tokens shared by several semantic contexts around the hub and tokens
 * whose embeddings project sharply onto one of them.
 *
 * <p>Contexts are the hub with its heaviest neighbors (the ring), and each ring member with its
 * own heaviest neighbors other than the hub.</p>
 */
public final class ContextSalience {
  private final int ringSize;
  private final int branchSize;
  private final SalienceWeights weights;

  public ContextSalience(int ringSize, int branchSize, SalienceWeights weights) {
    this.ringSize = ringSize;
    this.branchSize = branchSize;
    this.weights = weights;
  }

  public Map<String, Double> compute(Graph graph, String hubId) {
    Map<String, Double> baseline = Salience.compute(graph, weights);
    double maxBaseline = 0;
    for (double v : baseline.values()) maxBaseline = Math.max(maxBaseline, v);

    List<ContextBasis> contexts = contexts(graph, hubId);
    Map<String, Double> scores = new LinkedHashMap<>();
    for (Map.Entry<String, Double> entry : baseline.entrySet()) {
      String id = entry.getKey();
      double normalized = maxBaseline > 0 ? entry.getValue() / maxBaseline : 0;
      int containing = 0;
      double peak = 0;
      GraphNode node = graph.node(id);
      for (ContextBasis context : contexts) {
        if (context.members().contains(id)) containing++;
        if (node.hasEmbedding() && context.basis().get(0).length == node.getEmbedding().length) {
          peak = Math.max(peak, context.peakiness(node.getEmbedding()));
        }
      }
      double intertwining = contexts.isEmpty() ? 0 : (double) containing / contexts.size();
      scores.put(id, weights.baseline() * normalized
          + weights.intertwining() * intertwining
          + weights.peakiness() * peak);
    }
    return scores;
  }

  /** Contexts around {@code hubId}; empty when the hub is missing or nothing is embedded. */
  List<ContextBasis> contexts(Graph graph, String hubId) {
    List<ContextBasis> out = new ArrayList<>();
    if (!graph.hasNode(hubId)) return out;
    Map<String, Map<String, Double>> adjacency = weightedAdjacency(graph);
    List<String> ring = heaviest(adjacency.get(hubId), Set.of(hubId), ringSize);
    addContext(graph, hubId, ring, out);
    for (String member : ring) {
      addContext(graph, member, heaviest(adjacency.get(member), Set.of(hubId, member), branchSize), out);
    }
    return out;
  }

  private static void addContext(Graph graph, String anchor, List<String> others, List<ContextBasis> out) {
    Set<String> members = new LinkedHashSet<>();
    members.add(anchor);
    members.addAll(others);
    List<float[]> vectors = new ArrayList<>();
    int dim = -1;
    for (String id : members) {
      GraphNode n = graph.node(id);
      if (n == null || !n.hasEmbedding()) continue;
      if (dim < 0) dim = n.getEmbedding().length;
      if (n.getEmbedding().length == dim) vectors.add(n.getEmbedding());
    }
    List<float[]> basis = ContextBasis.orthonormalize(vectors, members.size());
    if (!basis.isEmpty()) out.add(new ContextBasis(anchor, members, basis));
  }

  private static List<String> heaviest(Map<String, Double> neighbors, Set<String> exclude, int limit) {
    if (neighbors == null) return List.of();
    List<Map.Entry<String, Double>> entries = new ArrayList<>(neighbors.entrySet());
    entries.removeIf(e -> exclude.contains(e.getKey()));
    entries.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()));
    List<String> ids = new ArrayList<>();
    for (int i = 0; i < entries.size() && i < limit; i++) ids.add(entries.get(i).getKey());
    return ids;
  }

  static Map<String, Map<String, Double>> weightedAdjacency(Graph graph) {
    Map<String, Map<String, Double>> adjacency = new HashMap<>();
    for (GraphEdge e : graph.edges()) {
      adjacency.computeIfAbsent(e.src(), k -> new LinkedHashMap<>()).merge(e.dst(), e.weight(), Math::max);
      adjacency.computeIfAbsent(e.dst(), k -> new LinkedHashMap<>()).merge(e.src(), e.weight(), Math::max);
    }
    return adjacency;
  }
}
