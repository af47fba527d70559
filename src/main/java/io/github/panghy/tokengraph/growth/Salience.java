package io.github.panghy.tokengraph.growth;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Baseline structural salience.
 */
public final class Salience {
  private Salience() {}

  /**
   * Scores every node as {@code degree * edges + weightSum * sum(edge weight) + frequency *
   * appearances}. The map iterates in the graph's node order.
   */
  public static Map<String, Double> compute(Graph graph, SalienceWeights weights) {
    Map<String, int[]> degree = new LinkedHashMap<>();
    Map<String, Double> weightSum = new LinkedHashMap<>();
    for (GraphNode n : graph.nodes()) {
      degree.put(n.getId(), new int[1]);
      weightSum.put(n.getId(), 0.0);
    }
    for (GraphEdge e : graph.edges()) {
      bump(degree, weightSum, e.src(), e.weight());
      if (!e.dst().equals(e.src())) bump(degree, weightSum, e.dst(), e.weight());
    }
    Map<String, Double> scores = new LinkedHashMap<>();
    for (GraphNode n : graph.nodes()) {
      double score = weights.degree() * degree.get(n.getId())[0]
          + weights.weightSum() * weightSum.get(n.getId())
          + weights.frequency() * n.getAppearanceFrequency();
      scores.put(n.getId(), score);
    }
    return scores;
  }

  private static void bump(Map<String, int[]> degree, Map<String, Double> weightSum, String id, double w) {
    int[] d = degree.get(id);
    if (d == null) return;
    d[0]++;
    weightSum.merge(id, w, Double::sum);
  }
}
