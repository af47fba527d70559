package io.github.panghy.tokengraph.growth;

import java.util.List;

/**
 * Nodes and edges proposed by the oracle for one expansion step.
 *
 * <p>Oracle output is passed through {@link AdjacencyDeltas#normalize} once, where it is
 * received; after that every field is non-null.</p>
 */
public record AdjacencyDelta(List<Node> nodes, List<Edge> edges) {

  public static final AdjacencyDelta EMPTY = new AdjacencyDelta(List.of(), List.of());

  /**
   * @param id        node id
   * @param label     display text, defaults to the id
   * @param weight    relevance, defaults to 0
   * @param embedding optional precomputed embedding
   * @param synthetic whether the node was produced by the fallback
   */
  public record Node(String id, String label, Double weight, float[] embedding, boolean synthetic) {

    public static Node of(String id, String label, double weight) {
      return new Node(id, label, weight, null, false);
    }
  }

  /**
   * @param weight defaults to 0.1
   * @param role   defaults to {@code instance}
   */
  public record Edge(String src, String dst, Double weight, String role) {

    public static Edge of(String src, String dst, double weight) {
      return new Edge(src, dst, weight, null);
    }
  }
}
