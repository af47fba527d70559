package io.github.panghy.tokengraph.growth;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normalization of oracle output and the deterministic synthetic fallback.
 */
public final class AdjacencyDeltas {
  static final double DEFAULT_EDGE_WEIGHT = 0.1;
  static final String DEFAULT_ROLE = "instance";

  private static final String[] VARIANTS = {"core", "context", "analogy", "role"};
  private static final double[] VARIANT_WEIGHTS = {0.82, 0.64, 0.58, 0.52};

  private AdjacencyDeltas() {}

  /**
   * Produces a canonical delta: null lists become empty, nodes and edges with blank ids are
   * dropped, labels default to the id, node weights to 0, edge weights to 0.1 and roles to
   * {@code instance}. Non-finite weights are treated as missing.
   */
  public static AdjacencyDelta normalize(AdjacencyDelta delta) {
    if (delta == null) return AdjacencyDelta.EMPTY;
    List<AdjacencyDelta.Node> nodes = new ArrayList<>();
    if (delta.nodes() != null) {
      for (AdjacencyDelta.Node n : delta.nodes()) {
        if (n == null || isBlank(n.id())) continue;
        String label = isBlank(n.label()) ? n.id() : n.label();
        double weight = finiteOr(n.weight(), 0.0);
        float[] embedding = n.embedding() == null || n.embedding().length == 0 ? null : n.embedding();
        nodes.add(new AdjacencyDelta.Node(n.id(), label, weight, embedding, n.synthetic()));
      }
    }
    List<AdjacencyDelta.Edge> edges = new ArrayList<>();
    if (delta.edges() != null) {
      for (AdjacencyDelta.Edge e : delta.edges()) {
        if (e == null || isBlank(e.src()) || isBlank(e.dst())) continue;
        String role = isBlank(e.role()) ? DEFAULT_ROLE : e.role();
        edges.add(new AdjacencyDelta.Edge(e.src(), e.dst(), finiteOr(e.weight(), DEFAULT_EDGE_WEIGHT), role));
      }
    }
    return new AdjacencyDelta(List.copyOf(nodes), List.copyOf(edges));
  }

  /**
   * Deterministic four-node delta around {@code srcId}: core, context, analogy and role variants
   * in descending weight.
   */
  public static AdjacencyDelta synthetic(String label, String srcId) {
    List<AdjacencyDelta.Node> nodes = new ArrayList<>(VARIANTS.length);
    List<AdjacencyDelta.Edge> edges = new ArrayList<>(VARIANTS.length);
    for (int i = 0; i < VARIANTS.length; i++) {
      String id = srcId + "-" + VARIANTS[i];
      nodes.add(new AdjacencyDelta.Node(id, label + " " + VARIANTS[i], VARIANT_WEIGHTS[i], null, true));
      edges.add(new AdjacencyDelta.Edge(srcId, id, VARIANT_WEIGHTS[i], VARIANTS[i]));
    }
    return new AdjacencyDelta(List.copyOf(nodes), List.copyOf(edges));
  }

  /**
   * Lowercase id made of letters, combining marks and digits from any script, separated by single
   * dashes. Text without any of those maps to {@code "node"}.
   */
  public static String slugify(String text) {
    String slug = text.toLowerCase(Locale.ROOT)
        .replaceAll("[^\\p{L}\\p{M}\\p{N}]+", "-")
        .replaceAll("^-+|-+$", "");
    return slug.isEmpty() ? "node" : slug;
  }

  /**
   * Keeps the {@code limit} highest-ranked nodes (see {@link #rank}) and drops edges that point at
   * removed nodes.
   */
  static AdjacencyDelta trim(AdjacencyDelta delta, int limit) {
    if (delta.nodes().size() <= limit) return delta;
    List<AdjacencyDelta.Node> kept = rank(delta).subList(0, limit);
    Set<String> dropped = new HashSet<>();
    for (AdjacencyDelta.Node n : delta.nodes()) dropped.add(n.id());
    for (AdjacencyDelta.Node n : kept) dropped.remove(n.id());
    List<AdjacencyDelta.Edge> edges = new ArrayList<>();
    for (AdjacencyDelta.Edge e : delta.edges()) {
      if (!dropped.contains(e.src()) && !dropped.contains(e.dst())) edges.add(e);
    }
    return new AdjacencyDelta(List.copyOf(kept), List.copyOf(edges));
  }

  /**
   * Nodes ordered by descending relevance, stable on ties. A node without its own weight takes the
   * heaviest delta edge touching it.
   */
  static List<AdjacencyDelta.Node> rank(AdjacencyDelta delta) {
    List<AdjacencyDelta.Node> sorted = new ArrayList<>(delta.nodes());
    sorted.sort((a, b) -> Double.compare(relevance(delta, b), relevance(delta, a)));
    return sorted;
  }

  private static double relevance(AdjacencyDelta delta, AdjacencyDelta.Node node) {
    if (node.weight() != null && node.weight() > 0) return node.weight();
    double best = 0;
    for (AdjacencyDelta.Edge e : delta.edges()) {
      if (e.src().equals(node.id()) || e.dst().equals(node.id())) best = Math.max(best, e.weight());
    }
    return best;
  }

  private static double finiteOr(Double value, double fallback) {
    return value == null || !Double.isFinite(value) ? fallback : value;
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
