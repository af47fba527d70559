package io.github.panghy.tokengraph.growth;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Prunes a working graph to the neighborhood of one or more centers.
 */
public final class GraphCollapser {
  public static final int DEFAULT_FAN_OUT = 9;

  private final int fanOut;

  public GraphCollapser() {
    this(DEFAULT_FAN_OUT);
  }

  public GraphCollapser(int fanOut) {
    if (fanOut < 0) throw new IllegalArgumentException("fanOut must not be negative");
    this.fanOut = fanOut;
  }

  /**
   * Keeps every center present in the graph, the {@code fanOut} heaviest direct neighbors of each,
   * and every node within {@code radius} undirected hops of a center. Edges survive when both
   * endpoints do.
   *
   * @return the collapsed graph, or {@code graph} itself when fewer than two nodes would remain
   */
  public Graph collapse(Graph graph, Collection<String> centers, int radius) {
    Map<String, Map<String, Double>> adjacency = ContextSalience.weightedAdjacency(graph);
    Set<String> keep = new LinkedHashSet<>();
    List<String> valid = new ArrayList<>();
    for (String c : centers) {
      if (graph.hasNode(c) && keep.add(c)) valid.add(c);
    }
    for (String c : valid) {
      Map<String, Double> neighbors = adjacency.getOrDefault(c, Map.of());
      neighbors.entrySet().stream()
          .filter(e -> !e.getKey().equals(c))
          .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()))
          .limit(fanOut)
          .forEach(e -> keep.add(e.getKey()));
    }
    Map<String, Integer> depth = new HashMap<>();
    Deque<String> queue = new ArrayDeque<>();
    for (String c : valid) {
      depth.put(c, 0);
      queue.add(c);
    }
    while (!queue.isEmpty()) {
      String current = queue.poll();
      int d = depth.get(current);
      if (d >= radius) continue;
      for (String next : adjacency.getOrDefault(current, Map.of()).keySet()) {
        if (depth.putIfAbsent(next, d + 1) == null) {
          keep.add(next);
          queue.add(next);
        }
      }
    }
    if (keep.size() < 2) return graph;
    return graph.retain(keep);
  }
}
