package io.github.panghy.tokengraph.growth;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The in-memory working graph of one growth run. Not thread-safe.
 *
 * <p>Nodes keep insertion order. At most one edge exists per {@code (src, dst)} pair.</p>
 */
public final class Graph {
  private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
  private final List<GraphEdge> edges = new ArrayList<>();
  private final Set<List<String>> edgeKeys = new HashSet<>();

  public boolean hasNode(String id) {
    return nodes.containsKey(id);
  }

  public GraphNode node(String id) {
    return nodes.get(id);
  }

  /** Adds a node unless one with the same id exists. Returns whether it was added. */
  public boolean addNode(GraphNode node) {
    return nodes.putIfAbsent(node.getId(), node) == null;
  }

  /** Adds an edge unless one with the same endpoints exists. Returns whether it was added. */
  public boolean addEdge(GraphEdge edge) {
    if (!edgeKeys.add(List.of(edge.src(), edge.dst()))) return false;
    edges.add(edge);
    return true;
  }

  public Collection<GraphNode> nodes() {
    return Collections.unmodifiableCollection(nodes.values());
  }

  public Set<String> nodeIds() {
    return Collections.unmodifiableSet(nodes.keySet());
  }

  public List<GraphEdge> edges() {
    return Collections.unmodifiableList(edges);
  }

  public int nodeCount() {
    return nodes.size();
  }

  public int edgeCount() {
    return edges.size();
  }

  /** Distinct neighbors of {@code id} over all edges, ignoring direction. */
  public Set<String> neighbors(String id) {
    Set<String> out = new LinkedHashSet<>();
    for (GraphEdge e : edges) {
      if (e.touches(id)) out.add(e.other(id));
    }
    out.remove(id);
    return out;
  }

  /**
   * Returns a new graph holding the kept nodes (in this graph's order) and the edges whose both
   * endpoints are kept.
   */
  public Graph retain(Set<String> keep) {
    Graph out = new Graph();
    for (GraphNode n : nodes.values()) {
      if (keep.contains(n.getId())) out.addNode(n);
    }
    for (GraphEdge e : edges) {
      if (out.hasNode(e.src()) && out.hasNode(e.dst())) out.addEdge(e);
    }
    return out;
  }

  /**
   * Keeps the first {@code maxNodes} nodes and, among edges between them, the first
   * {@code maxEdges}.
   */
  public Graph limit(int maxNodes, int maxEdges) {
    if (nodes.size() <= maxNodes && edges.size() <= maxEdges) return this;
    Graph out = new Graph();
    for (GraphNode n : nodes.values()) {
      if (out.nodeCount() >= maxNodes) break;
      out.addNode(n);
    }
    for (GraphEdge e : edges) {
      if (out.edgeCount() >= maxEdges) break;
      if (out.hasNode(e.src()) && out.hasNode(e.dst())) out.addEdge(e);
    }
    return out;
  }

  /** Deep copy; nodes are copied so the snapshot does not change with the run. */
  public Graph copy() {
    Graph out = new Graph();
    for (GraphNode n : nodes.values()) out.addNode(n.copy());
    for (GraphEdge e : edges) out.addEdge(e);
    return out;
  }

  @Override
  public String toString() {
    return "Graph{nodes=" + nodes.size() + ", edges=" + edges.size() + "}";
  }
}
