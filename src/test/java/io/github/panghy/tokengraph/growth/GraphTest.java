package io.github.panghy.tokengraph.growth;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;
import org.junit.jupiter.api.Test;

class GraphTest {

  static Graph graphOf(String... ids) {
    Graph g = new Graph();
    for (String id : ids) g.addNode(new GraphNode(id, id, 0.0, Layer.VISIBLE, false));
    return g;
  }

  static void link(Graph g, String src, String dst, double weight) {
    g.addEdge(new GraphEdge(src, dst, weight, "instance", Layer.VISIBLE));
  }

  @Test
  void nodesKeepFirstInsertion() {
    Graph g = graphOf("a", "b");

    boolean added = g.addNode(new GraphNode("a", "other label", 5.0, Layer.HIDDEN, true));

    assertThat(added).isFalse();
    assertThat(g.node("a").getLabel()).isEqualTo("a");
    assertThat(g.nodeIds()).containsExactly("a", "b");
  }

  @Test
  void edgesAreUniquePerDirectedPair() {
    Graph g = graphOf("a", "b");

    assertThat(g.addEdge(new GraphEdge("a", "b", 0.5, "instance", Layer.VISIBLE))).isTrue();
    assertThat(g.addEdge(new GraphEdge("a", "b", 0.9, "core", Layer.HIDDEN))).isFalse();
    assertThat(g.addEdge(new GraphEdge("b", "a", 0.9, "core", Layer.HIDDEN))).isTrue();

    assertThat(g.edgeCount()).isEqualTo(2);
    assertThat(g.edges().get(0).weight()).isEqualTo(0.5);
  }

  @Test
  void neighborsIgnoreDirectionAndSelfLoops() {
    Graph g = graphOf("a", "b", "c");
    link(g, "a", "b", 1);
    link(g, "c", "a", 1);
    link(g, "a", "a", 1);

    assertThat(g.neighbors("a")).containsExactly("b", "c");
    assertThat(g.neighbors("b")).containsExactly("a");
  }

  @Test
  void retainKeepsEdgesBetweenKeptNodes() {
    Graph g = graphOf("a", "b", "c");
    link(g, "a", "b", 1);
    link(g, "b", "c", 1);

    Graph kept = g.retain(Set.of("a", "b"));

    assertThat(kept.nodeIds()).containsExactly("a", "b");
    assertThat(kept.edgeCount()).isEqualTo(1);
  }

  @Test
  void limitBoundsNodesThenEdges() {
    Graph g = graphOf("a", "b", "c", "d");
    link(g, "a", "b", 1);
    link(g, "b", "c", 1);
    link(g, "a", "c", 1);
    link(g, "c", "d", 1);

    Graph limited = g.limit(3, 2);

    assertThat(limited.nodeIds()).containsExactly("a", "b", "c");
    assertThat(limited.edgeCount()).isEqualTo(2);
    assertThat(g.limit(10, 10)).isSameAs(g);
  }

  @Test
  void copyIsIndependentOfLaterChanges() {
    Graph g = graphOf("a");
    Graph snapshot = g.copy();

    g.node("a").incrementAppearance();
    g.addNode(new GraphNode("b", "b", 0, Layer.VISIBLE, false));

    assertThat(snapshot.node("a").getAppearanceFrequency()).isEqualTo(1);
    assertThat(snapshot.nodeCount()).isEqualTo(1);
  }

  @Test
  void embeddingStates() {
    GraphNode n = new GraphNode("a", "a", 0, Layer.VISIBLE, false);
    assertThat(n.embeddingAttempted()).isFalse();

    n.setEmbedding(new float[0]);
    assertThat(n.embeddingAttempted()).isTrue();
    assertThat(n.hasEmbedding()).isFalse();

    n.setEmbedding(new float[] {1f});
    assertThat(n.hasEmbedding()).isTrue();
  }
}
