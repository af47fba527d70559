package io.github.panghy.tokengraph.growth;

/**
 * A weighted edge of the working graph.
 */
public record GraphEdge(String src, String dst, double weight, String role, Layer layer) {

  boolean touches(String id) {
    return src.equals(id) || dst.equals(id);
  }

  String other(String id) {
    return src.equals(id) ? dst : src;
  }
}
