package io.github.panghy.tokengraph.growth;

/**
 * Which expansion produced a node or edge.
 */
public enum Layer {
  /** Breadth frontier: ring and child expansions. */
  VISIBLE,
  /** Salience-triggered deep dive. */
  HIDDEN
}
