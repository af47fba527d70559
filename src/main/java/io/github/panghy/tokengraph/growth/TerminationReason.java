package io.github.panghy.tokengraph.growth;

public enum TerminationReason {
  /** The same hub was selected on consecutive iterations. */
  STABLE_HUB,
  ITERATION_LIMIT,
  /** The abort predicate fired; the graph is partial. */
  ABORTED
}
