package io.github.panghy.tokengraph.growth;

import java.util.concurrent.CompletableFuture;

/**
 * Proposes adjacency for a token. Implementations may fail; the engine decides whether to fall
 * back to a synthetic delta.
 *
 * <p>The seed node's id is {@link AdjacencyDeltas#slugify} of the trimmed seed text, so
 * {@code slugify("New York")} is {@code "new-york"}. A seed delta attaches to the seed by using
 * that id as edge {@code src}; an edge whose endpoint matches no node id becomes a placeholder
 * node. Frontier tokens are passed by label, and their node ids are the ids the oracle assigned
 * when it first proposed them.</p>
 */
public interface AdjacencyOracle {

  /** Adjacency for the token a run starts from. */
  CompletableFuture<AdjacencyDelta> seedAdjacency(String token);

  /** Adjacency for a frontier token. */
  CompletableFuture<AdjacencyDelta> expandAdjacency(String token);
}
