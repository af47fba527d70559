package io.github.panghy.tokengraph.vector;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Finds stored vectors close to a query vector. Implementations may be exact or approximate.
 */
public interface SimilarityIndex {

  /**
   * @param queryId token id of the query, excluded from results
   * @param query   query vector
   * @param topK    maximum number of results
   * @return results sorted by score descending
   */
  CompletableFuture<List<ScoredToken>> search(long queryId, float[] query, int topK);
}
