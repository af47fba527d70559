package io.github.panghy.tokengraph.vector;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Per-token embedding persistence with similarity search inside one provider/dimension
 * namespace.
 */
public interface VectorStore {

  CompletableFuture<Void> init();

  boolean isInitialized();

  String provider();

  int dimension();

  /**
   * Stores a vector, normalizing and quantizing it if configured.
   *
   * @return future completing when persisted; fails with
   *     {@link io.github.panghy.tokengraph.DimensionMismatchException} on a wrong length
   */
  CompletableFuture<Void> put(long tokenId, float[] vector);

  /**
   * Returns the stored vector (dequantized), or null if the token has none.
   */
  CompletableFuture<float[]> get(long tokenId);

  /**
   * Returns up to {@code topK} tokens most similar to {@code tokenId}, best first, excluding the
   * token itself. Empty if the token has no vector.
   */
  CompletableFuture<List<ScoredToken>> similar(long tokenId, int topK);
}
