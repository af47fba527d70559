package io.github.panghy.tokengraph.vector;

import java.util.List;

/**
 * Reply to an {@link EmbeddingRequest}. Exactly one of {@code vectors} and {@code error} is set.
 */
public record EmbeddingResponse(long correlationId, List<float[]> vectors, String error) {

  public static EmbeddingResponse success(long correlationId, List<float[]> vectors) {
    return new EmbeddingResponse(correlationId, vectors, null);
  }

  public static EmbeddingResponse failure(long correlationId, String error) {
    return new EmbeddingResponse(correlationId, null, error == null ? "embedding failed" : error);
  }

  public boolean ok() {
    return error == null;
  }
}
