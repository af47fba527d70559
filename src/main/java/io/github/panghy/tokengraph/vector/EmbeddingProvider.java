package io.github.panghy.tokengraph.vector;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Produces fixed-dimension embeddings for token texts. Timeouts, if any, belong to the provider.
 */
public interface EmbeddingProvider {

  String name();

  int dimension();

  /**
   * Embeds a batch of texts.
   *
   * @return future with one vector per text, in input order
   */
  CompletableFuture<List<float[]>> embed(List<String> texts);

  default CompletableFuture<float[]> embed(String text) {
    return embed(List.of(text)).thenApply(vectors -> vectors.get(0));
  }
}
