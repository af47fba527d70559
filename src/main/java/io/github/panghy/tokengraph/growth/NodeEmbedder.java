package io.github.panghy.tokengraph.growth;

import io.github.panghy.tokengraph.kb.ShardStore;
import io.github.panghy.tokengraph.vector.EmbeddingProvider;
import io.github.panghy.tokengraph.vector.VectorService;
import java.util.concurrent.CompletableFuture;

/**
 * Computes embeddings for nodes added during a run.
 */
@FunctionalInterface
public interface NodeEmbedder {

  CompletableFuture<float[]> embed(String label);

  /** Embeds directly with a provider, nothing is persisted. */
  static NodeEmbedder of(EmbeddingProvider provider) {
    return provider::embed;
  }

  /**
   * Registers the label as a token and returns its stored embedding, computing and persisting it
   * on first use.
   */
  static NodeEmbedder persistent(ShardStore shardStore, VectorService vectors) {
    return label -> shardStore.ensureToken(label)
        .thenCompose(id -> vectors.ensureEmbedding(id, label));
  }

  /** Leaves every node without an embedding. */
  static NodeEmbedder none() {
    return label -> CompletableFuture.completedFuture(new float[0]);
  }
}
