package io.github.panghy.tokengraph.vector;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves {@link EmbeddingRequest}s on its own executor and posts one {@link EmbeddingResponse}
 * per request to a reply sink. Never throws back to the sender; failures become error replies.
 */
public final class EmbeddingWorker implements Consumer<EmbeddingRequest> {
  private static final Logger LOGGER = LoggerFactory.getLogger(EmbeddingWorker.class);

  private final EmbeddingProvider delegate;
  private final Executor executor;
  private volatile Consumer<EmbeddingResponse> replies;

  public EmbeddingWorker(EmbeddingProvider delegate, Executor executor) {
    this.delegate = Objects.requireNonNull(delegate);
    this.executor = Objects.requireNonNull(executor);
  }

  /** Sets the sink replies are posted to. Must be called before the first request. */
  public void replyTo(Consumer<EmbeddingResponse> replies) {
    this.replies = Objects.requireNonNull(replies);
  }

  @Override
  public void accept(EmbeddingRequest request) {
    Consumer<EmbeddingResponse> sink = Objects.requireNonNull(replies, "reply sink not set");
    CompletableFuture.supplyAsync(() -> delegate.embed(request.texts()), executor)
        .thenCompose(f -> f)
        .whenComplete((vectors, error) -> sink.accept(toResponse(request, vectors, error)));
  }

  private EmbeddingResponse toResponse(EmbeddingRequest request, List<float[]> vectors, Throwable error) {
    if (error != null) {
      LOGGER.debug("Embedding request {} failed", request.correlationId(), error);
      Throwable cause = error.getCause() != null ? error.getCause() : error;
      return EmbeddingResponse.failure(request.correlationId(), cause.getMessage());
    }
    if (vectors == null || vectors.size() != request.texts().size()) {
      return EmbeddingResponse.failure(request.correlationId(),
          "provider returned " + (vectors == null ? 0 : vectors.size()) + " vectors for "
              + request.texts().size() + " texts");
    }
    return EmbeddingResponse.success(request.correlationId(), vectors);
  }
}
