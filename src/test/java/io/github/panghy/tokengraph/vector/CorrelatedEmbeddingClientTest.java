package io.github.panghy.tokengraph.vector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.panghy.tokengraph.OracleFailureException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class CorrelatedEmbeddingClientTest {

  @Test
  void repliesCompleteTheMatchingCallOutOfOrder() {
    List<EmbeddingRequest> sent = new ArrayList<>();
    CorrelatedEmbeddingClient client = new CorrelatedEmbeddingClient("remote", 2, sent::add);

    CompletableFuture<List<float[]>> first = client.embed(List.of("a"));
    CompletableFuture<List<float[]>> second = client.embed(List.of("b"));
    assertThat(client.inflight()).isEqualTo(2);
    assertThat(sent.get(0).correlationId()).isNotEqualTo(sent.get(1).correlationId());

    client.receive(EmbeddingResponse.success(sent.get(1).correlationId(), List.of(new float[] {2, 2})));
    client.receive(EmbeddingResponse.success(sent.get(0).correlationId(), List.of(new float[] {1, 1})));

    assertThat(first.join().get(0)).containsExactly(1f, 1f);
    assertThat(second.join().get(0)).containsExactly(2f, 2f);
    assertThat(client.inflight()).isZero();
  }

  @Test
  void unknownRepliesAreIgnored() {
    List<EmbeddingRequest> sent = new ArrayList<>();
    CorrelatedEmbeddingClient client = new CorrelatedEmbeddingClient("remote", 2, sent::add);
    CompletableFuture<List<float[]>> call = client.embed(List.of("a"));

    client.receive(EmbeddingResponse.success(999, List.of(new float[] {0, 0})));

    assertThat(call).isNotDone();
    assertThat(client.inflight()).isEqualTo(1);
  }

  @Test
  void errorReplyFailsTheCall() {
    List<EmbeddingRequest> sent = new ArrayList<>();
    CorrelatedEmbeddingClient client = new CorrelatedEmbeddingClient("remote", 2, sent::add);
    CompletableFuture<List<float[]>> call = client.embed(List.of("a"));

    client.receive(EmbeddingResponse.failure(sent.get(0).correlationId(), "model not loaded"));

    assertThatThrownBy(call::join)
        .hasCauseInstanceOf(OracleFailureException.class)
        .hasMessageContaining("model not loaded");
  }

  @Test
  void closeFailsPendingCallsAndRejectsNewOnes() {
    CorrelatedEmbeddingClient client = new CorrelatedEmbeddingClient("remote", 2, request -> {});
    CompletableFuture<List<float[]>> call = client.embed(List.of("a"));

    client.close();

    assertThatThrownBy(call::join).hasCauseInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> client.embed(List.of("b")).join()).hasCauseInstanceOf(IllegalStateException.class);
  }

  @Test
  void transportFailureFailsTheCall() {
    CorrelatedEmbeddingClient client = new CorrelatedEmbeddingClient("remote", 2, request -> {
      throw new IllegalStateException("channel closed");
    });

    assertThatThrownBy(() -> client.embed(List.of("a")).join()).hasRootCauseMessage("channel closed");
    assertThat(client.inflight()).isZero();
  }

  @Test
  void localWorkerServesRequestsOnItsExecutor() throws Exception {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      HashingEmbeddingProvider hashing = new HashingEmbeddingProvider(8);
      CorrelatedEmbeddingClient client = CorrelatedEmbeddingClient.local(hashing, executor);

      List<float[]> vectors = client.embed(List.of("cat", "dog")).get(5, TimeUnit.SECONDS);

      assertThat(client.name()).isEqualTo(HashingEmbeddingProvider.NAME);
      assertThat(client.dimension()).isEqualTo(8);
      assertThat(vectors).hasSize(2);
      assertThat(vectors.get(0)).containsExactly(hashing.embedOne("cat"));
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void localWorkerTurnsProviderErrorsIntoFailedCalls() {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      EmbeddingProvider failing = new EmbeddingProvider() {
        @Override
        public String name() {
          return "failing";
        }

        @Override
        public int dimension() {
          return 4;
        }

        @Override
        public CompletableFuture<List<float[]>> embed(List<String> texts) {
          return CompletableFuture.failedFuture(new IllegalStateException("out of memory"));
        }
      };
      CorrelatedEmbeddingClient client = CorrelatedEmbeddingClient.local(failing, executor);

      assertThatThrownBy(() -> client.embed(List.of("cat")).get(5, TimeUnit.SECONDS))
          .hasCauseInstanceOf(OracleFailureException.class)
          .hasMessageContaining("out of memory");
    } finally {
      executor.shutdownNow();
    }
  }
}
