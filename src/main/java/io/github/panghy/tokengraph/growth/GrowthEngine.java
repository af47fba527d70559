package io.github.panghy.tokengraph.growth;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

/**
 * Grows a working graph around a seed token in "breaths": expand the hub's ring and its children,
 * bound the graph, collapse it around the hub, and pick the next hub by salience. A run stops when
 * the hub is stable, the iteration limit is hit, or the abort predicate fires.
 *
 * <p>Every run owns its graph; runs may execute concurrently on one engine.</p>
 */
public class GrowthEngine {
  private final AdjacencyOracle oracle;
  private final NodeEmbedder embedder;
  private final ThoughtSink sink;
  private final GrowthConfig config;

  public GrowthEngine(AdjacencyOracle oracle, NodeEmbedder embedder, GrowthConfig config) {
    this(oracle, embedder, ThoughtSink.NONE, config);
  }

  public GrowthEngine(AdjacencyOracle oracle, NodeEmbedder embedder, ThoughtSink sink, GrowthConfig config) {
    this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
    this.embedder = Objects.requireNonNull(embedder, "embedder must not be null");
    this.sink = sink == null ? ThoughtSink.NONE : sink;
    this.config = Objects.requireNonNull(config, "config must not be null");
    config.validate();
  }

  public GrowthConfig getConfig() {
    return config;
  }

  public CompletableFuture<GrowthResult> run(String seed) {
    return run(seed, () -> false);
  }

  /**
   * Starts a run.
   *
   * @param seed  token to grow from
   * @param abort polled between iterations and before each frontier item
   * @return the result; fails with {@link io.github.panghy.tokengraph.OracleFailureException} only
   *     when the seed adjacency cannot be obtained and synthetic fallback is disabled
   */
  public CompletableFuture<GrowthResult> run(String seed, BooleanSupplier abort) {
    if (seed == null || seed.isBlank()) {
      return CompletableFuture.failedFuture(new IllegalArgumentException("seed must not be blank"));
    }
    Objects.requireNonNull(abort, "abort must not be null");
    return new GrowthRun(config, oracle, embedder, sink, abort).start(seed);
  }
}
