package io.github.panghy.tokengraph.growth;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import lombok.Builder;
import lombok.Getter;

/**
 * Parameters of a growth run.
 */
@Getter
@Builder
public class GrowthConfig {
  public static final Set<String> DEFAULT_STOPWORDS = Set.of(
      "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "in", "is", "it", "of", "on",
      "or", "that", "the", "this", "to", "was", "with");

  /** Ring members taken from the hub's expansion each iteration. */
  @Builder.Default
  private final int ringSize = 9;

  /** Nodes kept from each child or deep-dive expansion. */
  @Builder.Default
  private final int childBranches = 5;

  /** Most salient unexpanded nodes that get a hidden deep dive each iteration. */
  @Builder.Default
  private final int hiddenTopK = 1;

  @Builder.Default
  private final int collapseRadius = 1;

  @Builder.Default
  private final int fanOut = GraphCollapser.DEFAULT_FAN_OUT;

  @Builder.Default
  private final int maxNodes = 256;

  @Builder.Default
  private final int maxEdges = 1024;

  /** Concurrent oracle and embedding calls. */
  @Builder.Default
  private final int concurrency = 4;

  @Builder.Default
  private final int iterationLimit = 8;

  /** Minimum edge weight joining two nodes into one thought cluster. */
  @Builder.Default
  private final double affinityThreshold = 0.5;

  @Builder.Default
  private final boolean allowSyntheticFallback = true;

  /** Whether hub selection uses {@link ContextSalience} instead of {@link Salience}. */
  @Builder.Default
  private final boolean contextSalience = false;

  @Builder.Default
  private final SalienceWeights salienceWeights = SalienceWeights.DEFAULT;

  @Builder.Default
  private final Set<String> stopwords = DEFAULT_STOPWORDS;

  @Builder.Default
  private final int adjacencyCacheSize = 1024;

  /** Runs continuations of the run's async loops. Default: ForkJoinPool.commonPool(). */
  @Builder.Default
  private final Executor backgroundExecutor = ForkJoinPool.commonPool();

  void validate() {
    if (ringSize <= 0) throw new IllegalArgumentException("ringSize must be positive");
    if (childBranches <= 0) throw new IllegalArgumentException("childBranches must be positive");
    if (hiddenTopK < 0) throw new IllegalArgumentException("hiddenTopK must not be negative");
    if (collapseRadius < 0) throw new IllegalArgumentException("collapseRadius must not be negative");
    if (maxNodes <= 0 || maxEdges <= 0) throw new IllegalArgumentException("budgets must be positive");
    if (concurrency <= 0) throw new IllegalArgumentException("concurrency must be positive");
    if (iterationLimit <= 0) throw new IllegalArgumentException("iterationLimit must be positive");
    if (adjacencyCacheSize <= 0) throw new IllegalArgumentException("adjacencyCacheSize must be positive");
    Objects.requireNonNull(backgroundExecutor, "backgroundExecutor must not be null");
  }
}
