package io.github.panghy.tokengraph.rank;

import java.util.Set;

/**
 * Parameters for {@link HybridRanker#hybrid}.
 */
public final class HybridQuery {
  public static final double DEFAULT_ALPHA = 0.6;
  public static final double DEFAULT_BETA = 0.4;

  private final long tokenId;
  private final int topK;
  private final double alpha;
  private final double beta;
  private final Long minWeight;
  private final Set<Integer> types;

  private HybridQuery(Builder b) {
    if (b.topK <= 0) throw new IllegalArgumentException("topK must be positive");
    if (!Double.isFinite(b.alpha) || !Double.isFinite(b.beta)) {
      throw new IllegalArgumentException("alpha and beta must be finite");
    }
    this.tokenId = b.tokenId;
    this.topK = b.topK;
    this.alpha = b.alpha;
    this.beta = b.beta;
    this.minWeight = b.minWeight;
    this.types = b.types == null ? null : Set.copyOf(b.types);
  }

  public static Builder builder(long tokenId, int topK) {
    return new Builder(tokenId, topK);
  }

  public long getTokenId() {
    return tokenId;
  }

  public int getTopK() {
    return topK;
  }

  /** Weight of the normalized edge weight term. */
  public double getAlpha() {
    return alpha;
  }

  /** Weight of the cosine similarity term. */
  public double getBeta() {
    return beta;
  }

  public Long getMinWeight() {
    return minWeight;
  }

  public Set<Integer> getTypes() {
    return types;
  }

  public static final class Builder {
    private final long tokenId;
    private final int topK;
    private double alpha = DEFAULT_ALPHA;
    private double beta = DEFAULT_BETA;
    private Long minWeight;
    private Set<Integer> types;

    private Builder(long tokenId, int topK) {
      this.tokenId = tokenId;
      this.topK = topK;
    }

    public Builder alpha(double alpha) {
      this.alpha = alpha;
      return this;
    }

    public Builder beta(double beta) {
      this.beta = beta;
      return this;
    }

    public Builder minWeight(Long minWeight) {
      this.minWeight = minWeight;
      return this;
    }

    public Builder types(Set<Integer> types) {
      this.types = types;
      return this;
    }

    public HybridQuery build() {
      return new HybridQuery(this);
    }
  }
}
