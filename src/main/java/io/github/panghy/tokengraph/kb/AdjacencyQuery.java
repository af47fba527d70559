package io.github.panghy.tokengraph.kb;

import java.util.Set;

/**
 * Parameters for {@link ShardStore#getAdj}.
 *
 * <p>{@code types} null means any type; {@code minWeight} and {@code limit} null mean no bound.
 * In reverse mode the rows returned have {@code neighborId} set to the token that points at
 * {@code tokenId}.</p>
 */
public final class AdjacencyQuery {
  private final long tokenId;
  private final Set<Integer> types;
  private final Long minWeight;
  private final Integer limit;
  private final boolean reverse;

  private AdjacencyQuery(Builder b) {
    this.tokenId = b.tokenId;
    this.types = b.types == null ? null : Set.copyOf(b.types);
    this.minWeight = b.minWeight;
    if (b.limit != null && b.limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    this.limit = b.limit;
    this.reverse = b.reverse;
  }

  public static Builder builder(long tokenId) {
    return new Builder(tokenId);
  }

  /** Forward query for every edge of {@code tokenId}. */
  public static AdjacencyQuery forward(long tokenId) {
    return builder(tokenId).build();
  }

  public long getTokenId() {
    return tokenId;
  }

  public Set<Integer> getTypes() {
    return types;
  }

  public Long getMinWeight() {
    return minWeight;
  }

  public Integer getLimit() {
    return limit;
  }

  public boolean isReverse() {
    return reverse;
  }

  boolean matches(int type, long weight) {
    if (types != null && !types.contains(type)) return false;
    return minWeight == null || weight >= minWeight;
  }

  boolean isFull(int size) {
    return limit != null && size >= limit;
  }

  @Override
  public String toString() {
    return "AdjacencyQuery{tokenId=" + tokenId + ", types=" + types + ", minWeight=" + minWeight
        + ", limit=" + limit + ", reverse=" + reverse + "}";
  }

  public static final class Builder {
    private final long tokenId;
    private Set<Integer> types;
    private Long minWeight;
    private Integer limit;
    private boolean reverse;

    private Builder(long tokenId) {
      this.tokenId = tokenId;
    }

    public Builder type(int type) {
      this.types = Set.of(type);
      return this;
    }

    public Builder types(Set<Integer> types) {
      this.types = types;
      return this;
    }

    public Builder minWeight(Long minWeight) {
      this.minWeight = minWeight;
      return this;
    }

    public Builder limit(Integer limit) {
      this.limit = limit;
      return this;
    }

    public Builder reverse(boolean reverse) {
      this.reverse = reverse;
      return this;
    }

    public AdjacencyQuery build() {
      if (types != null && types.isEmpty()) throw new IllegalArgumentException("types must not be empty");
      return new AdjacencyQuery(this);
    }
  }
}
