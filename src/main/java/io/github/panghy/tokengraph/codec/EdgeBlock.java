package io.github.panghy.tokengraph.codec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A shard of at most {@link #BLOCK_MAX} edges for one {@code (tokenId, part)} pair, held as
 * parallel columns.
 */
public final class EdgeBlock {
  public static final int BLOCK_MAX = 50_000;

  private final long tokenId;
  private final int part;
  private final long[] neighbor;
  private final int[] type;
  private final long[] weight;
  private final long[] lastSeen;
  // null when no row carries flags
  private final int[] flags;

  EdgeBlock(long tokenId, int part, long[] neighbor, int[] type, long[] weight, long[] lastSeen, int[] flags) {
    int count = neighbor.length;
    if (count > BLOCK_MAX) {
      throw new IllegalArgumentException("Block holds " + count + " edges, limit is " + BLOCK_MAX);
    }
    if (type.length != count || weight.length != count || lastSeen.length != count
        || (flags != null && flags.length != count)) {
      throw new IllegalArgumentException("Edge block columns have different lengths");
    }
    if (part < 0) throw new IllegalArgumentException("part must be >= 0");
    this.tokenId = tokenId;
    this.part = part;
    this.neighbor = neighbor;
    this.type = type;
    this.weight = weight;
    this.lastSeen = lastSeen;
    this.flags = flags;
  }

  /**
   * Builds a block from rows. The flags column is kept only if some row has flags; rows without
   * flags then store 0.
   */
  public static EdgeBlock of(long tokenId, int part, List<EdgeRow> rows) {
    int count = rows.size();
    long[] neighbor = new long[count];
    int[] type = new int[count];
    long[] weight = new long[count];
    long[] lastSeen = new long[count];
    int[] flags = new int[count];
    boolean hasFlags = false;
    for (int i = 0; i < count; i++) {
      EdgeRow row = rows.get(i);
      neighbor[i] = row.neighborId();
      type[i] = row.type();
      weight[i] = row.weight();
      lastSeen[i] = row.lastSeen();
      if (row.flags() != null) {
        hasFlags = true;
        flags[i] = row.flags();
      }
    }
    return new EdgeBlock(tokenId, part, neighbor, type, weight, lastSeen, hasFlags ? flags : null);
  }

  public long getTokenId() {
    return tokenId;
  }

  public int getPart() {
    return part;
  }

  public int count() {
    return neighbor.length;
  }

  public boolean hasFlags() {
    return flags != null;
  }

  public long neighborAt(int i) {
    return neighbor[i];
  }

  public int typeAt(int i) {
    return type[i];
  }

  public long weightAt(int i) {
    return weight[i];
  }

  public long lastSeenAt(int i) {
    return lastSeen[i];
  }

  /** Flag at row {@code i}, or null if the block has no flags column. */
  public Integer flagsAt(int i) {
    return flags == null ? null : flags[i];
  }

  public EdgeRow rowAt(int i) {
    return new EdgeRow(neighbor[i], type[i], weight[i], lastSeen[i], flagsAt(i));
  }

  public List<EdgeRow> rows() {
    List<EdgeRow> rows = new ArrayList<>(count());
    for (int i = 0; i < count(); i++) rows.add(rowAt(i));
    return Collections.unmodifiableList(rows);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof EdgeBlock)) return false;
    EdgeBlock that = (EdgeBlock) o;
    return tokenId == that.tokenId
        && part == that.part
        && Arrays.equals(neighbor, that.neighbor)
        && Arrays.equals(type, that.type)
        && Arrays.equals(weight, that.weight)
        && Arrays.equals(lastSeen, that.lastSeen)
        && Arrays.equals(flags, that.flags);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(tokenId, part);
    result = 31 * result + Arrays.hashCode(neighbor);
    result = 31 * result + Arrays.hashCode(type);
    result = 31 * result + Arrays.hashCode(weight);
    result = 31 * result + Arrays.hashCode(lastSeen);
    result = 31 * result + Arrays.hashCode(flags);
    return result;
  }

  @Override
  public String toString() {
    return "EdgeBlock{tokenId=" + tokenId + ", part=" + part + ", count=" + count() + ", flags=" + hasFlags() + "}";
  }
}
