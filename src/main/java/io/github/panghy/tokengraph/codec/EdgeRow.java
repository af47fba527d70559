package io.github.panghy.tokengraph.codec;

/**
 * One weighted edge from a token to {@code neighborId}.
 *
 * <p>All numeric fields are unsigned on disk: {@code neighborId}, {@code weight} and
 * {@code lastSeen} are u32, {@code type} is u16 and {@code flags} is an optional u8.</p>
 *
 * @param neighborId target token id
 * @param type       relation kind
 * @param weight     fixed-point weight
 * @param lastSeen   epoch seconds of the last observation
 * @param flags      optional flag byte, null when absent
 */
public record EdgeRow(long neighborId, int type, long weight, long lastSeen, Integer flags) {
  static final long U32_MAX = 0xFFFF_FFFFL;

  public EdgeRow {
    checkRange("neighborId", neighborId, U32_MAX);
    checkRange("type", type, 0xFFFF);
    checkRange("weight", weight, U32_MAX);
    checkRange("lastSeen", lastSeen, U32_MAX);
    if (flags != null) checkRange("flags", flags, 0xFF);
  }

  public EdgeRow(long neighborId, int type, long weight, long lastSeen) {
    this(neighborId, type, weight, lastSeen, null);
  }

  /** Merge identity of this row. */
  public EdgeKey key() {
    return new EdgeKey(neighborId, type);
  }

  /** Same row pointing at a different neighbor, used by reverse lookups. */
  public EdgeRow withNeighbor(long newNeighborId) {
    return new EdgeRow(newNeighborId, type, weight, lastSeen, flags);
  }

  private static void checkRange(String field, long value, long max) {
    if (value < 0 || value > max) {
      throw new IllegalArgumentException(field + " out of range [0, " + max + "]: " + value);
    }
  }

  /** Identity of an edge for merge purposes. */
  public record EdgeKey(long neighborId, int type) {}
}
