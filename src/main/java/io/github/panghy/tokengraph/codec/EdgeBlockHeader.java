package io.github.panghy.tokengraph.codec;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * JSON header written in front of the column bytes of an encoded block.
 */
public record EdgeBlockHeader(
    @JsonProperty("v") int version,
    @JsonProperty("tokenId") long tokenId,
    @JsonProperty("part") int part,
    @JsonProperty("count") int count,
    @JsonProperty("cols") List<String> cols) {

  public static final int VERSION = 1;
  public static final List<String> BASE_COLUMNS = List.of("neighbor", "type", "weight", "lastSeen");
  public static final List<String> FLAGGED_COLUMNS = List.of("neighbor", "type", "weight", "lastSeen", "flags");

  static EdgeBlockHeader describe(EdgeBlock block) {
    return new EdgeBlockHeader(
        VERSION, block.getTokenId(), block.getPart(), block.count(),
        block.hasFlags() ? FLAGGED_COLUMNS : BASE_COLUMNS);
  }

  boolean hasFlags() {
    return FLAGGED_COLUMNS.equals(cols);
  }

  /** Bytes per row for the declared columns. */
  int rowWidth() {
    return 4 + 2 + 4 + 4 + (hasFlags() ? 1 : 0);
  }
}
