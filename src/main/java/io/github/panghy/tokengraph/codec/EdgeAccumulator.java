package io.github.panghy.tokengraph.codec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects edges keyed by {@code (neighborId, type)}. A row added for an existing key replaces
 * it whole (last write wins), keeping the key's original position.
 */
public final class EdgeAccumulator {
  private final Map<EdgeRow.EdgeKey, EdgeRow> rows = new LinkedHashMap<>();

  public void add(EdgeRow row) {
    rows.put(row.key(), row);
  }

  public void addAll(Collection<EdgeRow> edges) {
    for (EdgeRow row : edges) add(row);
  }

  public void addBlock(EdgeBlock block) {
    for (int i = 0; i < block.count(); i++) add(block.rowAt(i));
  }

  /** Drops every row whose key is in {@code keys}. */
  public int removeAll(Collection<EdgeRow.EdgeKey> keys) {
    int before = rows.size();
    rows.keySet().removeAll(keys);
    return before - rows.size();
  }

  public int size() {
    return rows.size();
  }

  public List<EdgeRow> rows() {
    return new ArrayList<>(rows.values());
  }

  /**
   * Splits the rows into contiguous blocks numbered from 0: {@code ceil(N / BLOCK_MAX)} blocks,
   * all full except the last. An empty accumulator yields a single empty block 0 so the token
   * keeps a placeholder until {@code gc}.
   */
  public List<EdgeBlock> toBlocks(long tokenId) {
    List<EdgeRow> all = rows();
    List<EdgeBlock> blocks = new ArrayList<>(partsFor(all.size()));
    if (all.isEmpty()) {
      blocks.add(EdgeBlock.of(tokenId, 0, List.of()));
      return blocks;
    }
    for (int offset = 0; offset < all.size(); offset += EdgeBlock.BLOCK_MAX) {
      List<EdgeRow> slice = all.subList(offset, Math.min(all.size(), offset + EdgeBlock.BLOCK_MAX));
      blocks.add(EdgeBlock.of(tokenId, blocks.size(), slice));
    }
    return blocks;
  }

  /** Number of parts needed for {@code degree} edges, at least 1. */
  public static int partsFor(int degree) {
    return Math.max(1, (Math.max(0, degree) + EdgeBlock.BLOCK_MAX - 1) / EdgeBlock.BLOCK_MAX);
  }
}
