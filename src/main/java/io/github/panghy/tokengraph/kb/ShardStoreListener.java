package io.github.panghy.tokengraph.kb;

import io.github.panghy.tokengraph.codec.EdgeRow;
import java.util.List;

/**
 * Receives change notifications from a {@link ShardStore}. Callbacks run after the change
 * committed, on the thread that completed it, and must not block.
 */
public interface ShardStoreListener {

  /**
   * Called after {@code ensureToken} resolved a token.
   *
   * @param created whether the id was allocated by this call
   */
  default void onTokenObserved(long tokenId, String text, boolean created) {}

  /**
   * Called after the edges of {@code tokenId} were rewritten.
   *
   * @param edges the token's complete edge set after the write
   */
  default void onGraphUpdated(long tokenId, List<EdgeRow> edges) {}
}
