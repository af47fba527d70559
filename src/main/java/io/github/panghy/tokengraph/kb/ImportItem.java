package io.github.panghy.tokengraph.kb;

import io.github.panghy.tokengraph.codec.EdgeRow;
import java.util.List;

/**
 * One record of a bulk import. Identified by {@code tokenId} when set, otherwise by {@code token}
 * text. Items with neither are skipped.
 */
public record ImportItem(Long tokenId, String token, List<EdgeRow> edges) {

  public static ImportItem byId(long tokenId, List<EdgeRow> edges) {
    return new ImportItem(tokenId, null, edges);
  }

  public static ImportItem byText(String token, List<EdgeRow> edges) {
    return new ImportItem(null, token, edges);
  }
}
