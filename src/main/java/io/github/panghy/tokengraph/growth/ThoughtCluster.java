package io.github.panghy.tokengraph.growth;

import java.util.List;

/**
 * A connected component of strongly affine nodes.
 */
public record ThoughtCluster(int index, List<String> nodeIds) {

  public int size() {
    return nodeIds.size();
  }
}
