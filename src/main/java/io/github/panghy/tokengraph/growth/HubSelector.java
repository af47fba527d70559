package io.github.panghy.tokengraph.growth;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Picks the most salient eligible token.
 */
public final class HubSelector {
  private final Set<String> stopwords;

  /** @param stopwords lowercase words that are never selected */
  public HubSelector(Set<String> stopwords) {
    this.stopwords = Set.copyOf(stopwords);
  }

  /**
   * Returns the highest scoring node whose id and label are not stopwords. Ties go to the entry
   * seen first. Falls back to {@code previousHub} when nothing is eligible.
   */
  public String select(Graph graph, Map<String, Double> salience, String previousHub) {
    String best = previousHub;
    double bestScore = Double.NEGATIVE_INFINITY;
    for (Map.Entry<String, Double> entry : salience.entrySet()) {
      if (isStopword(graph, entry.getKey())) continue;
      double score = entry.getValue();
      if (score > bestScore) {
        bestScore = score;
        best = entry.getKey();
      }
    }
    return best;
  }

  boolean isStopword(Graph graph, String id) {
    if (stopwords.contains(id.toLowerCase(Locale.ROOT))) return true;
    GraphNode node = graph.node(id);
    return node != null && stopwords.contains(node.getLabel().toLowerCase(Locale.ROOT));
  }
}
