package io.github.panghy.tokengraph.growth;

import java.util.List;

/**
 * Outcome of a growth run.
 *
 * @param graph      the final working graph
 * @param hubs       hub selected by each completed iteration
 * @param summaries  one {@code "hub: neighbor, ..."} line per completed iteration
 * @param thoughts   narrations returned by the {@link ThoughtSink}
 * @param iterations completed iterations
 * @param reason     why the run stopped
 * @param failures   expansion steps skipped due to oracle failures
 * @param states     phases the run passed through, in order
 */
public record GrowthResult(
    Graph graph,
    List<String> hubs,
    List<String> summaries,
    List<String> thoughts,
    int iterations,
    TerminationReason reason,
    List<StepFailure> failures,
    List<GrowthState> states) {

  /** Last selected hub, or null if no iteration completed. */
  public String finalHub() {
    return hubs.isEmpty() ? null : hubs.get(hubs.size() - 1);
  }
}
