package io.github.panghy.tokengraph.growth;

import static java.util.concurrent.CompletableFuture.completedFuture;

import com.apple.foundationdb.async.AsyncUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands a frontier with a bounded number of concurrent workers.
 *
 * <p>Workers share one queue. Oracle calls and embeddings run concurrently; each result is applied
 * to the graph under the run's lock. Workers stop pulling once the run is aborted or its budget is
 * reached, and results that resolve after an abort are dropped.</p>
 */
final class FrontierExpander {
  private static final Logger LOGGER = LoggerFactory.getLogger(FrontierExpander.class);

  private final GrowthRun run;
  private final int concurrency;
  private final Executor executor;

  FrontierExpander(GrowthRun run, int concurrency, Executor executor) {
    this.run = run;
    this.concurrency = concurrency;
    this.executor = executor;
  }

  /**
   * Expands every node in {@code frontier}.
   *
   * @param branchLimit nodes kept from each delta
   * @return the applied (trimmed) delta per expanded node id
   */
  CompletableFuture<Map<String, AdjacencyDelta>> expand(List<String> frontier, Layer layer, int branchLimit) {
    Queue<String> queue = new ConcurrentLinkedQueue<>(frontier);
    Map<String, AdjacencyDelta> applied = new ConcurrentHashMap<>();
    int workers = Math.min(concurrency, queue.size());
    List<CompletableFuture<Void>> loops = new ArrayList<>(workers);
    for (int i = 0; i < workers; i++) {
      loops.add(AsyncUtil.whileTrue(() -> {
        if (run.shouldStop()) return completedFuture(false);
        String id = queue.poll();
        if (id == null) return completedFuture(false);
        return expandOne(id, layer, branchLimit, applied).thenApply(v -> true);
      }, executor));
    }
    return CompletableFuture.allOf(loops.toArray(CompletableFuture[]::new)).thenApply(v -> applied);
  }

  private CompletableFuture<Void> expandOne(
      String id, Layer layer, int branchLimit, Map<String, AdjacencyDelta> applied) {
    String label = run.labelOf(id);
    if (label == null) return completedFuture(null);
    run.markExpanded(id);
    return run.adjacency(GrowthRun.AdjacencyKind.EXPAND, label, id)
        .handle((delta, error) -> {
          if (error != null) {
            run.recordFailure(label, GrowthRun.unwrap(error));
            return null;
          }
          return delta;
        })
        .thenCompose(delta -> {
          if (delta == null) return completedFuture(null);
          if (run.aborted()) {
            LOGGER.debug("Discarding expansion of '{}' resolved after abort", label);
            return completedFuture(null);
          }
          AdjacencyDelta trimmed = AdjacencyDeltas.trim(delta, branchLimit);
          applied.put(id, trimmed);
          return run.applyAndEmbed(id, trimmed, layer);
        });
  }
}
