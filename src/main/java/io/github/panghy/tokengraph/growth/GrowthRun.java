package io.github.panghy.tokengraph.growth;

import static java.util.concurrent.CompletableFuture.completedFuture;

import com.apple.foundationdb.async.AsyncUtil;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.panghy.tokengraph.OracleFailureException;
import io.github.panghy.tokengraph.util.Metrics;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of a single growth run. The graph is only touched under {@link #lock}.
 */
final class GrowthRun {
  private static final Logger LOGGER = LoggerFactory.getLogger(GrowthRun.class);
  private static final int SUMMARY_NEIGHBORS = 5;

  enum AdjacencyKind {
    SEED("seed"),
    EXPAND("expand");

    private final String key;

    AdjacencyKind(String key) {
      this.key = key;
    }
  }

  private record PendingEmbedding(GraphNode node, float[] hint) {}

  private final GrowthConfig config;
  private final AdjacencyOracle oracle;
  private final NodeEmbedder embedder;
  private final ThoughtSink sink;
  private final BooleanSupplier abort;
  private final AsyncCache<String, AdjacencyDelta> adjacencyCache;
  private final FrontierExpander expander;
  private final GraphCollapser collapser;
  private final HubSelector hubSelector;
  private final ThoughtClusterer clusterer;
  private final ContextSalience contextSalience;

  private final Object lock = new Object();
  private Graph graph = new Graph();
  // "source|node" pairs already counted towards appearance frequency
  private final Set<String> mentions = new HashSet<>();
  private final Set<String> expanded = ConcurrentHashMap.newKeySet();
  private final List<StepFailure> failures = Collections.synchronizedList(new ArrayList<>());
  private final List<GrowthState> states = new ArrayList<>();
  private final List<String> hubs = new ArrayList<>();
  private final List<String> summaries = new ArrayList<>();
  private final List<String> thoughts = new ArrayList<>();

  private String hub;
  private String lastSelected;
  private int streak;
  private int iterations;
  private TerminationReason reason;

  GrowthRun(
      GrowthConfig config, AdjacencyOracle oracle, NodeEmbedder embedder, ThoughtSink sink, BooleanSupplier abort) {
    this.config = config;
    this.oracle = oracle;
    this.embedder = embedder;
    this.sink = sink;
    this.abort = abort;
    this.adjacencyCache = Caffeine.newBuilder()
        .maximumSize(config.getAdjacencyCacheSize())
        .executor(config.getBackgroundExecutor())
        .buildAsync();
    this.expander = new FrontierExpander(this, config.getConcurrency(), config.getBackgroundExecutor());
    this.collapser = new GraphCollapser(config.getFanOut());
    this.hubSelector = new HubSelector(config.getStopwords());
    this.clusterer = new ThoughtClusterer(config.getAffinityThreshold());
    this.contextSalience =
        new ContextSalience(config.getRingSize(), config.getChildBranches(), config.getSalienceWeights());
  }

  CompletableFuture<GrowthResult> start(String seed) {
    String text = seed.trim();
    String seedId = AdjacencyDeltas.slugify(text);
    long startNanos = System.nanoTime();
    enter(GrowthState.SEEDED);
    GraphNode seedNode = new GraphNode(seedId, text, 1.0, Layer.VISIBLE, false);
    synchronized (lock) {
      graph.addNode(seedNode);
    }
    markExpanded(seedId);
    return adjacency(AdjacencyKind.SEED, text, seedId)
        .thenCompose(delta -> {
          List<PendingEmbedding> pending = new ArrayList<>();
          pending.add(new PendingEmbedding(seedNode, null));
          pending.addAll(apply(seedId, delta, Layer.VISIBLE));
          return embed(pending);
        })
        .thenCompose(v -> {
          hub = seedId;
          return AsyncUtil.whileTrue(this::iterate, config.getBackgroundExecutor());
        })
        .thenApply(v -> finish(text))
        .whenComplete((r, e) -> Metrics.GROWTH_RUN_DURATION_MS.record(
            (System.nanoTime() - startNanos) / 1_000_000.0,
            Metrics.attrs("outcome", e == null ? r.reason().name() : "FAILED")));
  }

  private CompletableFuture<Boolean> iterate() {
    if (aborted()) {
      reason = TerminationReason.ABORTED;
      return completedFuture(false);
    }
    if (iterations >= config.getIterationLimit()) {
      reason = TerminationReason.ITERATION_LIMIT;
      return completedFuture(false);
    }
    enter(GrowthState.EXPAND_RING);
    return expander.expand(List.of(hub), Layer.VISIBLE, Integer.MAX_VALUE)
        .thenCompose(ringDeltas -> {
          enter(GrowthState.EXPAND_CHILDREN);
          return expander.expand(ring(ringDeltas.get(hub)), Layer.VISIBLE, config.getChildBranches());
        })
        .thenCompose(v -> {
          List<String> deep = deepDiveTargets();
          if (deep.isEmpty()) return completedFuture(Map.<String, AdjacencyDelta>of());
          return expander.expand(deep, Layer.HIDDEN, config.getChildBranches());
        })
        .thenApply(v -> afterExpansion());
  }

  private boolean afterExpansion() {
    enter(GrowthState.LIMIT_CHECK);
    Graph current;
    synchronized (lock) {
      graph = graph.limit(config.getMaxNodes(), config.getMaxEdges());
      current = graph;
    }
    if (aborted()) {
      reason = TerminationReason.ABORTED;
      return false;
    }
    enter(GrowthState.COLLAPSE);
    current = collapser.collapse(current, List.of(hub), config.getCollapseRadius());
    synchronized (lock) {
      graph = current;
    }
    enter(GrowthState.HUB_SELECT);
    Map<String, Double> salience = config.isContextSalience()
        ? contextSalience.compute(current, hub)
        : Salience.compute(current, config.getSalienceWeights());
    String selected = hubSelector.select(current, salience, hub);
    hubs.add(selected);
    summaries.add(summarize(current, selected));
    emitThoughts(current);

    enter(GrowthState.STABILITY_CHECK);
    streak = selected.equals(lastSelected) ? streak + 1 : 1;
    lastSelected = selected;
    iterations++;
    LOGGER.debug("Iteration {} hub={} streak={} graph={}", iterations - 1, selected, streak, current);
    hub = selected;
    if (streak >= 2 && iterations >= 2) {
      reason = TerminationReason.STABLE_HUB;
      return false;
    }
    return true;
  }

  private GrowthResult finish(String seed) {
    enter(GrowthState.TERMINATE);
    enter(GrowthState.FINALIZE);
    Graph result;
    synchronized (lock) {
      result = graph;
    }
    LOGGER.info("Growth run for '{}' stopped after {} iteration(s): {} nodes={} edges={} failures={}",
        seed, iterations, reason, result.nodeCount(), result.edgeCount(), failures.size());
    return new GrowthResult(result, List.copyOf(hubs), List.copyOf(summaries), List.copyOf(thoughts),
        iterations, reason, List.copyOf(failures), List.copyOf(states));
  }

  /** Ring members: the hub's heaviest proposed neighbors that are in the graph. */
  private List<String> ring(AdjacencyDelta hubDelta) {
    Set<String> ids = new LinkedHashSet<>();
    synchronized (lock) {
      if (hubDelta != null) {
        for (AdjacencyDelta.Node n : AdjacencyDeltas.rank(hubDelta)) {
          if (ids.size() >= config.getRingSize()) break;
          if (!n.id().equals(hub) && graph.hasNode(n.id())) ids.add(n.id());
        }
      }
      if (ids.isEmpty()) {
        Map<String, Double> neighbors =
            ContextSalience.weightedAdjacency(graph).getOrDefault(hub, Map.of());
        neighbors.entrySet().stream()
            .filter(e -> !e.getKey().equals(hub))
            .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
            .limit(config.getRingSize())
            .forEach(e -> ids.add(e.getKey()));
      }
    }
    return new ArrayList<>(ids);
  }

  /** Most salient nodes not yet expanded in this run. */
  private List<String> deepDiveTargets() {
    if (config.getHiddenTopK() == 0 || shouldStop()) return List.of();
    synchronized (lock) {
      Graph current = graph;
      return Salience.compute(current, config.getSalienceWeights()).entrySet().stream()
          .filter(e -> !expanded.contains(e.getKey()))
          .filter(e -> !hubSelector.isStopword(current, e.getKey()))
          .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
          .limit(config.getHiddenTopK())
          .map(Map.Entry::getKey)
          .collect(Collectors.toList());
    }
  }

  private static String summarize(Graph graph, String hubId) {
    GraphNode hubNode = graph.node(hubId);
    String hubLabel = hubNode == null ? hubId : hubNode.getLabel();
    Set<String> labels = new LinkedHashSet<>();
    for (String id : graph.neighbors(hubId)) {
      if (labels.size() >= SUMMARY_NEIGHBORS) break;
      labels.add(graph.node(id).getLabel());
    }
    return hubLabel + ": " + String.join(", ", labels);
  }

  private void emitThoughts(Graph current) {
    for (ThoughtCluster cluster : clusterer.clusters(current)) {
      ClusterSignal signal = clusterer.signal(current, cluster);
      try {
        sink.onCluster(signal).ifPresent(thoughts::add);
      } catch (RuntimeException e) {
        LOGGER.warn("Thought sink failed on cluster {} of {} node(s)", cluster.index(), cluster.size(), e);
      }
    }
  }

  CompletableFuture<AdjacencyDelta> adjacency(AdjacencyKind kind, String label, String srcId) {
    String key = kind.key + ":" + label.toLowerCase(Locale.ROOT);
    return adjacencyCache.get(key, (k, executor) -> fetch(kind, label, srcId));
  }

  private CompletableFuture<AdjacencyDelta> fetch(AdjacencyKind kind, String label, String srcId) {
    Metrics.ORACLE_CALL_COUNT.add(1, Metrics.attrs("kind", kind.key));
    CompletableFuture<AdjacencyDelta> call;
    try {
      call = Objects.requireNonNull(
          kind == AdjacencyKind.SEED ? oracle.seedAdjacency(label) : oracle.expandAdjacency(label),
          "oracle returned no future");
    } catch (RuntimeException e) {
      call = CompletableFuture.failedFuture(e);
    }
    return call.handle((delta, error) -> {
      if (error == null) return AdjacencyDeltas.normalize(delta);
      Throwable cause = unwrap(error);
      if (!config.isAllowSyntheticFallback()) throw new OracleFailureException(label, cause);
      Metrics.ORACLE_FALLBACK_COUNT.add(1, Metrics.attrs("kind", kind.key));
      LOGGER.warn("Oracle failed for '{}', substituting synthetic adjacency: {}", label, cause.toString());
      return AdjacencyDeltas.synthetic(label, srcId);
    });
  }

  CompletableFuture<Void> applyAndEmbed(String sourceId, AdjacencyDelta delta, Layer layer) {
    return embed(apply(sourceId, delta, layer));
  }

  /**
   * Adds the delta's new nodes and edges. Edge endpoints missing from both the graph and the delta
   * become placeholder nodes. Existing nodes count one more appearance per distinct source.
   */
  private List<PendingEmbedding> apply(String sourceId, AdjacencyDelta delta, Layer layer) {
    List<PendingEmbedding> added = new ArrayList<>();
    synchronized (lock) {
      for (AdjacencyDelta.Node n : delta.nodes()) {
        GraphNode existing = graph.node(n.id());
        if (existing == null) {
          GraphNode node = new GraphNode(n.id(), n.label(), n.weight(), layer, n.synthetic());
          graph.addNode(node);
          mentions.add(sourceId + "|" + n.id());
          added.add(new PendingEmbedding(node, n.embedding()));
        } else if (mentions.add(sourceId + "|" + n.id())) {
          existing.incrementAppearance();
        }
      }
      for (AdjacencyDelta.Edge e : delta.edges()) {
        for (String endpoint : List.of(e.src(), e.dst())) {
          if (!graph.hasNode(endpoint)) {
            GraphNode placeholder = new GraphNode(endpoint, endpoint, 0.0, layer, false);
            graph.addNode(placeholder);
            added.add(new PendingEmbedding(placeholder, null));
          }
        }
        graph.addEdge(new GraphEdge(e.src(), e.dst(), e.weight(), e.role(), layer));
      }
    }
    return added;
  }

  private CompletableFuture<Void> embed(List<PendingEmbedding> pending) {
    List<CompletableFuture<Void>> futures = new ArrayList<>();
    for (PendingEmbedding p : pending) {
      if (p.node().embeddingAttempted()) continue;
      if (p.hint() != null) {
        synchronized (lock) {
          p.node().setEmbedding(p.hint());
        }
        continue;
      }
      CompletableFuture<float[]> call;
      try {
        call = Objects.requireNonNull(embedder.embed(p.node().getLabel()), "embedder returned no future");
      } catch (RuntimeException e) {
        call = CompletableFuture.failedFuture(e);
      }
      futures.add(call.handle((vector, error) -> {
        if (error != null) {
          LOGGER.warn("Embedding failed for node '{}': {}", p.node().getId(), unwrap(error).toString());
        }
        synchronized (lock) {
          p.node().setEmbedding(error == null && vector != null ? vector : new float[0]);
        }
        return null;
      }));
    }
    return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new));
  }

  String labelOf(String id) {
    synchronized (lock) {
      GraphNode node = graph.node(id);
      return node == null ? null : node.getLabel();
    }
  }

  void markExpanded(String id) {
    expanded.add(id);
  }

  void recordFailure(String token, Throwable error) {
    LOGGER.warn("Skipping expansion of '{}': {}", token, error.toString());
    failures.add(new StepFailure(token, String.valueOf(error.getMessage())));
  }

  boolean aborted() {
    return abort.getAsBoolean();
  }

  boolean shouldStop() {
    if (aborted()) return true;
    synchronized (lock) {
      return graph.nodeCount() >= config.getMaxNodes() || graph.edgeCount() >= config.getMaxEdges();
    }
  }

  private void enter(GrowthState state) {
    states.add(state);
    LOGGER.debug("Growth state -> {}", state);
  }

  static Throwable unwrap(Throwable t) {
    while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }
}
