package io.github.panghy.tokengraph.growth;

import java.util.Optional;

/**
 * Receives clusters found during a run and may narrate them.
 */
@FunctionalInterface
public interface ThoughtSink {

  ThoughtSink NONE = signal -> Optional.empty();

  Optional<String> onCluster(ClusterSignal signal);
}
