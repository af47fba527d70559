package io.github.panghy.tokengraph.vector;

/**
 * Runs a deferred flush "when idle". Implementations decide what idle means.
 */
@FunctionalInterface
public interface FlushScheduler {

  void schedule(Runnable task);
}
