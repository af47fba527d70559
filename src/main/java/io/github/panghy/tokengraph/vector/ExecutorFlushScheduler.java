package io.github.panghy.tokengraph.vector;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Treats "idle" as a fixed delay on a scheduled executor.
 */
public final class ExecutorFlushScheduler implements FlushScheduler {
  private final ScheduledExecutorService executor;
  private final Duration delay;

  public ExecutorFlushScheduler(ScheduledExecutorService executor, Duration delay) {
    this.executor = executor;
    this.delay = delay;
  }

  @Override
  public void schedule(Runnable task) {
    executor.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
  }
}
