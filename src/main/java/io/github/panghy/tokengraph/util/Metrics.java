package io.github.panghy.tokengraph.util;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Centralizes OpenTelemetry instruments and helpers.
 */
public final class Metrics {
  private static final String INSTRUMENTATION_NAME = "io.github.panghy.tokengraph";
  private static final Meter METER = GlobalOpenTelemetry.getMeter(INSTRUMENTATION_NAME);

  // Histograms (ms)
  public static final DoubleHistogram GROWTH_RUN_DURATION_MS = METER.histogramBuilder(
          "tokengraph.growth.run.duration_ms")
      .setUnit("ms")
      .build();
  public static final DoubleHistogram EMBEDDING_FLUSH_DURATION_MS = METER.histogramBuilder(
          "tokengraph.embedding.flush.duration_ms")
      .setUnit("ms")
      .build();
  public static final DoubleHistogram SHARD_MAINTENANCE_DURATION_MS = METER.histogramBuilder(
          "tokengraph.shard.maintenance.duration_ms")
      .setUnit("ms")
      .build();

  // Counters
  public static final LongCounter SHARD_UPSERT_COUNT =
      METER.counterBuilder("tokengraph.shard.upsert").build();
  public static final LongCounter SHARD_BLOCKS_REMOVED =
      METER.counterBuilder("tokengraph.shard.gc.removed").build();
  public static final LongCounter SHARD_EDGES_PRUNED =
      METER.counterBuilder("tokengraph.shard.prune.removed").build();
  public static final LongCounter UNREADABLE_BLOCK_COUNT =
      METER.counterBuilder("tokengraph.shard.unreadable").build();
  public static final LongCounter ORACLE_CALL_COUNT =
      METER.counterBuilder("tokengraph.oracle.call").build();
  public static final LongCounter ORACLE_FALLBACK_COUNT =
      METER.counterBuilder("tokengraph.oracle.fallback").build();
  public static final LongCounter EMBEDDING_BATCH_COUNT =
      METER.counterBuilder("tokengraph.embedding.batch").build();

  private Metrics() {}

  public static Attributes attrs(String key, String value) {
    return Attributes.of(AttributeKey.stringKey(key), value);
  }
}
