package io.github.panghy.tokengraph.kb;

import io.github.panghy.tokengraph.codec.EdgeRow;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * Age and weight based edge decay used by {@link ShardStore#prune}.
 *
 * <p>An edge is trimmed when its decayed weight {@code w * exp(-lambdaPerDay * ageDays)} falls
 * below {@code minWeight}, or when it is older than {@code maxAgeDays} and its raw weight is below
 * {@code oldMinWeight}.</p>
 */
@Getter
@Builder
public class GcPolicy {
  private static final double MILLIS_PER_DAY = 86_400_000d;

  @Builder.Default
  private final double lambdaPerDay = 0.01;

  @Builder.Default
  private final double minWeight = 1.0;

  @Builder.Default
  private final double maxAgeDays = 365;

  @Builder.Default
  private final double oldMinWeight = 10.0;

  public boolean shouldTrim(EdgeRow row, Instant now) {
    double ageMs = Math.max(0, now.toEpochMilli() - row.lastSeen() * 1000);
    double ageDays = ageMs / MILLIS_PER_DAY;
    double effective = row.weight() * Math.exp(-lambdaPerDay * ageDays);
    return effective < minWeight || (ageDays > maxAgeDays && row.weight() < oldMinWeight);
  }
}
