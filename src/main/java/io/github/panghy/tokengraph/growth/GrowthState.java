package io.github.panghy.tokengraph.growth;

/**
 * Phases of a growth run, in execution order.
 */
public enum GrowthState {
  SEEDED,
  EXPAND_RING,
  EXPAND_CHILDREN,
  LIMIT_CHECK,
  COLLAPSE,
  HUB_SELECT,
  STABILITY_CHECK,
  TERMINATE,
  FINALIZE
}
