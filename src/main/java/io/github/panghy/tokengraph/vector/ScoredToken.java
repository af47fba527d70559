package io.github.panghy.tokengraph.vector;

/**
 * A candidate token with a similarity or blended score. Higher is better.
 */
public record ScoredToken(long id, double score) {}
