package io.github.panghy.tokengraph.vector;

/**
 * Read-cache key; vectors are only shared within one provider and dimension.
 */
record VectorCacheKey(String provider, int dimension, long tokenId) {}
