package io.github.panghy.tokengraph.kb;

/**
 * Store-wide counts. {@code shards} counts every stored block, including empty and unreadable
 * ones; {@code sizeBytes} is the encoded size of all blocks.
 */
public record ShardStats(long tokens, long shards, long edges, long sizeBytes) {}
