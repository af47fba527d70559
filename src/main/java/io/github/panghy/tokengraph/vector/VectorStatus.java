package io.github.panghy.tokengraph.vector;

/**
 * Snapshot of the vector subsystem.
 *
 * @param configured  whether init completed
 * @param provider    provider name
 * @param dimension   embedding dimension
 * @param queueSize   tokens waiting to be embedded
 * @param batches     completed embedding batches
 * @param lastBatchMs duration of the most recent flush
 */
public record VectorStatus(
    boolean configured, String provider, int dimension, int queueSize, long batches, long lastBatchMs) {}
