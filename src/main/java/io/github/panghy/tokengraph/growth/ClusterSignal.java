package io.github.panghy.tokengraph.growth;

import java.util.Map;

/**
 * What a {@link ThoughtSink} is shown about a cluster.
 *
 * @param embeddings embeddings of the embedded members, by node id
 * @param structural size-based score in {@code [0.6, 1]}
 * @param spectral   spectral score; constant 0.5 as no spectral analysis is performed
 * @param semantic   mean pairwise cosine similarity of embedded members in {@code [0, 1]}
 */
public record ClusterSignal(
    ThoughtCluster cluster, Map<String, float[]> embeddings, double structural, double spectral, double semantic) {}
