package io.github.panghy.tokengraph.vector;

import java.util.List;

/**
 * A batch embedding request tagged with its correlation id.
 */
public record EmbeddingRequest(long correlationId, List<String> texts) {}
