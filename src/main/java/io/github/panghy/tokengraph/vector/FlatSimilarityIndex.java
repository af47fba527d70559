package io.github.panghy.tokengraph.vector;

import com.google.protobuf.InvalidProtocolBufferException;
import io.github.panghy.tokengraph.proto.EmbeddingRecord;
import io.github.panghy.tokengraph.storage.GraphKeys;
import io.github.panghy.tokengraph.storage.StorageBackend;
import io.github.panghy.tokengraph.storage.StorageScans;
import io.github.panghy.tokengraph.storage.StoredEntry;
import io.github.panghy.tokengraph.util.VectorMath;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brute-force index: scans every vector stored under the same provider and dimension.
 *
 * <p>Score is {@code dot(query, candidate) / |candidate|}, which is the cosine similarity when
 * the query is already unit length. Candidates of a different length, with zero norm or with a
 * non-finite score are skipped. The namespace is read {@code pageSize} records per transaction.</p>
 */
public final class FlatSimilarityIndex implements SimilarityIndex {
  private static final Logger LOGGER = LoggerFactory.getLogger(FlatSimilarityIndex.class);
  static final int DEFAULT_PAGE_SIZE = 512;

  private final StorageBackend backend;
  private final GraphKeys keys;
  private final String provider;
  private final int dimension;
  private final int pageSize;
  private final Executor executor;

  public FlatSimilarityIndex(StorageBackend backend, GraphKeys keys, String provider, int dimension) {
    this(backend, keys, provider, dimension, DEFAULT_PAGE_SIZE, ForkJoinPool.commonPool());
  }

  public FlatSimilarityIndex(
      StorageBackend backend, GraphKeys keys, String provider, int dimension, int pageSize, Executor executor) {
    if (pageSize <= 0) throw new IllegalArgumentException("pageSize must be positive");
    this.backend = backend;
    this.keys = keys;
    this.provider = provider;
    this.dimension = dimension;
    this.pageSize = pageSize;
    this.executor = executor;
  }

  @Override
  public CompletableFuture<List<ScoredToken>> search(long queryId, float[] query, int topK) {
    if (topK <= 0) return CompletableFuture.completedFuture(List.of());
    List<ScoredToken> scored = new ArrayList<>();
    Set<Long> seen = new HashSet<>();
    byte[] prefix = keys.vectorNamespacePrefix(provider, dimension);
    return StorageScans.forEachPage(backend, prefix, pageSize, executor, page -> {
          for (StoredEntry entry : page) {
            EmbeddingRecord record;
            try {
              record = EmbeddingRecord.parseFrom(entry.value());
            } catch (InvalidProtocolBufferException e) {
              LOGGER.warn("Skipping unreadable embedding record", e);
              continue;
            }
            long id = record.getTokenId();
            if (id == queryId || !seen.add(id)) continue;
            float[] candidate = EmbeddingRecords.toVector(record);
            if (candidate.length != query.length) {
              LOGGER.debug("Skipping tokenId={} with length {} != {}", id, candidate.length, query.length);
              continue;
            }
            double norm = VectorMath.norm(candidate);
            if (norm == 0.0) continue;
            double score = VectorMath.dot(query, candidate) / norm;
            if (Double.isFinite(score)) scored.add(new ScoredToken(id, score));
          }
          return true;
        })
        .thenApply(v -> {
          scored.sort(Comparator.comparingDouble(ScoredToken::score).reversed());
          return scored.size() > topK ? List.copyOf(scored.subList(0, topK)) : List.copyOf(scored);
        });
  }
}
