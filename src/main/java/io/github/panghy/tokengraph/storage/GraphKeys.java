package io.github.panghy.tokengraph.storage;

import com.apple.foundationdb.subspace.Subspace;
import com.apple.foundationdb.tuple.Tuple;

/**
 * Key layout for the token graph.
 *
 * <pre>
 * /{root}/meta/schemaVersion               -> StoreMeta
 * /{root}/meta/nextTokenId                 -> little-endian long
 * /{root}/tok/s/{text}                     -> Tuple(tokenId)
 * /{root}/tok/id/{tokenId}                 -> UTF-8 text
 * /{root}/edge/{tokenId}/{part}/{chunk}    -> slice of an encoded edge block
 * /{root}/vec/{provider}/{dim}/{tokenId}   -> EmbeddingRecord
 * </pre>
 */
public final class GraphKeys {
  private final Subspace root;
  private final Subspace tokensByText;
  private final Subspace tokensById;
  private final Subspace edges;
  private final Subspace vectors;

  public GraphKeys(String rootPrefix) {
    this(new Subspace(Tuple.from(rootPrefix)));
  }

  public GraphKeys(Subspace root) {
    this.root = root;
    this.tokensByText = root.get("tok").get("s");
    this.tokensById = root.get("tok").get("id");
    this.edges = root.get("edge");
    this.vectors = root.get("vec");
  }

  public byte[] schemaVersionKey() {
    return root.pack(Tuple.from("meta", "schemaVersion"));
  }

  public byte[] nextTokenIdKey() {
    return root.pack(Tuple.from("meta", "nextTokenId"));
  }

  public byte[] tokenByTextKey(String text) {
    return tokensByText.pack(Tuple.from(text));
  }

  public byte[] tokenByIdKey(long tokenId) {
    return tokensById.pack(Tuple.from(tokenId));
  }

  public byte[] tokenByIdPrefix() {
    return tokensById.pack();
  }

  public long tokenIdFromKey(byte[] key) {
    return tokensById.unpack(key).getLong(0);
  }

  public byte[] edgeChunkKey(long tokenId, int part, int chunk) {
    return edges.pack(Tuple.from(tokenId, part, chunk));
  }

  /** Prefix covering every chunk of one block. */
  public byte[] edgeBlockPrefix(long tokenId, int part) {
    return edges.pack(Tuple.from(tokenId, part));
  }

  /** Prefix covering every block of one token. */
  public byte[] edgeBlocksPrefix(long tokenId) {
    return edges.pack(Tuple.from(tokenId));
  }

  /** Prefix covering every block in the store. */
  public byte[] allEdgeBlocksPrefix() {
    return edges.pack();
  }

  /** Returns {tokenId, part, chunk} for an edge chunk key. */
  public long[] edgeChunkKeyParts(byte[] key) {
    Tuple t = edges.unpack(key);
    return new long[] {t.getLong(0), t.getLong(1), t.size() > 2 ? t.getLong(2) : 0L};
  }

  public byte[] vectorKey(String provider, int dimension, long tokenId) {
    return vectors.pack(Tuple.from(provider, dimension, tokenId));
  }

  /** Prefix covering every vector stored under one provider and dimension. */
  public byte[] vectorNamespacePrefix(String provider, int dimension) {
    return vectors.pack(Tuple.from(provider, dimension));
  }
}
