package io.github.panghy.tokengraph.kb;

import io.github.panghy.tokengraph.storage.GraphKeys;
import io.github.panghy.tokengraph.storage.StorageTransaction;
import io.github.panghy.tokengraph.storage.StoredEntry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits encoded edge blocks into values every backend accepts and joins them back.
 *
 * <p>Chunk {@code i} of block {@code (tokenId, part)} is stored under
 * {@link GraphKeys#edgeChunkKey}. Chunks are numbered from 0 without gaps; a block missing a
 * chunk comes back with null bytes.</p>
 */
final class BlockChunks {
  /** Bytes per chunk, below FoundationDB's 100,000-byte value limit. */
  static final int CHUNK_BYTES = 90_000;

  /** Upper bound on chunks per block, covering a full block with flags and gzip overhead. */
  static final int MAX_CHUNKS = 10;

  record BlockId(long tokenId, int part) {}

  /**
   * A block as read from storage.
   *
   * @param bytes     the joined encoding, or null when chunks are missing
   * @param chunkKeys every key holding a chunk of this block
   * @param size      total stored bytes
   */
  record StoredBlock(BlockId id, byte[] bytes, List<byte[]> chunkKeys, long size) {}

  private final GraphKeys keys;

  BlockChunks(GraphKeys keys) {
    this.keys = keys;
  }

  BlockId blockOf(byte[] chunkKey) {
    long[] parts = keys.edgeChunkKeyParts(chunkKey);
    return new BlockId(parts[0], (int) parts[1]);
  }

  /** Writes {@code encoded} as the chunks of block {@code (tokenId, part)}. */
  void write(StorageTransaction tx, long tokenId, int part, byte[] encoded) {
    int chunk = 0;
    int offset = 0;
    do {
      int end = Math.min(encoded.length, offset + CHUNK_BYTES);
      tx.set(keys.edgeChunkKey(tokenId, part, chunk++), Arrays.copyOfRange(encoded, offset, end));
      offset = end;
    } while (offset < encoded.length);
  }

  /**
   * Groups chunk entries, given in key order, into blocks.
   */
  List<StoredBlock> assemble(List<StoredEntry> entries) {
    List<StoredBlock> blocks = new ArrayList<>();
    int i = 0;
    while (i < entries.size()) {
      BlockId id = blockOf(entries.get(i).key());
      List<byte[]> chunkKeys = new ArrayList<>();
      List<byte[]> values = new ArrayList<>();
      boolean contiguous = true;
      long size = 0;
      while (i < entries.size() && blockOf(entries.get(i).key()).equals(id)) {
        StoredEntry entry = entries.get(i++);
        if (keys.edgeChunkKeyParts(entry.key())[2] != values.size()) contiguous = false;
        chunkKeys.add(entry.key());
        values.add(entry.value());
        size += entry.value().length;
      }
      blocks.add(new StoredBlock(id, contiguous ? join(values, size) : null, chunkKeys, size));
    }
    return blocks;
  }

  private static byte[] join(List<byte[]> values, long size) {
    if (values.size() == 1) return values.get(0);
    byte[] joined = new byte[Math.toIntExact(size)];
    int offset = 0;
    for (byte[] v : values) {
      System.arraycopy(v, 0, joined, offset, v.length);
      offset += v.length;
    }
    return joined;
  }
}
