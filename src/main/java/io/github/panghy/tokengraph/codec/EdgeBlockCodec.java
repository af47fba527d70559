package io.github.panghy.tokengraph.codec;

/**
 * Encodes and decodes a single {@link EdgeBlock}.
 */
public interface EdgeBlockCodec {

  /** Name recorded in logs, e.g. {@code raw} or {@code gzip}. */
  String name();

  byte[] encode(EdgeBlock block);

  /**
   * Decodes a block.
   *
   * @throws EdgeBlockEncodingException if the bytes are malformed or truncated
   */
  EdgeBlock decode(byte[] bytes);
}
