package io.github.panghy.tokengraph.codec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Gzip wrapper around the raw layout. Decoding falls back to the raw layout when the bytes are
 * not gzip, so blocks written before compression was enabled stay readable.
 */
public final class GzipEdgeBlockCodec implements EdgeBlockCodec {
  private final RawEdgeBlockCodec raw;

  public GzipEdgeBlockCodec(RawEdgeBlockCodec raw) {
    this.raw = raw;
  }

  @Override
  public String name() {
    return "gzip";
  }

  @Override
  public byte[] encode(EdgeBlock block) {
    byte[] plain = raw.encode(block);
    ByteArrayOutputStream out = new ByteArrayOutputStream(plain.length / 2 + 64);
    try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
      gzip.write(plain);
    } catch (IOException e) {
      throw new UncheckedIOException("gzip failed on an in-memory stream", e);
    }
    return out.toByteArray();
  }

  @Override
  public EdgeBlock decode(byte[] bytes) {
    byte[] plain;
    try {
      plain = gunzip(bytes);
    } catch (IOException notGzip) {
      return raw.decode(bytes);
    }
    return raw.decode(plain);
  }

  static byte[] gunzip(byte[] bytes) throws IOException {
    try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
      return in.readAllBytes();
    }
  }
}
