package io.github.panghy.tokengraph.vector;

import static java.util.concurrent.CompletableFuture.completedFuture;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Deterministic local provider based on feature hashing of character trigrams.
 *
 * <p>Texts sharing many trigrams get similar vectors. Needs no model files, so it is the default
 * when no other provider is plugged in.</p>
 */
public final class HashingEmbeddingProvider implements EmbeddingProvider {
  public static final String NAME = "hashing";

  private final int dimension;

  public HashingEmbeddingProvider(int dimension) {
    if (dimension <= 0) throw new IllegalArgumentException("dimension must be positive");
    this.dimension = dimension;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public CompletableFuture<List<float[]>> embed(List<String> texts) {
    List<float[]> out = new ArrayList<>(texts.size());
    for (String text : texts) out.add(embedOne(text));
    return completedFuture(out);
  }

  float[] embedOne(String text) {
    float[] v = new float[dimension];
    String padded = " " + text.trim().toLowerCase(Locale.ROOT) + " ";
    byte[] bytes = padded.getBytes(StandardCharsets.UTF_8);
    for (int i = 0; i + 3 <= bytes.length; i++) {
      int h = fnv1a(bytes, i, 3);
      int slot = Math.floorMod(h, dimension);
      // signed feature hashing
      v[slot] += ((h >>> 16) & 1) == 0 ? 1f : -1f;
    }
    return v;
  }

  private static int fnv1a(byte[] bytes, int offset, int length) {
    int h = 0x811c9dc5;
    for (int i = offset; i < offset + length; i++) {
      h ^= bytes[i] & 0xff;
      h *= 0x01000193;
    }
    return h;
  }
}
