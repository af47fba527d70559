package io.github.panghy.tokengraph.codec;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the block codec once, by checking whether compression works in this runtime.
 */
public final class EdgeBlockCodecs {
  private static final Logger LOGGER = LoggerFactory.getLogger(EdgeBlockCodecs.class);

  private EdgeBlockCodecs() {}

  public static EdgeBlockCodec raw() {
    return new RawEdgeBlockCodec();
  }

  /**
   * Returns the gzip codec when {@code preferCompression} is set and a sample block survives a
   * compressed round trip, otherwise the raw codec.
   */
  public static EdgeBlockCodec select(boolean preferCompression) {
    RawEdgeBlockCodec raw = new RawEdgeBlockCodec();
    if (!preferCompression) {
      return raw;
    }
    GzipEdgeBlockCodec gzip = new GzipEdgeBlockCodec(raw);
    EdgeBlock sample = EdgeBlock.of(0, 0, List.of(new EdgeRow(1, 0, 1, 0, 1)));
    try {
      if (sample.equals(gzip.decode(gzip.encode(sample)))) {
        LOGGER.debug("Edge block compression available, using gzip codec");
        return gzip;
      }
      LOGGER.warn("Edge block compression round trip returned a different block, using raw codec");
    } catch (RuntimeException e) {
      LOGGER.warn("Edge block compression unavailable, using raw codec", e);
    }
    return raw;
  }
}
