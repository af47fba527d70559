package io.github.panghy.tokengraph.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class EdgeBlockCodecTest {
  private final RawEdgeBlockCodec raw = new RawEdgeBlockCodec();
  private final GzipEdgeBlockCodec gzip = new GzipEdgeBlockCodec(raw);

  private static EdgeBlock sampleBlock(int count, boolean withFlags) {
    List<EdgeRow> rows = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      Integer flags = withFlags ? i % 256 : null;
      rows.add(new EdgeRow(0xFFFF_FFFFL - i, i % 65536, (long) i * 7919 % 0xFFFF_FFFFL, 1_700_000_000L + i, flags));
    }
    return EdgeBlock.of(42, 3, rows);
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 2, 1000, EdgeBlock.BLOCK_MAX})
  void rawRoundTripPreservesEveryField(int count) {
    EdgeBlock block = sampleBlock(count, false);

    EdgeBlock decoded = raw.decode(raw.encode(block));

    assertThat(decoded).isEqualTo(block);
    assertThat(decoded.getTokenId()).isEqualTo(42);
    assertThat(decoded.getPart()).isEqualTo(3);
    assertThat(decoded.count()).isEqualTo(count);
    assertThat(decoded.hasFlags()).isFalse();
  }

  @Test
  void flagsColumnSurvivesRoundTrip() {
    EdgeBlock block = sampleBlock(300, true);

    EdgeBlock decoded = gzip.decode(gzip.encode(block));

    assertThat(decoded).isEqualTo(block);
    assertThat(decoded.flagsAt(255)).isEqualTo(255);
    assertThat(decoded.rowAt(10).flags()).isEqualTo(10);
  }

  @Test
  void rowsWithoutFlagsReadZeroWhenAnotherRowHasFlags() {
    EdgeBlock block = EdgeBlock.of(1, 0, List.of(new EdgeRow(2, 0, 5, 9), new EdgeRow(3, 0, 6, 9, 4)));

    EdgeBlock decoded = raw.decode(raw.encode(block));

    assertThat(decoded.flagsAt(0)).isEqualTo(0);
    assertThat(decoded.flagsAt(1)).isEqualTo(4);
  }

  @Test
  void headerIsVersionedJson() {
    byte[] bytes = raw.encode(sampleBlock(2, false));
    ByteBuffer bb = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    int headerLength = bb.getInt();
    String header = new String(bytes, 4, headerLength, StandardCharsets.UTF_8);

    assertThat(header).contains("\"v\":1").contains("\"tokenId\":42").contains("\"count\":2");
    assertThat(bytes.length).isEqualTo(4 + headerLength + 2 * 14);
  }

  @Test
  void gzipDecodesRawBlocks() {
    EdgeBlock block = sampleBlock(5, false);

    assertThat(gzip.decode(raw.encode(block))).isEqualTo(block);
  }

  @Test
  void gzipIsSmallerForRepetitiveBlocks() {
    List<EdgeRow> rows = new ArrayList<>();
    for (int i = 0; i < 5000; i++) rows.add(new EdgeRow(7, 0, 1, 0));
    EdgeBlock block = EdgeBlock.of(1, 0, rows);

    assertThat(gzip.encode(block).length).isLessThan(raw.encode(block).length / 4);
  }

  @Test
  void truncatedColumnsAreRejected() {
    byte[] bytes = raw.encode(sampleBlock(10, false));
    byte[] truncated = Arrays.copyOf(bytes, bytes.length - 3);

    assertThatThrownBy(() -> raw.decode(truncated))
        .isInstanceOf(EdgeBlockEncodingException.class)
        .hasMessageContaining("Declared count 10");
  }

  @Test
  void headerLengthBeyondBufferIsRejected() {
    byte[] bytes = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putInt(1_000).array();

    assertThatThrownBy(() -> raw.decode(bytes)).isInstanceOf(EdgeBlockEncodingException.class);
    assertThatThrownBy(() -> raw.decode(new byte[] {1, 2})).isInstanceOf(EdgeBlockEncodingException.class);
    assertThatThrownBy(() -> gzip.decode(new byte[] {1, 2})).isInstanceOf(EdgeBlockEncodingException.class);
  }

  @Test
  void unknownVersionAndGarbageHeadersAreRejected() {
    assertThatThrownBy(() -> raw.decode(withHeader("{\"v\":2,\"tokenId\":1,\"part\":0,\"count\":0,"
            + "\"cols\":[\"neighbor\",\"type\",\"weight\",\"lastSeen\"]}")))
        .isInstanceOf(EdgeBlockEncodingException.class)
        .hasMessageContaining("version");
    assertThatThrownBy(() -> raw.decode(withHeader("{\"v\":1,\"tokenId\":1,\"part\":0,\"count\":60000,"
            + "\"cols\":[\"neighbor\",\"type\",\"weight\",\"lastSeen\"]}")))
        .isInstanceOf(EdgeBlockEncodingException.class)
        .hasMessageContaining("out of range");
    assertThatThrownBy(() -> raw.decode(withHeader("{\"v\":1,\"tokenId\":1,\"part\":0,\"count\":0,"
            + "\"cols\":[\"neighbor\"]}")))
        .isInstanceOf(EdgeBlockEncodingException.class)
        .hasMessageContaining("column");
    assertThatThrownBy(() -> raw.decode(withHeader("not json")))
        .isInstanceOf(EdgeBlockEncodingException.class);
  }

  @Test
  void rowsOutsideUnsignedRangesAreRejected() {
    assertThatThrownBy(() -> new EdgeRow(-1, 0, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new EdgeRow(1, 65536, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new EdgeRow(1, 0, 0x1_0000_0000L, 0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new EdgeRow(1, 0, 0, 0, 256)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void oversizedBlockCannotBeBuilt() {
    List<EdgeRow> rows = new ArrayList<>();
    for (int i = 0; i <= EdgeBlock.BLOCK_MAX; i++) rows.add(new EdgeRow(i, 0, 1, 0));

    assertThatThrownBy(() -> EdgeBlock.of(1, 0, rows)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void selectionHonoursPreference() {
    assertThat(EdgeBlockCodecs.select(false).name()).isEqualTo("raw");
    assertThat(EdgeBlockCodecs.select(true).name()).isEqualTo("gzip");
  }

  private static byte[] withHeader(String json) {
    byte[] header = json.getBytes(StandardCharsets.UTF_8);
    return ByteBuffer.allocate(4 + header.length)
        .order(ByteOrder.LITTLE_ENDIAN)
        .putInt(header.length)
        .put(header)
        .array();
  }
}
