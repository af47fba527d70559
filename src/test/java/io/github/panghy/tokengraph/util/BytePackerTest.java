package io.github.panghy.tokengraph.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class BytePackerTest {

  @Test
  void testFloatsAreLittleEndian() {
    byte[] bytes = BytePacker.floatsToBytes(new float[] {1.0f});

    // 1.0f is 0x3F800000
    assertThat(bytes).containsExactly(0x00, 0x00, (byte) 0x80, 0x3F);
    assertThat(BytePacker.bytesToFloats(bytes)).containsExactly(1.0f);
  }

  @Test
  void testLongCounterEncoding() {
    byte[] bytes = BytePacker.longToBytes(258L);

    assertThat(bytes).hasSize(8);
    assertThat(bytes[0]).isEqualTo((byte) 2);
    assertThat(bytes[1]).isEqualTo((byte) 1);
    assertThat(BytePacker.bytesToLong(bytes)).isEqualTo(258L);
  }

  @Test
  void testInvalidLengths() {
    assertThatThrownBy(() -> BytePacker.bytesToFloats(new byte[5])).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> BytePacker.bytesToLong(new byte[4])).isInstanceOf(IllegalArgumentException.class);
  }
}
