package io.github.panghy.valkeyvector.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class VectorBytesTest {

  @Test
  void packsLittleEndianFloat32() {
    byte[] bytes = VectorBytes.toFloat32Bytes(new float[] {1.0f, -2.0f});
    // 1.0f = 0x3F800000, -2.0f = 0xC0000000
    assertThat(bytes).containsExactly(0x00, 0x00, (byte) 0x80, 0x3F, 0x00, 0x00, 0x00, (byte) 0xC0);
  }

  @Test
  void lengthIsFourBytesPerElement() {
    assertThat(VectorBytes.toFloat32Bytes(new float[0])).isEmpty();
    assertThat(VectorBytes.toFloat32Bytes(new float[384])).hasSize(1536);
  }

  @Test
  void unpacksWhatWasPacked() {
    float[] in = {0.0f, -1.5f, 3.14159f, Float.MIN_VALUE};
    assertThat(VectorBytes.fromFloat32Bytes(VectorBytes.toFloat32Bytes(in))).containsExactly(in);
  }

  @Test
  void rejectsTruncatedInput() {
    assertThatThrownBy(() -> VectorBytes.fromFloat32Bytes(new byte[5]))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("multiple of 4");
  }
}
