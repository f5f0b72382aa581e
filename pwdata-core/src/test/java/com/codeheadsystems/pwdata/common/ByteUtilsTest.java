package com.codeheadsystems.pwdata.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.lang.reflect.Constructor;
import org.junit.jupiter.api.Test;

class ByteUtilsTest {

  // ─── Constructor ──────────────────────────────────────────────────────────

  @Test
  void privateConstructorIsInaccessible() throws Exception {
    Constructor<ByteUtils> ctor = ByteUtils.class.getDeclaredConstructor();
    ctor.setAccessible(true);
    ctor.newInstance(); // covers the private constructor line
  }

  // ─── uint32 ───────────────────────────────────────────────────────────────

  @Test
  void uint32_isBigEndian() {
    assertThat(ByteUtils.uint32(10000)).isEqualTo(new byte[]{0x00, 0x00, 0x27, 0x10});
  }

  @Test
  void uint32_zero() {
    assertThat(ByteUtils.uint32(0)).isEqualTo(new byte[]{0, 0, 0, 0});
  }

  @Test
  void uint32_negativeWritesUnsignedBitPattern() {
    assertThat(ByteUtils.uint32(-1)).isEqualTo(new byte[]{(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF});
    assertThat(ByteUtils.uint32(Integer.MIN_VALUE)).isEqualTo(new byte[]{(byte) 0x80, 0, 0, 0});
  }

  // ─── readUint32 ───────────────────────────────────────────────────────────

  @Test
  void readUint32_atOffset() {
    byte[] data = {0x01, 0x00, 0x00, 0x27, 0x10, 0x7F};
    assertThat(ByteUtils.readUint32(data, 1)).isEqualTo(10000L);
  }

  @Test
  void readUint32_highBitIsNotSign() {
    byte[] data = {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF};
    assertThat(ByteUtils.readUint32(data, 0)).isEqualTo(4294967295L);
  }

  @Test
  void readUint32_invertsUint32() {
    assertThat(ByteUtils.readUint32(ByteUtils.uint32(0x80000001), 0)).isEqualTo(0x80000001L & 0xFFFFFFFFL);
    assertThat(ByteUtils.readUint32(ByteUtils.uint32(64), 0)).isEqualTo(64L);
  }

  @Test
  void readUint32_tooFewBytesThrows() {
    assertThatThrownBy(() -> ByteUtils.readUint32(new byte[]{1, 2, 3, 4}, 1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Need 4 bytes");
  }

  @Test
  void readUint32_negativeOffsetThrows() {
    assertThatThrownBy(() -> ByteUtils.readUint32(new byte[8], -1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // ─── concat ───────────────────────────────────────────────────────────────

  @Test
  void concat_noArraysReturnsEmpty() {
    assertThat(ByteUtils.concat()).isEmpty();
  }

  @Test
  void concat_threeArrays() {
    assertThat(ByteUtils.concat(new byte[]{1}, new byte[]{2, 3}, new byte[]{4}))
        .isEqualTo(new byte[]{1, 2, 3, 4});
  }

  @Test
  void concat_emptyArrayAmongOthers() {
    assertThat(ByteUtils.concat(new byte[]{1, 2}, new byte[0], new byte[]{3, 4}))
        .isEqualTo(new byte[]{1, 2, 3, 4});
  }

  @Test
  void concat_doesNotMutateInputs() {
    byte[] a = {1, 2};
    byte[] b = {3, 4};
    byte[] result = ByteUtils.concat(a, b);
    result[0] = 99;
    assertThat(a[0]).isEqualTo((byte) 1);
  }
}
