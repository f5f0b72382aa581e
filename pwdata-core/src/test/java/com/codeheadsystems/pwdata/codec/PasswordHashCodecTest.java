package com.codeheadsystems.pwdata.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.pwdata.common.ByteUtils;
import com.codeheadsystems.pwdata.model.ErrorKind;
import com.codeheadsystems.pwdata.model.PasswordHash;
import com.codeheadsystems.pwdata.model.PasswordHashException;
import java.util.Arrays;
import java.util.Base64;
import java.util.stream.Stream;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class PasswordHashCodecTest {

  static final String JOSEPHINE =
      "AQAAAAEAACcQAAAAEO4k5r1SgFuCYAS8xfu/Mnu5iZUqh+DgSRU4IyJpD+mVo4KdbI1BwiF3KcY1V6AapQ==";
  static final String JAKE =
      "AQAAAAEAACcQAAAAEHhGT2mW9BMcWhMNA4lNj80h8OULQyuvqbSR99lZ+GWsuhA2H6HLxcZI8+RhtxV5FA==";

  private static final byte V3 = 1;
  private static final byte PRF = 1;
  // PBKDF2-HMAC-SHA256("hello", {0xEE}, 1)
  private static final byte[] HELLO_SUBKEY =
      Hex.decode("f1ac530038a8fe35090e24b2bd1586543a351a431abc314f77bb3e6689fa5a31");

  // ─── decodeText / encodeText ──────────────────────────────────────────────

  @ParameterizedTest
  @ValueSource(strings = {JOSEPHINE, JAKE})
  void decodeText_aspNetValue_reencodesIdentically(String stored) {
    PasswordHash hash = PasswordHashCodec.decodeText(stored);
    assertThat(PasswordHashCodec.encodeText(hash)).isEqualTo(stored);
  }

  @Test
  void decodeText_aspNetValue_fields() {
    PasswordHash hash = PasswordHashCodec.decodeText(JOSEPHINE);
    assertThat(hash.version()).isEqualTo(PasswordHash.VERSION_3);
    assertThat(hash.prf()).isEqualTo(PasswordHash.PRF_HMAC_SHA256);
    assertThat(hash.iterations()).isEqualTo(10000);
    assertThat(hash.salt()).isEqualTo(Hex.decode("ee24e6bd52805b826004bcc5fbbf327b"));
    assertThat(hash.subkey())
        .isEqualTo(Hex.decode("b989952a87e0e04915382322690fe995a3829d6c8d41c2217729c63557a01aa5"));
  }

  @Test
  void decodeText_appendedGarbage_isCorruptWithBase64Diagnostic() {
    assertThatThrownBy(() -> PasswordHashCodec.decodeText(JOSEPHINE + "??"))
        .isInstanceOf(PasswordHashException.class)
        .hasMessageStartingWith("malformed hashed value: password encoding:")
        .hasCauseInstanceOf(IllegalArgumentException.class)
        .extracting(e -> ((PasswordHashException) e).kind())
        .isEqualTo(ErrorKind.CORRUPT);
  }

  @Test
  void decodeText_appendedValidBase64_isCorrupt() {
    assertKind(() -> PasswordHashCodec.decodeText(JOSEPHINE.replace("==", "AA") + "AAAA"), ErrorKind.CORRUPT);
  }

  @Test
  void decodeText_everyTruncation_isCorrupt() {
    for (int len = 0; len < JOSEPHINE.length(); len++) {
      String truncated = JOSEPHINE.substring(0, len);
      assertKind(() -> PasswordHashCodec.decodeText(truncated), ErrorKind.CORRUPT);
    }
  }

  @Test
  void decodeText_missingPadding_isCorrupt() {
    String unpadded = JOSEPHINE.substring(0, JOSEPHINE.length() - 2);
    assertThatThrownBy(() -> PasswordHashCodec.decodeText(unpadded))
        .isInstanceOf(PasswordHashException.class)
        .hasMessageContaining("padding");
  }

  @Test
  void decodeText_urlSafeAlphabet_isCorrupt() {
    assertKind(() -> PasswordHashCodec.decodeText(JOSEPHINE.replace('+', '-').replace('/', '_')),
        ErrorKind.CORRUPT);
  }

  @Test
  void decodeText_null_isCorrupt() {
    assertKind(() -> PasswordHashCodec.decodeText(null), ErrorKind.CORRUPT);
  }

  // ─── decode: validation order ─────────────────────────────────────────────

  static Stream<Arguments> malformedValues() {
    return Stream.of(
        Arguments.of(new byte[]{0, 0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10}, ErrorKind.CORRUPT),
        Arguments.of(new byte[]{0, 0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11}, ErrorKind.VERSION),
        Arguments.of(new byte[]{V3, 0, 0, 0, 0, 4, 5, 6, 7, 8, 9, 10, 11}, ErrorKind.FUNCTION),
        Arguments.of(new byte[]{V3, 0, 0, 0, PRF, 4, 5, 6, 7, 8, 9, 10, 11}, ErrorKind.PARAMETER),
        Arguments.of(new byte[]{V3, 0, 0, 0, PRF, 0, 0, 0, 0, 8, 9, 10, 11}, ErrorKind.PARAMETER),
        Arguments.of(new byte[]{V3, 0, 0, 0, PRF, 0, 0, 0, 1, 8, 9, 10, 11}, ErrorKind.PARAMETER),
        Arguments.of(new byte[]{V3, 0, 0, 0, PRF, 0, 0, 0, 1, 0, 0, 0, 1}, ErrorKind.CORRUPT),
        Arguments.of(new byte[]{V3, 0, 0, 0, PRF, 0, 0, 0, 1, 0, 0, 0, 1, (byte) 0xEE}, ErrorKind.CORRUPT),
        Arguments.of(new byte[0], ErrorKind.CORRUPT),
        Arguments.of(header(2, PRF, 1, 1), ErrorKind.VERSION),
        Arguments.of(header(V3, 2, 1, 1), ErrorKind.FUNCTION),
        Arguments.of(header(V3, 0x01000000, 1, 1), ErrorKind.FUNCTION),
        Arguments.of(header(V3, PRF, 100001, 1), ErrorKind.PARAMETER),
        Arguments.of(header(V3, PRF, -1, 1), ErrorKind.PARAMETER),
        Arguments.of(header(V3, PRF, 1, 0), ErrorKind.PARAMETER),
        Arguments.of(header(V3, PRF, 1, 65), ErrorKind.PARAMETER),
        Arguments.of(header(V3, PRF, 1, Integer.MIN_VALUE), ErrorKind.PARAMETER),
        // version is checked before the length of the remainder
        Arguments.of(ByteUtils.concat(header(0, PRF, 1, 1), new byte[33]), ErrorKind.VERSION),
        // subkey one byte short / long
        Arguments.of(ByteUtils.concat(header(V3, PRF, 1, 1), new byte[32]), ErrorKind.CORRUPT),
        Arguments.of(ByteUtils.concat(header(V3, PRF, 1, 1), new byte[34]), ErrorKind.CORRUPT)
    );
  }

  @ParameterizedTest
  @MethodSource("malformedValues")
  void decode_malformedValue_reportsKind(byte[] value, ErrorKind expected) {
    assertKind(() -> PasswordHashCodec.decode(value), expected);
  }

  @Test
  void decode_null_isCorrupt() {
    assertKind(() -> PasswordHashCodec.decode(null), ErrorKind.CORRUPT);
  }

  @Test
  void decode_minimalValidValue() {
    byte[] value = ByteUtils.concat(
        new byte[]{V3, 0, 0, 0, PRF, 0, 0, 0, 1, 0, 0, 0, 1, (byte) 0xEE}, HELLO_SUBKEY);
    PasswordHash hash = PasswordHashCodec.decode(value);
    assertThat(hash.iterations()).isEqualTo(1);
    assertThat(hash.salt()).isEqualTo(new byte[]{(byte) 0xEE});
    assertThat(hash.subkey()).isEqualTo(HELLO_SUBKEY);
    assertThat(PasswordHashCodec.encode(hash)).isEqualTo(value);
  }

  @Test
  void decode_doesNotAliasInput() {
    byte[] value = Base64.getDecoder().decode(JOSEPHINE);
    PasswordHash hash = PasswordHashCodec.decode(value);
    Arrays.fill(value, (byte) 0);
    assertThat(PasswordHashCodec.encodeText(hash)).isEqualTo(JOSEPHINE);
  }

  // ─── encode ───────────────────────────────────────────────────────────────

  @Test
  void encode_layout() {
    byte[] salt = {9, 8, 7};
    byte[] subkey = new byte[32];
    Arrays.fill(subkey, (byte) 0x5A);
    byte[] encoded = PasswordHashCodec.encode(PasswordHash.fromComponents(salt, 10000, subkey));

    assertThat(encoded).hasSize(13 + 3 + 32);
    assertThat(Arrays.copyOfRange(encoded, 0, 13))
        .isEqualTo(new byte[]{1, 0, 0, 0, 1, 0, 0, 0x27, 0x10, 0, 0, 0, 3});
    assertThat(Arrays.copyOfRange(encoded, 13, 16)).isEqualTo(salt);
    assertThat(Arrays.copyOfRange(encoded, 16, 48)).isEqualTo(subkey);
  }

  static Stream<Arguments> boundaryParameters() {
    return Stream.of(
        Arguments.of(1, 1),
        Arguments.of(1, 64),
        Arguments.of(100000, 1),
        Arguments.of(100000, 64),
        Arguments.of(10000, 16)
    );
  }

  @ParameterizedTest
  @MethodSource("boundaryParameters")
  void decode_invertsEncode_atBoundaries(int iterations, int saltLength) {
    byte[] salt = new byte[saltLength];
    Arrays.fill(salt, (byte) saltLength);
    byte[] subkey = new byte[32];
    Arrays.fill(subkey, (byte) 0xC3);
    PasswordHash hash = PasswordHash.fromComponents(salt, iterations, subkey);

    assertThat(PasswordHashCodec.decode(PasswordHashCodec.encode(hash))).isEqualTo(hash);
    assertThat(PasswordHashCodec.decodeText(PasswordHashCodec.encodeText(hash))).isEqualTo(hash);
  }

  private static byte[] header(int version, int prf, int iterations, int saltLength) {
    return ByteUtils.concat(new byte[]{(byte) version}, ByteUtils.uint32(prf),
        ByteUtils.uint32(iterations), ByteUtils.uint32(saltLength));
  }

  private static void assertKind(ThrowingCallable call, ErrorKind kind) {
    assertThatThrownBy(call)
        .isInstanceOf(PasswordHashException.class)
        .extracting(e -> ((PasswordHashException) e).kind())
        .isEqualTo(kind);
  }
}
