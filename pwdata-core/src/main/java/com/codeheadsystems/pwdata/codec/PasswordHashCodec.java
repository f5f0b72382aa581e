package com.codeheadsystems.pwdata.codec;

import static com.codeheadsystems.pwdata.model.PasswordHash.HEADER_LENGTH;
import static com.codeheadsystems.pwdata.model.PasswordHash.MAX_ITERATIONS;
import static com.codeheadsystems.pwdata.model.PasswordHash.MAX_SALT_LENGTH;
import static com.codeheadsystems.pwdata.model.PasswordHash.MIN_ITERATIONS;
import static com.codeheadsystems.pwdata.model.PasswordHash.MIN_SALT_LENGTH;
import static com.codeheadsystems.pwdata.model.PasswordHash.PRF_HMAC_SHA256;
import static com.codeheadsystems.pwdata.model.PasswordHash.SUBKEY_LENGTH;
import static com.codeheadsystems.pwdata.model.PasswordHash.VERSION_3;

import com.codeheadsystems.pwdata.common.ByteUtils;
import com.codeheadsystems.pwdata.model.ErrorKind;
import com.codeheadsystems.pwdata.model.PasswordHash;
import com.codeheadsystems.pwdata.model.PasswordHashException;
import java.util.Arrays;
import java.util.Base64;

/**
 * Binary and text codecs for {@link PasswordHash}, byte-identical to ASP.NET Core Identity:
 * <pre>
 *   ver[1]=0x01, prf[4]=0x01, iter[4], saltLen[4], salt[saltLen], subkey[32]
 * </pre>
 * All 32-bit integers are big-endian. The text form is padded standard base64 of the binary form.
 */
public class PasswordHashCodec {

  private static final int PRF_OFFSET = 1;
  private static final int ITERATIONS_OFFSET = PRF_OFFSET + ByteUtils.UINT32_LENGTH;
  private static final int SALT_LENGTH_OFFSET = ITERATIONS_OFFSET + ByteUtils.UINT32_LENGTH;

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private PasswordHashCodec() {
  }

  /**
   * Packs a hash into its binary layout. Cannot fail.
   *
   * @param hash the hash
   * @return the byte [ ]
   */
  public static byte[] encode(PasswordHash hash) {
    byte[] salt = hash.salt();
    return ByteUtils.concat(
        new byte[]{(byte) hash.version()},
        ByteUtils.uint32(hash.prf()),
        ByteUtils.uint32(hash.iterations()),
        ByteUtils.uint32(salt.length),
        salt,
        hash.subkey());
  }

  /**
   * Unpacks the binary layout. Every field is checked before anything is built, so a failure
   * never yields a partial record. The salt and subkey are copied out of {@code bytes}.
   *
   * @param bytes the packed value
   * @return the password hash
   * @throws PasswordHashException {@link ErrorKind#CORRUPT} for a bad length,
   *                               {@link ErrorKind#VERSION}, {@link ErrorKind#FUNCTION},
   *                               or {@link ErrorKind#PARAMETER} for out-of-range iterations or salt length
   */
  public static PasswordHash decode(byte[] bytes) {
    if (bytes == null) {
      throw new PasswordHashException(ErrorKind.CORRUPT, "no data");
    }
    if (bytes.length < HEADER_LENGTH) {
      throw new PasswordHashException(ErrorKind.CORRUPT,
          "need at least " + HEADER_LENGTH + " bytes, have " + bytes.length);
    }
    int version = bytes[0] & 0xFF;
    if (version != VERSION_3) {
      throw new PasswordHashException(ErrorKind.VERSION, "version " + version);
    }
    long prf = ByteUtils.readUint32(bytes, PRF_OFFSET);
    if (prf != PRF_HMAC_SHA256) {
      throw new PasswordHashException(ErrorKind.FUNCTION, "prf " + prf);
    }
    long iterations = ByteUtils.readUint32(bytes, ITERATIONS_OFFSET);
    if (iterations < MIN_ITERATIONS || iterations > MAX_ITERATIONS) {
      throw new PasswordHashException(ErrorKind.PARAMETER, "iteration count " + iterations);
    }
    long saltLength = ByteUtils.readUint32(bytes, SALT_LENGTH_OFFSET);
    if (saltLength < MIN_SALT_LENGTH || saltLength > MAX_SALT_LENGTH) {
      throw new PasswordHashException(ErrorKind.PARAMETER, "salt length " + saltLength);
    }
    if (HEADER_LENGTH + saltLength + SUBKEY_LENGTH != bytes.length) {
      throw new PasswordHashException(ErrorKind.CORRUPT, "expected "
          + (HEADER_LENGTH + saltLength + SUBKEY_LENGTH) + " bytes, have " + bytes.length);
    }
    int saltEnd = HEADER_LENGTH + (int) saltLength;
    return new PasswordHash(version, (int) prf, (int) iterations,
        Arrays.copyOfRange(bytes, HEADER_LENGTH, saltEnd),
        Arrays.copyOfRange(bytes, saltEnd, bytes.length));
  }

  /**
   * Encodes a hash as stored in the ASP.NET user table. Cannot fail.
   *
   * @param hash the hash
   * @return padded standard base64 of {@link #encode(PasswordHash)}
   */
  public static String encodeText(PasswordHash hash) {
    return B64.encodeToString(encode(hash));
  }

  /**
   * Decodes a hash from its user table text.
   *
   * @param text padded standard base64
   * @return the password hash
   * @throws PasswordHashException {@link ErrorKind#CORRUPT} carrying the base64 diagnostic when the
   *                               text is not padded standard base64, otherwise as {@link #decode(byte[])}
   */
  public static PasswordHash decodeText(String text) {
    if (text == null) {
      throw new PasswordHashException(ErrorKind.CORRUPT, "no encoded value");
    }
    final byte[] bytes;
    try {
      bytes = B64D.decode(text);
    } catch (IllegalArgumentException e) {
      throw new PasswordHashException(ErrorKind.CORRUPT, "password encoding: " + e.getMessage(), e);
    }
    // The JDK decoder also takes unpadded input.
    if (text.length() % 4 != 0) {
      throw new PasswordHashException(ErrorKind.CORRUPT,
          "password encoding: missing base64 padding, length " + text.length());
    }
    return decode(bytes);
  }
}
