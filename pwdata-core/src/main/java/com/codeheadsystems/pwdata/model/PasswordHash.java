package com.codeheadsystems.pwdata.model;

import com.codeheadsystems.pwdata.codec.PasswordHashCodec;
import java.util.Arrays;
import java.util.Objects;

/**
 * A hashed password in the ASP.NET Core Identity version 3 layout:
 * PBKDF2 with HMAC-SHA256, by default a 128-bit salt, a 256-bit subkey and 10000 iterations.
 * <p>
 * Wire format: {@code { 0x01, prf (u32), iterations (u32), salt length (u32), salt, subkey }},
 * all integers big-endian. See {@link PasswordHashCodec}.
 * <p>
 * Instances are immutable. The salt and subkey are copied on the way in and on the way out,
 * so no caller-held array ever aliases the record's state.
 *
 * @param version    format version, {@link #VERSION_3} for every decodable value
 * @param prf        pseudorandom function identifier, {@link #PRF_HMAC_SHA256}
 * @param iterations PBKDF2 iteration count
 * @param salt       per-credential salt
 * @param subkey     derived key compared during verification
 */
public record PasswordHash(int version, int prf, int iterations, byte[] salt, byte[] subkey) {

  /**
   * Version byte of the only supported format (ASP.NET Core Identity "V3").
   */
  public static final int VERSION_3 = 1;

  /**
   * PRF identifier for HMAC-SHA256.
   */
  public static final int PRF_HMAC_SHA256 = 1;

  /**
   * Iteration count used by ASP.NET Core Identity.
   */
  public static final int DEFAULT_ITERATIONS = 10000;

  /**
   * Salt length used by ASP.NET Core Identity.
   */
  public static final int DEFAULT_SALT_LENGTH = 16;

  /**
   * Subkey length, fixed by the SHA-256 output size.
   */
  public static final int SUBKEY_LENGTH = 32;

  public static final int MIN_ITERATIONS = 1;
  public static final int MAX_ITERATIONS = 100000;
  public static final int MIN_SALT_LENGTH = 1;
  public static final int MAX_SALT_LENGTH = 64;

  /**
   * version[1] + prf[4] + iterations[4] + saltLength[4].
   */
  public static final int HEADER_LENGTH = 1 + 3 * 4;

  /**
   * Instantiates a new Password hash, copying the salt and subkey.
   */
  public PasswordHash {
    Objects.requireNonNull(salt, "salt");
    Objects.requireNonNull(subkey, "subkey");
    salt = salt.clone();
    subkey = subkey.clone();
  }

  /**
   * Assembles a version 3 / HMAC-SHA256 record from components obtained elsewhere.
   * Ranges are not validated here; callers holding untrusted components must check them.
   *
   * @param salt       the salt
   * @param iterations the iteration count
   * @param subkey     the derived subkey
   * @return the password hash
   */
  public static PasswordHash fromComponents(byte[] salt, int iterations, byte[] subkey) {
    return new PasswordHash(VERSION_3, PRF_HMAC_SHA256, iterations, salt, subkey);
  }

  @Override
  public byte[] salt() {
    return salt.clone();
  }

  @Override
  public byte[] subkey() {
    return subkey.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof PasswordHash other
        && version == other.version
        && prf == other.prf
        && iterations == other.iterations
        && Arrays.equals(salt, other.salt)
        && Arrays.equals(subkey, other.subkey);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(version, prf, iterations);
    result = 31 * result + Arrays.hashCode(salt);
    return 31 * result + Arrays.hashCode(subkey);
  }

  /**
   * The base64 text form, i.e. the value kept in the user table.
   */
  @Override
  public String toString() {
    return PasswordHashCodec.encodeText(this);
  }
}
