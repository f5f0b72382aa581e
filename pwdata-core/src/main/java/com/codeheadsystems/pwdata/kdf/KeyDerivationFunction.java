package com.codeheadsystems.pwdata.kdf;

/**
 * Turns a plaintext password plus the stored parameters into the subkey that is compared
 * during verification. Implementations are pure and thread-safe.
 */
public interface KeyDerivationFunction {

  /**
   * Derives a key.
   *
   * @param password   the password bytes
   * @param salt       the salt
   * @param iterations work factor, at least 1
   * @return a new array of {@link #outputLength()} bytes
   */
  byte[] derive(byte[] password, byte[] salt, int iterations);

  /**
   * Length of every derived key in bytes.
   *
   * @return the int
   */
  int outputLength();
}
