package com.codeheadsystems.pwdata.kdf;

import com.codeheadsystems.pwdata.model.PasswordHash;
import java.util.Objects;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * PBKDF2 (RFC 8018) with HMAC-SHA256 as PRF and a 32-byte output, the key derivation of the
 * ASP.NET Core Identity version 3 format. Cost is linear in the iteration count.
 */
public class Pbkdf2HmacSha256 implements KeyDerivationFunction {

  @Override
  public byte[] derive(byte[] password, byte[] salt, int iterations) {
    Objects.requireNonNull(password, "password");
    Objects.requireNonNull(salt, "salt");
    if (iterations < 1) {
      throw new IllegalArgumentException("Iteration count must be positive: " + iterations);
    }
    // A fresh generator per call; BouncyCastle generators are not thread-safe.
    PKCS5S2ParametersGenerator gen = new PKCS5S2ParametersGenerator(new SHA256Digest());
    gen.init(password, salt, iterations);
    KeyParameter key = (KeyParameter) gen.generateDerivedParameters(outputLength() * 8);
    return key.getKey();
  }

  @Override
  public int outputLength() {
    return PasswordHash.SUBKEY_LENGTH;
  }
}
