package com.codeheadsystems.pwdata.config;

import static com.codeheadsystems.pwdata.model.PasswordHash.DEFAULT_ITERATIONS;
import static com.codeheadsystems.pwdata.model.PasswordHash.DEFAULT_SALT_LENGTH;
import static com.codeheadsystems.pwdata.model.PasswordHash.MAX_ITERATIONS;
import static com.codeheadsystems.pwdata.model.PasswordHash.MAX_SALT_LENGTH;
import static com.codeheadsystems.pwdata.model.PasswordHash.MIN_ITERATIONS;
import static com.codeheadsystems.pwdata.model.PasswordHash.MIN_SALT_LENGTH;

import com.codeheadsystems.pwdata.common.RandomProvider;
import com.codeheadsystems.pwdata.kdf.KeyDerivationFunction;
import com.codeheadsystems.pwdata.kdf.Pbkdf2HmacSha256;
import java.util.Objects;

/**
 * Parameters for creating new password hashes.
 * Stored hashes always carry their own iteration count and salt; these values only apply to
 * hashes created from now on and to the decoy checked when no stored hash exists.
 *
 * @param iterations     PBKDF2 iteration count for new hashes
 * @param saltLength     salt length for new hashes
 * @param kdf            the key derivation function
 * @param randomProvider source of salts
 */
public record PasswordHashConfig(
    int iterations,
    int saltLength,
    KeyDerivationFunction kdf,
    RandomProvider randomProvider
) {

  /**
   * ASP.NET Core Identity defaults: 10000 iterations, 16-byte salt.
   */
  public static final PasswordHashConfig DEFAULT = new PasswordHashConfig(
      DEFAULT_ITERATIONS,
      DEFAULT_SALT_LENGTH,
      new Pbkdf2HmacSha256(),
      new RandomProvider()
  );

  public PasswordHashConfig {
    if (iterations < MIN_ITERATIONS || iterations > MAX_ITERATIONS) {
      throw new IllegalArgumentException("Iterations must be in [" + MIN_ITERATIONS + ", "
          + MAX_ITERATIONS + "]: " + iterations);
    }
    if (saltLength < MIN_SALT_LENGTH || saltLength > MAX_SALT_LENGTH) {
      throw new IllegalArgumentException("Salt length must be in [" + MIN_SALT_LENGTH + ", "
          + MAX_SALT_LENGTH + "]: " + saltLength);
    }
    Objects.requireNonNull(kdf, "kdf");
    Objects.requireNonNull(randomProvider, "randomProvider");
  }

  /**
   * Creates a cheap configuration for tests. Not for production use.
   */
  public static PasswordHashConfig forTesting() {
    return new PasswordHashConfig(10, DEFAULT_SALT_LENGTH, new Pbkdf2HmacSha256(), new RandomProvider());
  }

  /**
   * Returns a new config identical to this one but with the given iteration count.
   */
  public PasswordHashConfig withIterations(int iterations) {
    return new PasswordHashConfig(iterations, saltLength, kdf, randomProvider);
  }

  /**
   * Returns a new config identical to this one but using the given {@link RandomProvider}.
   */
  public PasswordHashConfig withRandomProvider(RandomProvider randomProvider) {
    return new PasswordHashConfig(iterations, saltLength, kdf, randomProvider);
  }
}
