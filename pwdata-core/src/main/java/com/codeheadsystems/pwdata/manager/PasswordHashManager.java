package com.codeheadsystems.pwdata.manager;

import com.codeheadsystems.pwdata.codec.PasswordHashCodec;
import com.codeheadsystems.pwdata.config.PasswordHashConfig;
import com.codeheadsystems.pwdata.model.ErrorKind;
import com.codeheadsystems.pwdata.model.PasswordHash;
import com.codeheadsystems.pwdata.model.PasswordHashException;
import com.codeheadsystems.pwdata.model.VerificationResult;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.bouncycastle.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates and verifies ASP.NET Core Identity compatible password hashes.
 * <p>
 * Passwords given as {@link String} are hashed as their UTF-8 bytes, like ASP.NET does.
 * <p>
 * When a stored value cannot be decoded, or there is no stored value at all, a decoy hash of
 * the configured cost is verified instead, so the time taken does not tell an observer
 * whether the stored value was malformed, missing or simply did not match.
 * <p>
 * Thread-safe.
 */
public class PasswordHashManager {

  private static final Logger log = LoggerFactory.getLogger(PasswordHashManager.class);

  private static final int DECOY_PASSWORD_LENGTH = 32;

  private final PasswordHashConfig config;
  private final PasswordHash decoy;

  /**
   * Instantiates a new Password hash manager with {@link PasswordHashConfig#DEFAULT}.
   */
  public PasswordHashManager() {
    this(PasswordHashConfig.DEFAULT);
  }

  /**
   * Instantiates a new Password hash manager.
   *
   * @param config the config
   * @throws PasswordHashException {@link ErrorKind#RANDOM_SOURCE_FAILURE} if the decoy cannot be salted
   */
  public PasswordHashManager(final PasswordHashConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    log.info("PasswordHashManager(iterations={}, saltLength={})", config.iterations(), config.saltLength());
    // Independent secret, so a decoy comparison never compares a key with itself.
    byte[] decoyPassword = randomBytes(DECOY_PASSWORD_LENGTH);
    this.decoy = newFromPassword(decoyPassword, config.iterations());
  }

  public PasswordHashConfig config() {
    return config;
  }

  // ── Construction ──────────────────────────────────────────────────────────

  /**
   * Hashes a password with the configured iteration count and a fresh random salt.
   *
   * @param password the password
   * @return the password hash
   * @throws PasswordHashException {@link ErrorKind#RANDOM_SOURCE_FAILURE} if no salt can be made
   */
  public PasswordHash newFromPassword(String password) {
    return newFromPassword(password, config.iterations());
  }

  /**
   * Hashes a password with a fresh random salt.
   * {@link PasswordHash#DEFAULT_ITERATIONS} is the ASP.NET compatible choice of iterations.
   *
   * @param password   the password
   * @param iterations the iteration count, in [1, 100000]
   * @return the password hash
   * @throws PasswordHashException {@link ErrorKind#RANDOM_SOURCE_FAILURE} if no salt can be made
   */
  public PasswordHash newFromPassword(String password, int iterations) {
    return newFromPassword(utf8(password), iterations);
  }

  /**
   * Hashes password bytes with a fresh random salt.
   *
   * @param password   the password bytes
   * @param iterations the iteration count, in [1, 100000]
   * @return the password hash
   * @throws PasswordHashException {@link ErrorKind#RANDOM_SOURCE_FAILURE} if no salt can be made
   */
  public PasswordHash newFromPassword(byte[] password, int iterations) {
    Objects.requireNonNull(password, "password");
    if (iterations < PasswordHash.MIN_ITERATIONS || iterations > PasswordHash.MAX_ITERATIONS) {
      throw new IllegalArgumentException("Iterations must be in [" + PasswordHash.MIN_ITERATIONS + ", "
          + PasswordHash.MAX_ITERATIONS + "]: " + iterations);
    }
    byte[] salt = randomBytes(config.saltLength());
    byte[] subkey = config.kdf().derive(password, salt, iterations);
    log.trace("newFromPassword(iterations={})", iterations);
    return PasswordHash.fromComponents(salt, iterations, subkey);
  }

  /**
   * Hashes password bytes and returns the user table text as ASCII bytes.
   *
   * @param password   the password bytes
   * @param iterations the iteration count, in [1, 100000]
   * @return the encoded hash
   * @throws PasswordHashException {@link ErrorKind#RANDOM_SOURCE_FAILURE} if no salt can be made
   */
  public byte[] generateFromPassword(byte[] password, int iterations) {
    return PasswordHashCodec.encodeText(newFromPassword(password, iterations))
        .getBytes(StandardCharsets.US_ASCII);
  }

  // ── Verification ──────────────────────────────────────────────────────────

  /**
   * Checks a password against a decoded hash in constant time.
   *
   * @param hash     the stored hash
   * @param password the candidate password
   * @return true iff the password produced the stored subkey
   */
  public boolean verifyPassword(PasswordHash hash, String password) {
    return verifyPassword(hash, utf8(password));
  }

  /**
   * Checks password bytes against a decoded hash in constant time.
   *
   * @param hash     the stored hash
   * @param password the candidate password bytes
   * @return true iff the password produced the stored subkey
   */
  public boolean verifyPassword(PasswordHash hash, byte[] password) {
    Objects.requireNonNull(hash, "hash");
    Objects.requireNonNull(password, "password");
    byte[] candidate = config.kdf().derive(password, hash.salt(), hash.iterations());
    // Full pass over both arrays, even when the lengths differ.
    return Arrays.constantTimeAreEqual(hash.subkey(), candidate);
  }

  /**
   * Checks a password against the user table text of a hash.
   * A stored value that cannot be decoded costs one decoy verification and is reported as
   * unverified together with the decode error. Treat that error like {@code false}.
   *
   * @param encoded  the stored base64 text
   * @param password the candidate password
   * @return the verification result
   */
  public VerificationResult verifyEncodedHash(String encoded, String password) {
    return verifyEncodedHash(encoded, utf8(password));
  }

  /**
   * As {@link #verifyEncodedHash(String, String)} for password bytes.
   *
   * @param encoded  the stored base64 text
   * @param password the candidate password bytes
   * @return the verification result
   */
  public VerificationResult verifyEncodedHash(String encoded, byte[] password) {
    Objects.requireNonNull(password, "password");
    final PasswordHash hash;
    try {
      hash = PasswordHashCodec.decodeText(encoded);
    } catch (PasswordHashException e) {
      log.debug("verifyEncodedHash(): stored value rejected, kind={}", e.kind());
      verifyAgainstDecoy(password);
      return VerificationResult.failed(e);
    }
    return VerificationResult.of(verifyPassword(hash, password));
  }

  /**
   * Compares encoded hash bytes with a password, returning normally on a match.
   *
   * @param hashed   the stored base64 text as ASCII bytes
   * @param password the candidate password bytes
   * @throws PasswordHashException the decode failure for a malformed stored value, or
   *                               {@link ErrorKind#MISMATCH} for a wrong password
   */
  public void compareHashAndPassword(byte[] hashed, byte[] password) {
    String encoded = hashed == null ? null : new String(hashed, StandardCharsets.US_ASCII);
    VerificationResult result = verifyEncodedHash(encoded, password);
    if (result.error() != null) {
      throw result.error();
    }
    if (!result.verified()) {
      throw new PasswordHashException(ErrorKind.MISMATCH);
    }
  }

  /**
   * Spends the time of one verification at the configured cost, for callers that have no
   * stored hash to check.
   *
   * @param password the candidate password
   */
  public void verifyAgainstDecoy(String password) {
    verifyAgainstDecoy(utf8(password));
  }

  private void verifyAgainstDecoy(byte[] password) {
    boolean matched = verifyPassword(decoy, password);
    log.trace("verifyAgainstDecoy(matched={})", matched);
  }

  /**
   * Whether a hash was made with fewer iterations than currently configured.
   *
   * @param hash the hash
   * @return true if it should be replaced after the next successful verification
   */
  public boolean needsRehash(PasswordHash hash) {
    return hash.iterations() < config.iterations();
  }

  private byte[] randomBytes(int len) {
    try {
      return config.randomProvider().randomBytes(len);
    } catch (RuntimeException e) {
      throw new PasswordHashException(ErrorKind.RANDOM_SOURCE_FAILURE, e.toString(), e);
    }
  }

  private static byte[] utf8(String password) {
    return Objects.requireNonNull(password, "password").getBytes(StandardCharsets.UTF_8);
  }
}
