package com.codeheadsystems.pwdata.model;

import java.util.Optional;

/**
 * Outcome of verifying a password against an encoded hash.
 * <p>
 * For access control only {@link #verified()} matters; any error is to be treated exactly like
 * a {@code false} result and used for diagnostics only.
 *
 * @param verified true iff the stored hash decoded and the password matched
 * @param error    why the stored hash could not be decoded, or null when it decoded
 */
public record VerificationResult(boolean verified, PasswordHashException error) {

  /**
   * Result for a stored hash that decoded.
   *
   * @param verified whether the password matched
   * @return the verification result
   */
  public static VerificationResult of(boolean verified) {
    return new VerificationResult(verified, null);
  }

  /**
   * Result for a stored hash that could not be decoded.
   *
   * @param error the decode failure
   * @return the verification result
   */
  public static VerificationResult failed(PasswordHashException error) {
    return new VerificationResult(false, error);
  }

  public Optional<ErrorKind> errorKind() {
    return Optional.ofNullable(error).map(PasswordHashException::kind);
  }
}
