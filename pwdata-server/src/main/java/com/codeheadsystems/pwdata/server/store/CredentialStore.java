package com.codeheadsystems.pwdata.server.store;

import com.codeheadsystems.pwdata.model.PasswordHash;
import java.util.Optional;

/**
 * Storage abstraction for password hash records, keyed by user name.
 * <p>
 * Implementations must be thread-safe. Typical production implementations back
 * this with the existing user table, keeping the hash in its base64 text form.
 */
public interface CredentialStore {

  /**
   * Stores or replaces the password hash for the given user.
   *
   * @param userName the user name
   * @param hash     the password hash record
   */
  void store(String userName, PasswordHash hash);

  /**
   * Retrieves the password hash for the given user.
   *
   * @param userName the user name
   * @return the stored record, or empty if the user is not registered
   * @throws com.codeheadsystems.pwdata.model.PasswordHashException if the stored value cannot be decoded
   */
  Optional<PasswordHash> load(String userName);

  /**
   * Replaces the password hash only if the current one equals {@code expected}.
   *
   * @param userName    the user name
   * @param expected    the record the caller last loaded
   * @param replacement the new record
   * @return true if the record was replaced, false if it was changed or removed in the meantime
   */
  boolean replace(String userName, PasswordHash expected, PasswordHash replacement);

  /**
   * Removes the password hash for the given user, if present.
   *
   * @param userName the user name
   */
  void delete(String userName);
}
