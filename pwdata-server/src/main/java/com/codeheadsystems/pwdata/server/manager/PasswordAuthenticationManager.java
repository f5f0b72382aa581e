package com.codeheadsystems.pwdata.server.manager;

import com.codeheadsystems.pwdata.codec.PasswordHashCodec;
import com.codeheadsystems.pwdata.manager.PasswordHashManager;
import com.codeheadsystems.pwdata.model.PasswordHash;
import com.codeheadsystems.pwdata.model.PasswordHashException;
import com.codeheadsystems.pwdata.server.model.UserRecord;
import com.codeheadsystems.pwdata.server.store.CredentialStore;
import java.util.Objects;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic password registration and authentication on top of a {@link CredentialStore}.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException} for bad or missing request data (HTTP 400)</li>
 *   <li>{@link PasswordHashException} when an imported hash cannot be decoded (HTTP 400)</li>
 * </ul>
 * Authentication failures are reported as {@code false}, never as exceptions, and cost the same
 * whether the user is unknown, the stored value is corrupt, or the password is wrong.
 */
@Singleton
public class PasswordAuthenticationManager {

  private static final Logger log = LoggerFactory.getLogger(PasswordAuthenticationManager.class);

  private final PasswordHashManager passwordHashManager;
  private final CredentialStore credentialStore;

  /**
   * Instantiates a new Password authentication manager.
   *
   * @param passwordHashManager the password hash manager
   * @param credentialStore     the credential store
   */
  @Inject
  public PasswordAuthenticationManager(final PasswordHashManager passwordHashManager,
                                       final CredentialStore credentialStore) {
    this.passwordHashManager = Objects.requireNonNull(passwordHashManager, "passwordHashManager");
    this.credentialStore = Objects.requireNonNull(credentialStore, "credentialStore");
    log.info("PasswordAuthenticationManager({})", credentialStore.getClass().getSimpleName());
  }

  /**
   * Creates a hash with the configured cost and stores it, replacing any existing one.
   *
   * @param userName the user name
   * @param password the password
   */
  public void register(String userName, String password) {
    requireUserName(userName);
    if (password == null) {
      throw new IllegalArgumentException("Missing required field: password");
    }
    credentialStore.store(userName, passwordHashManager.newFromPassword(password));
    log.debug("register({})", userName);
  }

  /**
   * Checks the password for the user. A record below the configured cost is re-hashed on success.
   *
   * @param userName the user name
   * @param password the password
   * @return true if the user exists and the password matches
   */
  public boolean authenticate(String userName, String password) {
    Optional<PasswordHash> verified = verify(userName, password);
    if (verified.isEmpty()) {
      return false;
    }
    PasswordHash hash = verified.get();
    if (passwordHashManager.needsRehash(hash)) {
      // Only the record that was verified gets replaced.
      boolean upgraded = credentialStore.replace(userName, hash, passwordHashManager.newFromPassword(password));
      log.info("authenticate({}): upgrade iterations from {} to {}: {}", userName, hash.iterations(),
          passwordHashManager.config().iterations(), upgraded ? "done" : "record changed, skipped");
    }
    return true;
  }

  /**
   * Imports a base64 hash string taken from a legacy user table.
   *
   * @param userName    the user name
   * @param encodedHash the encoded hash
   * @throws PasswordHashException if the value cannot be decoded
   */
  public void importEncoded(String userName, String encodedHash) {
    requireUserName(userName);
    PasswordHash hash = PasswordHashCodec.decodeText(encodedHash);
    credentialStore.store(userName, hash);
    log.debug("importEncoded({}): iterations={}", userName, hash.iterations());
  }

  /**
   * Imports a user record.
   *
   * @param record the record
   * @throws IllegalArgumentException if the user name or hash field is missing
   * @throws PasswordHashException    if the hash cannot be decoded
   */
  public void importUser(UserRecord record) {
    Objects.requireNonNull(record, "record");
    String userName = record.requireUserName();
    PasswordHash hash = record.passwordHash();
    credentialStore.store(userName, hash);
    log.debug("importUser({}): iterations={}", userName, hash.iterations());
  }

  /**
   * Exports the stored hash of a user.
   *
   * @param userName the user name
   * @return the user record, or empty if the user is not registered
   */
  public Optional<UserRecord> exportUser(String userName) {
    requireUserName(userName);
    return credentialStore.load(userName).map(hash -> new UserRecord(userName, hash));
  }

  /**
   * Replaces the password if the old one matches.
   *
   * @param userName    the user name
   * @param oldPassword the old password
   * @param newPassword the new password
   * @return true if the password was changed, false if the old one did not match or the record
   *     was changed concurrently
   */
  public boolean changePassword(String userName, String oldPassword, String newPassword) {
    if (newPassword == null) {
      throw new IllegalArgumentException("Missing required field: newPassword");
    }
    Optional<PasswordHash> verified = verify(userName, oldPassword);
    if (verified.isEmpty()) {
      return false;
    }
    boolean changed = credentialStore.replace(userName, verified.get(),
        passwordHashManager.newFromPassword(newPassword));
    log.debug("changePassword({}): {}", userName, changed ? "done" : "record changed, rejected");
    return changed;
  }

  /**
   * Whether the stored record is below the configured cost. Unknown users never need it,
   * an undecodable record always does.
   *
   * @param userName the user name
   * @return true if the record should be re-hashed at next login
   */
  public boolean needsRehash(String userName) {
    requireUserName(userName);
    try {
      return credentialStore.load(userName).map(passwordHashManager::needsRehash).orElse(false);
    } catch (PasswordHashException e) {
      log.warn("needsRehash({}): stored value rejected ({})", userName, e.kind());
      return true;
    }
  }

  /**
   * Removes the user's record, if present.
   *
   * @param userName the user name
   */
  public void delete(String userName) {
    requireUserName(userName);
    credentialStore.delete(userName);
  }

  /**
   * Returns the stored record if the password matches it. Costs one verification either way.
   */
  private Optional<PasswordHash> verify(String userName, String password) {
    requireUserName(userName);
    if (password == null) {
      throw new IllegalArgumentException("Missing required field: password");
    }
    Optional<PasswordHash> stored = loadQuietly(userName);
    if (stored.isEmpty()) {
      passwordHashManager.verifyAgainstDecoy(password);
      log.debug("verify({}): no usable record", userName);
      return Optional.empty();
    }
    if (!passwordHashManager.verifyPassword(stored.get(), password)) {
      log.debug("verify({}): mismatch", userName);
      return Optional.empty();
    }
    return stored;
  }

  private Optional<PasswordHash> loadQuietly(String userName) {
    try {
      return credentialStore.load(userName);
    } catch (PasswordHashException e) {
      log.warn("Stored password hash for {} rejected ({})", userName, e.kind());
      return Optional.empty();
    }
  }

  private static void requireUserName(String userName) {
    if (userName == null || userName.isBlank()) {
      throw new IllegalArgumentException("Missing required field: userName");
    }
  }
}
