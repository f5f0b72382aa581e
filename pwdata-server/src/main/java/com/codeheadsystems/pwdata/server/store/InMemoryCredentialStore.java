package com.codeheadsystems.pwdata.server.store;

import com.codeheadsystems.pwdata.model.PasswordHash;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link CredentialStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All records are lost on restart. Suitable for development and testing only.
 */
public class InMemoryCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStore.class);

  private final ConcurrentHashMap<String, PasswordHash> store = new ConcurrentHashMap<>();

  public InMemoryCredentialStore() {
    log.warn("Using InMemoryCredentialStore, password hashes will NOT survive restarts. "
        + "Replace with a persistent CredentialStore for production.");
  }

  @Override
  public void store(String userName, PasswordHash hash) {
    store.put(userName, hash);
    log.debug("Stored password hash for {} (iterations={})", userName, hash.iterations());
  }

  @Override
  public Optional<PasswordHash> load(String userName) {
    return Optional.ofNullable(store.get(userName));
  }

  @Override
  public boolean replace(String userName, PasswordHash expected, PasswordHash replacement) {
    boolean replaced = store.replace(userName, expected, replacement);
    log.debug("Replace password hash for {}: {}", userName, replaced ? "done" : "stale");
    return replaced;
  }

  @Override
  public void delete(String userName) {
    if (store.remove(userName) != null) {
      log.debug("Deleted password hash for {}", userName);
    }
  }
}
