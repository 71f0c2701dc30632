package org.a11yrag.retrieval_service.authority.service;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.a11yrag.retrieval_service.authority.loader.AuthorityRecordsLoader;
import org.a11yrag.retrieval_service.authority.model.AuthorityRecord;
import org.a11yrag.retrieval_service.authority.model.AuthoritySnapshot;
import org.a11yrag.retrieval_service.config.AuthorityConfig;
import org.a11yrag.retrieval_service.exceptions.FailureReason;
import org.a11yrag.retrieval_service.exceptions.RetrievalException;
import org.springframework.stereotype.Service;

/**
 * {@link AuthorityStore} over an immutable snapshot of the authority records file. Reloading
 * builds a new snapshot and swaps it in; lookups never block.
 */
@Slf4j
@Service
public class AuthorityService implements AuthorityStore {

  private final AuthorityRecordsLoader loader;
  private final AuthorityConfig authorityConfig;
  private final AtomicReference<AuthoritySnapshot> current =
      new AtomicReference<>(AuthoritySnapshot.empty());

  public AuthorityService(AuthorityRecordsLoader loader, AuthorityConfig authorityConfig) {
    this.loader = loader;
    this.authorityConfig = authorityConfig;
  }

  /**
   * Loads the configured records file and publishes it.
   *
   * @throws RetrievalException with reason {@code CONFIGURATION_ERROR} if the file cannot be
   *     loaded; the previous snapshot stays
   */
  public synchronized AuthoritySnapshot loadRecords() {
    String location = authorityConfig.getRecordsLocation();
    AuthoritySnapshot snapshot;
    try {
      snapshot = loader.loadFromResource(location);
    } catch (IllegalStateException e) {
      throw new RetrievalException(
          FailureReason.CONFIGURATION_ERROR,
          "Authority records rejected: " + e.getMessage(),
          e);
    }
    current.set(snapshot);
    log.info(
        "Authority records {} loaded from {}: {} authors",
        snapshot.getVersion(),
        location,
        snapshot.size());
    return snapshot;
  }

  @Override
  public Optional<AuthorityRecord> lookup(String authorId) {
    return current.get().find(authorId).map(profile -> profile.toRecord(authorId));
  }

  public AuthoritySnapshot getCurrentSnapshot() {
    return current.get();
  }
}
