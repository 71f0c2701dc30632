package org.a11yrag.retrieval_service.authority.service;

import java.util.Optional;
import org.a11yrag.retrieval_service.authority.model.AuthorityRecord;

/** Read-only lookup of known authors. */
public interface AuthorityStore {

  /**
   * @param authorId author identifier or name, may be null
   * @return the record of a known author, empty if the author is not known
   */
  Optional<AuthorityRecord> lookup(String authorId);
}
