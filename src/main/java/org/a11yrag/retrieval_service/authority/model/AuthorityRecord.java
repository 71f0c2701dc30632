package org.a11yrag.retrieval_service.authority.model;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Authority of an author or source.
 *
 * @param authorId identifier the record was resolved for, may be null for type defaults
 * @param level authority level
 * @param expertise expertise-area tags, sorted
 * @param basis rule that produced the record
 */
public record AuthorityRecord(
    String authorId, AuthorityLevel level, Set<String> expertise, AuthorityBasis basis) {

  public AuthorityRecord {
    Objects.requireNonNull(level, "level must not be null");
    Objects.requireNonNull(basis, "basis must not be null");
    expertise =
        expertise == null
            ? Set.of()
            : Collections.unmodifiableSet(new TreeSet<>(expertise));
  }

  public AuthorityRecord withAuthorId(String id) {
    return new AuthorityRecord(id, level, expertise, basis);
  }
}
