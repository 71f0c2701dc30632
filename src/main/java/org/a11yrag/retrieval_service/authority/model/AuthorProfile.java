package org.a11yrag.retrieval_service.authority.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A known author as listed in the authority records file.
 *
 * @param id stable identifier, also accepted as lookup key
 * @param name display name
 * @param aliases alternative spellings
 * @param level authority level
 * @param expertise expertise-area tags
 */
public record AuthorProfile(
    String id, String name, List<String> aliases, AuthorityLevel level, Set<String> expertise) {

  public AuthorProfile {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(level, "level must not be null");
    aliases = aliases == null ? List.of() : List.copyOf(aliases);
    expertise = expertise == null ? Set.of() : Set.copyOf(expertise);
  }

  public AuthorityRecord toRecord(String requestedId) {
    return new AuthorityRecord(requestedId, level, expertise, AuthorityBasis.KNOWN_AUTHOR);
  }
}
