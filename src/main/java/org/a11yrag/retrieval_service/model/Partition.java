package org.a11yrag.retrieval_service.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import lombok.Getter;

/**
 * Document-type partitions of the knowledge base. Each partition is searched through its own
 * {@link org.a11yrag.retrieval_service.index.VectorIndex}.
 */
@Getter
public enum Partition {
  ACADEMIC("academic_papers", "academic"),
  STANDARDS("standards", "standards"),
  BLOGS("expert_blogs", "blogs"),
  AUDITS("audit_tickets", "audits"),
  TRANSCRIPTS("testing_transcripts", "transcripts"),
  NEWSLETTERS("newsletters", "newsletters");

  /** Name of the underlying collection / index directory. */
  private final String collectionName;

  /** Short name used in routing tables, logs and API filters. */
  private final String shortName;

  Partition(String collectionName, String shortName) {
    this.collectionName = collectionName;
    this.shortName = shortName;
  }

  /**
   * Resolves a partition from its enum name, short name or collection name, ignoring case.
   *
   * @param name the name to resolve, may be null
   * @return the matching partition, or empty if the name is blank or unknown
   */
  public static Optional<Partition> fromName(String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(
            p ->
                p.name().toLowerCase(Locale.ROOT).equals(normalized)
                    || p.shortName.equals(normalized)
                    || p.collectionName.equals(normalized))
        .findFirst();
  }
}
