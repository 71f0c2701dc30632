package org.a11yrag.retrieval_service.model;

import java.time.LocalDate;

/**
 * Read-only view of the source metadata attached to an indexed chunk. Owned by the index; the
 * pipeline only reads the fields it needs for scoring and explanation.
 *
 * @param authorId author or source identifier, may be null
 * @param affiliation free-text author affiliation, may be null
 * @param publicationDate publication date, null when unknown
 * @param documentType document type of the source
 * @param title document title, may be null
 * @param superseded true if a newer version replaces this document (standards only)
 */
public record SourceMetadata(
    String authorId,
    String affiliation,
    LocalDate publicationDate,
    Partition documentType,
    String title,
    boolean superseded) {

  public static SourceMetadata of(String authorId, LocalDate publicationDate, Partition type) {
    return new SourceMetadata(authorId, null, publicationDate, type, null, false);
  }
}
