package org.a11yrag.retrieval_service.model;

import java.util.Objects;
import org.a11yrag.retrieval_service.search.query.Provenance;

/**
 * One raw hit from a single (variant, partition) search.
 *
 * @param documentId source document identifier
 * @param chunkId chunk identifier within the document
 * @param similarity raw similarity score in [0,1]
 * @param partition partition the hit was retrieved from
 * @param partitionWeight prior weight of that partition for the current request
 * @param provenance provenance of the query variant that retrieved the hit
 * @param metadata source metadata, never null
 */
public record DocumentHit(
    String documentId,
    String chunkId,
    double similarity,
    Partition partition,
    double partitionWeight,
    Provenance provenance,
    SourceMetadata metadata) {

  public DocumentHit {
    Objects.requireNonNull(documentId, "documentId must not be null");
    Objects.requireNonNull(chunkId, "chunkId must not be null");
    Objects.requireNonNull(partition, "partition must not be null");
    Objects.requireNonNull(provenance, "provenance must not be null");
    Objects.requireNonNull(metadata, "metadata must not be null");
    similarity = Math.max(0.0, Math.min(1.0, similarity));
  }

  /** Identity of the underlying chunk, used for deduplication across variants and partitions. */
  public String key() {
    return documentId + "#" + chunkId;
  }
}
