package org.a11yrag.retrieval_service.search.fusion;

import java.util.List;
import org.a11yrag.retrieval_service.authority.model.AuthorityBasis;
import org.a11yrag.retrieval_service.model.Partition;
import org.a11yrag.retrieval_service.model.SourceMetadata;
import org.a11yrag.retrieval_service.search.query.Provenance;

/**
 * One entry of the final ranking.
 *
 * @param rank 1-based position
 * @param documentId source document
 * @param chunkId chunk within the document
 * @param partition partition of the representative hit
 * @param score composite score
 * @param authorityLevel resolved authority level, 1..5
 * @param authorityBasis rule that produced the authority level
 * @param provenances provenances of all variants that retrieved the chunk, in priority order
 * @param metadata source metadata of the representative hit
 * @param breakdown score components
 */
public record RankedResult(
    int rank,
    String documentId,
    String chunkId,
    Partition partition,
    double score,
    int authorityLevel,
    AuthorityBasis authorityBasis,
    List<Provenance> provenances,
    SourceMetadata metadata,
    ScoreBreakdown breakdown) {

  public RankedResult {
    provenances = List.copyOf(provenances);
  }

  public double similarity() {
    return breakdown.similarity();
  }
}
