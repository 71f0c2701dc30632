package org.a11yrag.retrieval_service.search.fusion;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.a11yrag.retrieval_service.authority.model.AuthorityRecord;
import org.a11yrag.retrieval_service.config.RetrievalConfig;
import org.a11yrag.retrieval_service.model.DocumentHit;
import org.a11yrag.retrieval_service.model.Partition;
import org.a11yrag.retrieval_service.model.SourceMetadata;
import org.a11yrag.retrieval_service.search.query.Provenance;
import org.springframework.stereotype.Component;

/**
 * Merges raw hits into the final ranking.
 *
 * <ol>
 *   <li>Hits with the same document and chunk id are merged: the highest-similarity hit is kept
 *       and the provenances of all of them are unioned.
 *   <li>Composite score = {@code w1*similarity + w2*authority/5 + w3*recency + w4*partitionWeight}.
 *   <li>Order: composite score, then similarity, then authority (all descending), then document
 *       id and chunk id ascending. Scores are compared at nine decimal places.
 *   <li>Diversity: no partition may supply more than {@code max(1, floor(cap * count))} results
 *       unless the other partitions cannot fill the count.
 * </ol>
 *
 * Pure function of its inputs and the clock's current date.
 */
@Slf4j
@Component
public class FusionRanker {

  private static final double UNKNOWN_DATE_RECENCY = 0.5;
  private static final double DAYS_PER_YEAR = 365.25;

  // Scores closer than 1e-9 compare equal so rounding noise never overrides the tie-breaks
  private static final double SCORE_SCALE = 1e9;

  private static final Comparator<Scored> RANK_ORDER =
      Comparator.comparingLong((Scored s) -> quantize(s.breakdown.composite()))
          .reversed()
          .thenComparing(
              Comparator.comparingLong((Scored s) -> quantize(s.breakdown.similarity())).reversed())
          .thenComparing(
              Comparator.comparingInt((Scored s) -> s.authority.level().value()).reversed())
          .thenComparing(s -> s.hit.documentId())
          .thenComparing(s -> s.hit.chunkId());

  private final RetrievalConfig retrievalConfig;
  private final Clock clock;

  public FusionRanker(RetrievalConfig retrievalConfig, Clock clock) {
    this.retrievalConfig = retrievalConfig;
    this.clock = clock;
  }

  /** Ranks with the configured result count. */
  public List<RankedResult> rank(
      List<DocumentHit> hits, Function<DocumentHit, AuthorityRecord> authorities) {
    return rank(hits, authorities, retrievalConfig.getResultCount());
  }

  /**
   * @param hits raw hits from all searches, in any order
   * @param authorities authority lookup, consulted once per distinct chunk
   * @param resultCount maximum number of results
   * @return at most {@code resultCount} results, best first
   */
  public List<RankedResult> rank(
      List<DocumentHit> hits,
      Function<DocumentHit, AuthorityRecord> authorities,
      int resultCount) {
    if (hits.isEmpty() || resultCount <= 0) {
      return List.of();
    }
    LocalDate today = LocalDate.now(clock);

    List<Scored> scored = new ArrayList<>();
    for (Merged merged : deduplicate(hits).values()) {
      AuthorityRecord authority = authorities.apply(merged.best);
      ScoreBreakdown breakdown = score(merged.best, authority, today);
      scored.add(new Scored(merged.best, merged.provenances, authority, breakdown));
    }
    scored.sort(RANK_ORDER);

    List<Scored> selected = diversify(scored, resultCount);
    List<RankedResult> results = new ArrayList<>(selected.size());
    for (int i = 0; i < selected.size(); i++) {
      results.add(selected.get(i).toResult(i + 1));
    }
    log.debug(
        "Fused {} hits into {} distinct chunks, returning {}",
        hits.size(),
        scored.size(),
        results.size());
    return results;
  }

  private static long quantize(double score) {
    return Math.round(score * SCORE_SCALE);
  }

  /** Recency factor of a source on the given date. */
  double recency(SourceMetadata metadata, LocalDate today) {
    if (metadata.documentType() == Partition.STANDARDS) {
      return metadata.superseded() ? 0.0 : 1.0;
    }
    LocalDate published = metadata.publicationDate();
    if (published == null) {
      return UNKNOWN_DATE_RECENCY;
    }
    if (published.isAfter(today)) {
      return 1.0;
    }
    double horizonDays = retrievalConfig.getRecencyHorizonYears() * DAYS_PER_YEAR;
    double ageDays = ChronoUnit.DAYS.between(published, today);
    return Math.max(0.0, 1.0 - ageDays / horizonDays);
  }

  private ScoreBreakdown score(DocumentHit hit, AuthorityRecord authority, LocalDate today) {
    RetrievalConfig.Weights weights = retrievalConfig.getWeights();
    double similarity = hit.similarity();
    double normalizedAuthority = authority.level().normalized();
    double recency = recency(hit.metadata(), today);
    double partitionWeight = hit.partitionWeight();
    double composite =
        weights.getSimilarity() * similarity
            + weights.getAuthority() * normalizedAuthority
            + weights.getRecency() * recency
            + weights.getPartition() * partitionWeight;
    return new ScoreBreakdown(similarity, normalizedAuthority, recency, partitionWeight, composite);
  }

  private static Map<String, Merged> deduplicate(List<DocumentHit> hits) {
    Map<String, Merged> merged = new LinkedHashMap<>();
    for (DocumentHit hit : hits) {
      Merged entry = merged.computeIfAbsent(hit.key(), k -> new Merged(hit));
      entry.provenances.add(hit.provenance());
      if (isBetterRepresentative(hit, entry.best)) {
        entry.best = hit;
      }
    }
    return merged;
  }

  /** Higher similarity wins; on equal similarity the higher partition weight, then partition. */
  private static boolean isBetterRepresentative(DocumentHit candidate, DocumentHit current) {
    int bySimilarity = Double.compare(candidate.similarity(), current.similarity());
    if (bySimilarity != 0) {
      return bySimilarity > 0;
    }
    int byWeight = Double.compare(candidate.partitionWeight(), current.partitionWeight());
    if (byWeight != 0) {
      return byWeight > 0;
    }
    return candidate.partition().compareTo(current.partition()) < 0;
  }

  private List<Scored> diversify(List<Scored> sorted, int resultCount) {
    int quota = Math.max(1, (int) Math.floor(retrievalConfig.getDiversityCap() * resultCount));
    Map<Partition, Integer> perPartition = new EnumMap<>(Partition.class);
    List<Scored> selected = new ArrayList<>();
    List<Scored> overflow = new ArrayList<>();

    for (Scored candidate : sorted) {
      if (selected.size() >= resultCount) {
        break;
      }
      Partition partition = candidate.hit.partition();
      int used = perPartition.getOrDefault(partition, 0);
      if (used < quota) {
        selected.add(candidate);
        perPartition.put(partition, used + 1);
      } else {
        overflow.add(candidate);
      }
    }

    if (selected.size() < resultCount && !overflow.isEmpty()) {
      int missing = resultCount - selected.size();
      log.debug("Diversity cap left {} slots open, backfilling from over-quota results", missing);
      selected.addAll(overflow.subList(0, Math.min(missing, overflow.size())));
      selected.sort(RANK_ORDER);
    }
    return selected;
  }

  private static final class Merged {
    private DocumentHit best;
    private final Set<Provenance> provenances = EnumSet.noneOf(Provenance.class);

    private Merged(DocumentHit first) {
      this.best = first;
    }
  }

  private static final class Scored {
    private final DocumentHit hit;
    private final Set<Provenance> provenances;
    private final AuthorityRecord authority;
    private final ScoreBreakdown breakdown;

    private Scored(
        DocumentHit hit,
        Set<Provenance> provenances,
        AuthorityRecord authority,
        ScoreBreakdown breakdown) {
      this.hit = hit;
      this.provenances = provenances;
      this.authority = authority;
      this.breakdown = breakdown;
    }

    private RankedResult toResult(int rank) {
      return new RankedResult(
          rank,
          hit.documentId(),
          hit.chunkId(),
          hit.partition(),
          breakdown.composite(),
          authority.level().value(),
          authority.basis(),
          new ArrayList<>(provenances),
          hit.metadata(),
          breakdown);
    }
  }
}
