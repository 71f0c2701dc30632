package org.a11yrag.retrieval_service.search.fusion;

/**
 * Components of a composite score, each in [0,1], before weighting.
 *
 * @param similarity maximum raw similarity over the deduplicated hits
 * @param authority authority level divided by 5
 * @param recency recency factor
 * @param partitionWeight prior weight of the partition the representative hit came from
 * @param composite weighted sum of the four components
 */
public record ScoreBreakdown(
    double similarity, double authority, double recency, double partitionWeight, double composite) {}
