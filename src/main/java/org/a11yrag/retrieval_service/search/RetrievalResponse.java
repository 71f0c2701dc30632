package org.a11yrag.retrieval_service.search;

import java.util.List;
import org.a11yrag.retrieval_service.ontology.domain.DomainScore;
import org.a11yrag.retrieval_service.search.fanout.FanoutStats;
import org.a11yrag.retrieval_service.search.fusion.RankedResult;
import org.a11yrag.retrieval_service.search.intent.Intent;
import org.a11yrag.retrieval_service.search.query.QueryVariant;
import org.a11yrag.retrieval_service.search.routing.PartitionRoute;

/**
 * Ranked results of one request together with how they were obtained.
 *
 * @param query the query text
 * @param intent intent that drove expansion and routing
 * @param intentOverridden true if the caller supplied the intent
 * @param domains accessibility and technology domains the query touches, best first
 * @param expandedTerms ontology terms added to the query
 * @param variants searched variants, original first
 * @param routes searched partitions with their weights
 * @param results ranked results, best first
 * @param degraded true if some searches failed or timed out
 * @param fanout search counts by outcome
 * @param tookMs wall-clock time of the request
 */
public record RetrievalResponse(
    String query,
    Intent intent,
    boolean intentOverridden,
    List<DomainScore> domains,
    List<String> expandedTerms,
    List<QueryVariant> variants,
    List<PartitionRoute> routes,
    List<RankedResult> results,
    boolean degraded,
    FanoutStats fanout,
    long tookMs) {}
