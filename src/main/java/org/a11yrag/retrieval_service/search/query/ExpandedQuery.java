package org.a11yrag.retrieval_service.search.query;

import java.util.List;
import java.util.Objects;
import org.a11yrag.retrieval_service.search.intent.Intent;

/**
 * The query with its intent, the candidate terms found in it, the merged ontology expansion and
 * the bounded list of variants to search. The original query is always the first variant.
 */
public record ExpandedQuery(
    RetrievalQuery query,
    Intent intent,
    List<String> candidateTerms,
    List<String> expandedTerms,
    List<QueryVariant> variants) {

  public ExpandedQuery {
    Objects.requireNonNull(query, "query must not be null");
    Objects.requireNonNull(intent, "intent must not be null");
    candidateTerms = List.copyOf(candidateTerms);
    expandedTerms = List.copyOf(expandedTerms);
    variants = List.copyOf(variants);
    if (variants.isEmpty() || variants.get(0).provenance() != Provenance.ORIGINAL) {
      throw new IllegalArgumentException("The original query must be the first variant");
    }
  }

  /** Query with no expansion at all: only the original text is searched. */
  public static ExpandedQuery unexpanded(RetrievalQuery query, Intent intent) {
    return new ExpandedQuery(
        query, intent, List.of(), List.of(), List.of(QueryVariant.original(query.text())));
  }
}
