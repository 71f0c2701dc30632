package org.a11yrag.retrieval_service.ontology.domain;

import java.util.List;

/**
 * How strongly a query belongs to one domain.
 *
 * @param domain domain name, e.g. {@code visual} or {@code aria}
 * @param category accessibility or technology domain
 * @param score share of the domain's terms found in the query, in (0,1]
 * @param matchedTerms domain terms found in the query, in configured order
 */
public record DomainScore(
    String domain, DomainCategory category, double score, List<String> matchedTerms) {

  public DomainScore {
    matchedTerms = List.copyOf(matchedTerms);
  }
}
