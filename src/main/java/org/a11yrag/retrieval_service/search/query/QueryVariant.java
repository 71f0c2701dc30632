package org.a11yrag.retrieval_service.search.query;

/**
 * One search string sent to the partitions.
 *
 * @param text the variant text
 * @param provenance how the variant was derived
 * @param expansionTerm ontology term substituted or appended, null for the original query
 * @param termFrequency number of ontology concepts mentioning the expansion term (lower means
 *     more specific), 0 for the original query
 */
public record QueryVariant(
    String text, Provenance provenance, String expansionTerm, int termFrequency) {

  public static QueryVariant original(String text) {
    return new QueryVariant(text, Provenance.ORIGINAL, null, 0);
  }
}
