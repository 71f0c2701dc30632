package org.a11yrag.retrieval_service.ontology.model;

/**
 * One term produced by an ontology expansion.
 *
 * @param term surface form (label or synonym) as authored in the ontology
 * @param conceptId concept the term belongs to, null for the unmatched input term itself
 * @param via kind of the first edge on the path from the matched concept, {@link
 *     RelationKind#SYNONYM} for alternative forms of the matched concept itself, null for the
 *     input term
 * @param depth number of hops from the matched concept
 */
public record ExpansionTerm(String term, String conceptId, RelationKind via, int depth) {

  /** True for the input term echoed back unchanged. */
  public boolean isInputTerm() {
    return via == null;
  }
}
