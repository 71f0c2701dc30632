package org.a11yrag.retrieval_service.search.query;

import org.a11yrag.retrieval_service.ontology.model.RelationKind;

/** How a query variant was derived from the user's query. Declared in priority order. */
public enum Provenance {
  ORIGINAL,
  SYNONYM,
  HYPONYM,
  RELATED;

  /** Lower value means the variant is kept first when variants are capped. */
  public int priority() {
    return ordinal();
  }

  /**
   * Maps the kind of the first ontology edge on an expansion path to a provenance tag. A null kind
   * denotes the input term itself.
   */
  public static Provenance fromRelation(RelationKind kind) {
    if (kind == null) {
      return ORIGINAL;
    }
    switch (kind) {
      case SYNONYM:
        return SYNONYM;
      case HYPONYM:
        return HYPONYM;
      default:
        return RELATED;
    }
  }
}
