package org.a11yrag.retrieval_service.ontology.model;

import java.util.Objects;

/** Directed, typed edge from one concept to another. */
public record ConceptRelation(RelationKind kind, String targetId) {

  public ConceptRelation {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(targetId, "targetId must not be null");
  }
}
