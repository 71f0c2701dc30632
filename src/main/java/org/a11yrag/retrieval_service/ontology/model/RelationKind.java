package org.a11yrag.retrieval_service.ontology.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Kinds of typed edges in the ontology graph.
 *
 * <p>{@link #HYPONYM} edges include the implicit parent-to-child (subconcept) links. The remaining
 * cross-domain kinds are grouped as "related" for expansion and tie-breaking.
 */
public enum RelationKind {
  SYNONYM(0),
  HYPONYM(1),
  IMPLEMENTS(2),
  REQUIRES(2),
  ADDRESSES(2),
  TESTED_BY(2);

  /** Cross-domain relation kinds, collectively called "related". */
  public static final Set<RelationKind> RELATED =
      EnumSet.of(IMPLEMENTS, REQUIRES, ADDRESSES, TESTED_BY);

  private final int priority;

  RelationKind(int priority) {
    this.priority = priority;
  }

  /** Traversal priority: lower is visited first (synonym, then hyponym, then related). */
  public int priority() {
    return priority;
  }

  public boolean isRelated() {
    return RELATED.contains(this);
  }

  /**
   * Parses a schema value such as {@code "tested_by"} or {@code "TESTED-BY"}.
   *
   * @throws IllegalArgumentException if the value is not a known relation kind
   */
  public static RelationKind fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Relation kind must not be null");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
  }
}
