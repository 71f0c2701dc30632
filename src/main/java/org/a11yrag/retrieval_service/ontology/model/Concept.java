package org.a11yrag.retrieval_service.ontology.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Node of the ontology graph. Immutable once the owning {@link OntologyGraph} is built.
 *
 * <p>Parent and child ids describe the subconcept hierarchy, which must be acyclic. Synonyms are
 * alternative surface forms of the same concept. Typed relations point at other concepts and may
 * form cycles.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString(onlyExplicitlyIncluded = true)
public final class Concept {

  @EqualsAndHashCode.Include @ToString.Include private final String id;

  @ToString.Include private final String label;

  private final String definition;
  private final SortedSet<String> parentIds;
  private final SortedSet<String> childIds;
  private final SortedSet<String> synonyms;
  private final List<ConceptRelation> relations;

  @Getter(AccessLevel.NONE)
  private final List<Pattern> surfacePatterns;

  public Concept(
      String id,
      String label,
      String definition,
      Set<String> parentIds,
      Set<String> childIds,
      Set<String> synonyms,
      List<ConceptRelation> relations) {
    this.id = Objects.requireNonNull(id, "ID must not be null");
    this.label = label == null || label.isBlank() ? id : label;
    this.definition = definition == null ? "" : definition;
    this.parentIds = Collections.unmodifiableSortedSet(new TreeSet<>(parentIds));
    this.childIds = Collections.unmodifiableSortedSet(new TreeSet<>(childIds));
    this.synonyms = Collections.unmodifiableSortedSet(new TreeSet<>(synonyms));
    this.relations = List.copyOf(relations);
    List<Pattern> patterns = new ArrayList<>();
    patterns.add(TermPatterns.wordBounded(this.label));
    for (String synonym : this.synonyms) {
      patterns.add(TermPatterns.wordBounded(synonym));
    }
    this.surfacePatterns = List.copyOf(patterns);
  }

  /** True if this concept has subconcepts. */
  public boolean hasChildren() {
    return !childIds.isEmpty();
  }

  /**
   * True if the given lowercase text equals the id, label or one of the synonyms of this concept.
   */
  boolean matchesExactly(String lowerText) {
    if (id.equalsIgnoreCase(lowerText) || label.equalsIgnoreCase(lowerText)) {
      return true;
    }
    return synonyms.stream().anyMatch(s -> s.equalsIgnoreCase(lowerText));
  }

  /** True if the given lowercase text occurs inside the label or one of the synonyms. */
  boolean containsText(String lowerText) {
    if (label.toLowerCase(Locale.ROOT).contains(lowerText)) {
      return true;
    }
    return synonyms.stream().anyMatch(s -> s.toLowerCase(Locale.ROOT).contains(lowerText));
  }

  /**
   * True if the label or a synonym of at least {@code minLength} characters occurs as whole words,
   * singular or plural, inside the given lowercase text ("screen readers" mentions "screen
   * reader").
   */
  boolean occursIn(String lowerText, int minLength) {
    if (label.length() >= minLength && surfacePatterns.get(0).matcher(lowerText).find()) {
      return true;
    }
    int i = 1;
    for (String synonym : synonyms) {
      if (synonym.length() >= minLength && surfacePatterns.get(i).matcher(lowerText).find()) {
        return true;
      }
      i++;
    }
    return false;
  }

  /** True if the label, a synonym or the definition mentions the given lowercase text. */
  boolean mentions(String lowerText) {
    return containsText(lowerText) || definition.toLowerCase(Locale.ROOT).contains(lowerText);
  }
}
