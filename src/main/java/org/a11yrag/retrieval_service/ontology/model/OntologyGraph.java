package org.a11yrag.retrieval_service.ontology.model;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable in-memory concept graph used for query expansion. Built via {@link Builder} from an
 * ontology schema, validated before it is published, and then shared by all requests without
 * locking.
 *
 * <p>Expansion is a breadth-first traversal from the concepts matching a term. Matching is
 * case-insensitive: exact match on id, label or synonym first, then substring match in both
 * directions between the term and labels or synonyms. Only edges of the requested kinds are followed, up to a hop limit and a result-size
 * limit. Edges leaving one concept are visited by kind priority (synonym, hyponym, related) and
 * then alphabetically by target label, so expansion output is deterministic.
 */
public final class OntologyGraph {

  public static final int DEFAULT_MAX_DEPTH = 2;
  public static final int DEFAULT_MAX_RESULTS = 25;

  /** Shorter terms are never substring-matched; they would hit most labels. */
  private static final int MIN_SUBSTRING_LENGTH = 3;

  private final String version;
  private final Map<String, Concept> concepts;
  private final LoadingCache<String, Integer> termFrequencies;

  private OntologyGraph(String version, Map<String, Concept> concepts) {
    this.version = version;
    this.concepts = Map.copyOf(concepts);
    this.termFrequencies =
        CacheBuilder.newBuilder()
            .maximumSize(10_000)
            .build(CacheLoader.from(this::countConceptsMentioning));
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getVersion() {
    return version;
  }

  public Map<String, Concept> getConcepts() {
    return concepts;
  }

  public int getConceptCount() {
    return concepts.size();
  }

  public Optional<Concept> getConcept(String id) {
    return Optional.ofNullable(id == null ? null : concepts.get(id));
  }

  /**
   * Expands a term with the default result-size bound.
   *
   * @see #expand(String, Set, int, int)
   */
  public Set<String> expand(String term, Set<RelationKind> kinds, int maxDepth) {
    return expand(term, kinds, maxDepth, DEFAULT_MAX_RESULTS);
  }

  /**
   * Returns the term together with the related terms reachable through edges of the given kinds.
   * The term itself is always the first element. Unknown terms yield the singleton {@code {term}}.
   *
   * @param term free-text term, not null
   * @param kinds edge kinds to follow
   * @param maxDepth maximum number of hops from a matched concept
   * @param maxResults maximum size of the returned set, including the term itself
   * @return ordered, case-insensitively deduplicated set of terms
   */
  public Set<String> expand(String term, Set<RelationKind> kinds, int maxDepth, int maxResults) {
    return expandWithProvenance(term, kinds, maxDepth, maxResults).stream()
        .map(ExpansionTerm::term)
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  /**
   * Same traversal as {@link #expand(String, Set, int, int)}, keeping the concept, path kind and
   * depth of every produced term.
   */
  public List<ExpansionTerm> expandWithProvenance(
      String term, Set<RelationKind> kinds, int maxDepth, int maxResults) {
    String trimmed = term == null ? "" : term.trim();
    Map<String, ExpansionTerm> results = new LinkedHashMap<>();
    results.put(normalize(trimmed), new ExpansionTerm(trimmed, null, null, 0));

    List<Concept> seeds = findConcepts(trimmed);
    if (seeds.isEmpty() || maxResults <= 1) {
      return List.copyOf(results.values());
    }

    Set<String> visited = new HashSet<>();
    Deque<Visit> queue = new ArrayDeque<>();
    for (Concept seed : seeds) {
      if (visited.add(seed.getId())) {
        queue.add(new Visit(seed, 0, RelationKind.SYNONYM));
      }
    }

    while (!queue.isEmpty() && results.size() < maxResults) {
      Visit visit = queue.poll();
      Concept concept = visit.concept;

      add(results, maxResults, concept.getLabel(), concept.getId(), visit.via, visit.depth);
      if (kinds.contains(RelationKind.SYNONYM)) {
        for (String synonym : concept.getSynonyms()) {
          add(results, maxResults, synonym, concept.getId(), visit.via, visit.depth);
        }
      }

      if (visit.depth >= maxDepth) {
        continue;
      }
      for (Edge edge : outgoingEdges(concept, kinds)) {
        if (visited.add(edge.target.getId())) {
          RelationKind via = visit.depth == 0 ? edge.kind : visit.via;
          queue.add(new Visit(edge.target, visit.depth + 1, via));
        }
      }
    }
    return List.copyOf(results.values());
  }

  /**
   * Finds the concepts a free-text term refers to: exact (case-insensitive) matches on id, label or
   * synonym if there are any. Otherwise concepts whose label or a synonym contains the term, and
   * concepts whose label or a synonym occurs as whole words inside it (plural forms included).
   * Results are ordered by label for determinism.
   */
  public List<Concept> findConcepts(String term) {
    if (term == null || term.isBlank()) {
      return List.of();
    }
    String lower = normalize(term);
    List<Concept> exact =
        concepts.values().stream().filter(c -> c.matchesExactly(lower)).sorted(BY_LABEL).toList();
    if (!exact.isEmpty() || lower.length() < MIN_SUBSTRING_LENGTH) {
      return exact;
    }
    return concepts.values().stream()
        .filter(c -> c.containsText(lower) || c.occursIn(lower, MIN_SUBSTRING_LENGTH))
        .sorted(BY_LABEL)
        .toList();
  }

  /**
   * Number of concepts whose label, synonyms or definition mention the term. Lower values mean a
   * more specific term.
   */
  public int termFrequency(String term) {
    if (term == null || term.isBlank()) {
      return 0;
    }
    return termFrequencies.getUnchecked(normalize(term));
  }

  /** Counts of concepts and edges in this snapshot. */
  public OntologyStats stats() {
    Map<RelationKind, Integer> relationCounts = new EnumMap<>(RelationKind.class);
    int synonymCount = 0;
    int hierarchyEdges = 0;
    for (Concept concept : concepts.values()) {
      synonymCount += concept.getSynonyms().size();
      hierarchyEdges += concept.getChildIds().size();
      for (ConceptRelation relation : concept.getRelations()) {
        relationCounts.merge(relation.kind(), 1, Integer::sum);
      }
    }
    return new OntologyStats(
        version, concepts.size(), synonymCount, hierarchyEdges, Map.copyOf(relationCounts));
  }

  /** Concepts referenced by id from the given collection that are missing in this graph. */
  public Set<String> missingIds(Collection<String> ids) {
    return ids.stream()
        .filter(id -> !concepts.containsKey(id))
        .collect(Collectors.toCollection(TreeSet::new));
  }

  private int countConceptsMentioning(String lowerTerm) {
    return (int) concepts.values().stream().filter(c -> c.mentions(lowerTerm)).count();
  }

  private List<Edge> outgoingEdges(Concept concept, Set<RelationKind> kinds) {
    List<Edge> edges = new ArrayList<>();
    if (kinds.contains(RelationKind.HYPONYM)) {
      for (String childId : concept.getChildIds()) {
        Concept child = concepts.get(childId);
        if (child != null) {
          edges.add(new Edge(RelationKind.HYPONYM, child));
        }
      }
    }
    for (ConceptRelation relation : concept.getRelations()) {
      Concept target = concepts.get(relation.targetId());
      if (target != null && kinds.contains(relation.kind())) {
        edges.add(new Edge(relation.kind(), target));
      }
    }
    edges.sort(EDGE_ORDER);
    return edges;
  }

  private static void add(
      Map<String, ExpansionTerm> results,
      int maxResults,
      String term,
      String conceptId,
      RelationKind via,
      int depth) {
    if (results.size() >= maxResults || term == null || term.isBlank()) {
      return;
    }
    results.putIfAbsent(normalize(term), new ExpansionTerm(term, conceptId, via, depth));
  }

  private static String normalize(String text) {
    return text.trim().toLowerCase(Locale.ROOT);
  }

  private static final Comparator<Concept> BY_LABEL =
      Comparator.comparing((Concept c) -> c.getLabel().toLowerCase(Locale.ROOT))
          .thenComparing(Concept::getId);

  private static final Comparator<Edge> EDGE_ORDER =
      Comparator.comparingInt((Edge e) -> e.kind.priority())
          .thenComparing(e -> e.target, BY_LABEL);

  private record Edge(RelationKind kind, Concept target) {}

  private record Visit(Concept concept, int depth, RelationKind via) {}

  /**
   * Incremental builder used while mapping a schema. Parent/child declarations are recorded in both
   * directions at {@link #build()} time. References to unknown concepts are kept so the validator
   * can report them.
   */
  public static class Builder {
    private final Map<String, Draft> drafts = new LinkedHashMap<>();
    private String version = "unknown";

    public Builder version(String version) {
      if (version != null && !version.isBlank()) {
        this.version = version;
      }
      return this;
    }

    public Builder addConcept(String id, String label, String definition) {
      Draft draft = drafts.computeIfAbsent(id, Draft::new);
      draft.label = label;
      draft.definition = definition;
      return this;
    }

    public Builder addSynonym(String conceptId, String synonym) {
      if (synonym != null && !synonym.isBlank()) {
        draft(conceptId).synonyms.add(synonym.trim());
      }
      return this;
    }

    /** Declares {@code childId} as a subconcept of {@code parentId}. */
    public Builder addParent(String childId, String parentId) {
      draft(childId).parents.add(parentId);
      return this;
    }

    /** Declares {@code childId} as a subconcept of {@code parentId}, from the parent's side. */
    public Builder addChild(String parentId, String childId) {
      draft(parentId).children.add(childId);
      return this;
    }

    public Builder addRelation(String sourceId, RelationKind kind, String targetId) {
      draft(sourceId).relations.add(new ConceptRelation(kind, targetId));
      return this;
    }

    public boolean contains(String id) {
      return drafts.containsKey(id);
    }

    public OntologyGraph build() {
      if (drafts.isEmpty()) {
        throw new IllegalStateException("Cannot build empty ontology graph");
      }
      for (Draft draft : drafts.values()) {
        for (String parentId : draft.parents) {
          Draft parent = drafts.get(parentId);
          if (parent != null) {
            parent.children.add(draft.id);
          }
        }
        for (String childId : draft.children) {
          Draft child = drafts.get(childId);
          if (child != null) {
            child.parents.add(draft.id);
          }
        }
      }
      Map<String, Concept> concepts = new LinkedHashMap<>();
      for (Draft draft : drafts.values()) {
        concepts.put(draft.id, draft.toConcept());
      }
      return new OntologyGraph(version, concepts);
    }

    private Draft draft(String id) {
      Draft draft = drafts.get(id);
      if (draft == null) {
        throw new IllegalArgumentException("Unknown concept id: " + id);
      }
      return draft;
    }

    private static final class Draft {
      private final String id;
      private String label;
      private String definition;
      private final Set<String> parents = new TreeSet<>();
      private final Set<String> children = new TreeSet<>();
      private final Set<String> synonyms = new TreeSet<>();
      private final List<ConceptRelation> relations = new ArrayList<>();

      private Draft(String id) {
        this.id = id;
      }

      private Concept toConcept() {
        return new Concept(id, label, definition, parents, children, synonyms, relations);
      }
    }
  }
}
