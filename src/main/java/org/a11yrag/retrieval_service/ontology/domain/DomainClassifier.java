package org.a11yrag.retrieval_service.ontology.domain;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.a11yrag.retrieval_service.config.DomainConfig;
import org.a11yrag.retrieval_service.ontology.model.Concept;
import org.a11yrag.retrieval_service.ontology.model.OntologyGraph;
import org.a11yrag.retrieval_service.ontology.model.TermPatterns;
import org.a11yrag.retrieval_service.ontology.service.OntologyService;
import org.springframework.stereotype.Component;

/**
 * Scores a query against the configured accessibility and technology domains. A domain's score is
 * the share of its terms that occur in the query as whole words, singular or plural; domains with
 * no matching term are left out.
 *
 * <p>Results are ordered by score descending, then accessibility before technology, then domain
 * name.
 */
@Slf4j
@Component
public class DomainClassifier {

  private static final Comparator<DomainScore> SCORE_ORDER =
      Comparator.comparingDouble(DomainScore::score)
          .reversed()
          .thenComparing(DomainScore::category)
          .thenComparing(DomainScore::domain);

  private final List<Domain> domains;
  private final OntologyService ontologyService;

  public DomainClassifier(DomainConfig domainConfig, OntologyService ontologyService) {
    this.ontologyService = ontologyService;
    List<Domain> list = new ArrayList<>();
    addDomains(list, DomainCategory.ACCESSIBILITY, domainConfig.getAccessibility());
    addDomains(list, DomainCategory.TECHNOLOGY, domainConfig.getTechnology());
    this.domains = List.copyOf(list);
    log.debug("Domain classifier configured with {} domains", domains.size());
  }

  private static void addDomains(
      List<Domain> target, DomainCategory category, Map<String, List<String>> configured) {
    for (Map.Entry<String, List<String>> entry : configured.entrySet()) {
      List<String> terms =
          entry.getValue().stream()
              .map(term -> term.trim().replace('_', ' ').toLowerCase(Locale.ROOT))
              .filter(term -> !term.isEmpty())
              .distinct()
              .toList();
      if (terms.isEmpty()) {
        throw new IllegalStateException(
            "ontology.domains." + category.name().toLowerCase(Locale.ROOT) + "." + entry.getKey()
                + " must list at least one term");
      }
      String name = entry.getKey().trim().toLowerCase(Locale.ROOT);
      target.add(
          new Domain(
              name, category, terms, terms.stream().map(TermPatterns::wordBounded).toList()));
    }
  }

  /**
   * @param query free text
   * @return matching domains, best first; empty for blank text or when nothing matches
   */
  public List<DomainScore> classify(String query) {
    if (query == null || query.isBlank()) {
      return List.of();
    }
    String lower = query.toLowerCase(Locale.ROOT);
    List<DomainScore> scores = new ArrayList<>();
    for (Domain domain : domains) {
      List<String> matched = new ArrayList<>();
      for (int i = 0; i < domain.terms.size(); i++) {
        if (domain.patterns.get(i).matcher(lower).find()) {
          matched.add(domain.terms.get(i));
        }
      }
      if (!matched.isEmpty()) {
        double score = (double) matched.size() / domain.terms.size();
        scores.add(new DomainScore(domain.name, domain.category, score, matched));
      }
    }
    scores.sort(SCORE_ORDER);
    return scores;
  }

  /**
   * Terms of a domain. Configured domains return their configured terms. Any other name is looked
   * up in the ontology: the concept with that id and its direct children contribute their labels
   * and synonyms, sorted.
   *
   * @return the terms, empty if the name is neither configured nor an ontology concept
   */
  public List<String> domainTerms(String domain) {
    if (domain == null || domain.isBlank()) {
      return List.of();
    }
    String name = domain.trim().toLowerCase(Locale.ROOT);
    Optional<Domain> configured = domains.stream().filter(d -> d.name.equals(name)).findFirst();
    if (configured.isPresent()) {
      return configured.get().terms;
    }
    if (!ontologyService.isLoaded()) {
      return List.of();
    }
    OntologyGraph graph = ontologyService.getCurrentGraph();
    Optional<Concept> root = graph.getConcept(name);
    if (root.isEmpty()) {
      return List.of();
    }
    TreeSet<String> terms = new TreeSet<>();
    addSurfaceForms(terms, root.get());
    for (String childId : root.get().getChildIds()) {
      graph.getConcept(childId).ifPresent(child -> addSurfaceForms(terms, child));
    }
    return List.copyOf(terms);
  }

  private static void addSurfaceForms(TreeSet<String> terms, Concept concept) {
    terms.add(concept.getLabel().toLowerCase(Locale.ROOT));
    for (String synonym : concept.getSynonyms()) {
      terms.add(synonym.toLowerCase(Locale.ROOT));
    }
  }

  private record Domain(
      String name, DomainCategory category, List<String> terms, List<Pattern> patterns) {}
}
