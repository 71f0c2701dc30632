package org.a11yrag.retrieval_service.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.a11yrag.retrieval_service.config.OntologyConfig;
import org.a11yrag.retrieval_service.exceptions.InvalidRetrievalRequestException;
import org.a11yrag.retrieval_service.ontology.domain.DomainClassifier;
import org.a11yrag.retrieval_service.ontology.domain.DomainScore;
import org.a11yrag.retrieval_service.ontology.model.ExpansionTerm;
import org.a11yrag.retrieval_service.ontology.model.OntologyGraph;
import org.a11yrag.retrieval_service.ontology.model.OntologyStats;
import org.a11yrag.retrieval_service.ontology.model.RelationKind;
import org.a11yrag.retrieval_service.ontology.service.OntologyService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/ontology")
@Tag(name = "Ontology", description = "Diagnostics for the loaded ontology snapshot")
public class OntologyController {

  private final OntologyService ontologyService;
  private final OntologyConfig ontologyConfig;
  private final DomainClassifier domainClassifier;

  public OntologyController(
      OntologyService ontologyService,
      OntologyConfig ontologyConfig,
      DomainClassifier domainClassifier) {
    this.ontologyService = ontologyService;
    this.ontologyConfig = ontologyConfig;
    this.domainClassifier = domainClassifier;
  }

  @Operation(summary = "Expand a single term through the ontology")
  @GetMapping(value = "/expand", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<RestResponse<List<ExpansionTerm>>> expand(
      @Parameter(description = "Term to expand", example = "color contrast") @RequestParam
          String term,
      @Parameter(description = "Comma-separated edge kinds, all when omitted", example = "synonym")
          @RequestParam(required = false)
          List<String> kinds,
      @RequestParam(required = false) Integer maxDepth) {
    if (term == null || term.isBlank()) {
      throw new InvalidRetrievalRequestException("term", "Term must not be blank");
    }
    int depth = maxDepth != null ? maxDepth : ontologyConfig.getMaxDepth();
    if (depth < 0) {
      throw new InvalidRetrievalRequestException("maxDepth", "maxDepth must not be negative");
    }
    OntologyGraph graph = ontologyService.getCurrentGraph();
    List<ExpansionTerm> terms =
        graph.expandWithProvenance(term, parseKinds(kinds), depth, ontologyConfig.getMaxResults());
    return ResponseEntity.ok(
        RestResponse.success(terms.size() + " terms", new ArrayList<>(terms)));
  }

  @Operation(summary = "Counts and version of the loaded ontology")
  @GetMapping(value = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<RestResponse<OntologyStats>> stats() {
    OntologyStats stats = ontologyService.getCurrentGraph().stats();
    return ResponseEntity.ok(RestResponse.success("Ontology " + stats.version(), stats));
  }

  @Operation(summary = "Score a query against the accessibility and technology domains")
  @GetMapping(value = "/domains", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<RestResponse<List<DomainScore>>> domains(
      @Parameter(description = "Query text", example = "keyboard only users and focus indicators")
          @RequestParam
          String query) {
    if (query == null || query.isBlank()) {
      throw new InvalidRetrievalRequestException("query", "Query must not be blank");
    }
    List<DomainScore> scores = domainClassifier.classify(query);
    return ResponseEntity.ok(RestResponse.success(scores.size() + " domains", scores));
  }

  @Operation(summary = "Terms of a configured domain or of an ontology concept and its children")
  @GetMapping(value = "/domains/{domain}/terms", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<RestResponse<List<String>>> domainTerms(
      @Parameter(description = "Domain name or concept id", example = "motor") @PathVariable
          String domain) {
    List<String> terms = domainClassifier.domainTerms(domain);
    return ResponseEntity.ok(RestResponse.success(terms.size() + " terms", terms));
  }

  private static Set<RelationKind> parseKinds(List<String> kinds) {
    if (kinds == null || kinds.isEmpty()) {
      return EnumSet.allOf(RelationKind.class);
    }
    Set<RelationKind> parsed = EnumSet.noneOf(RelationKind.class);
    for (String kind : kinds) {
      if (kind.isBlank()) {
        continue;
      }
      if ("related".equalsIgnoreCase(kind.trim())) {
        parsed.addAll(RelationKind.RELATED);
        continue;
      }
      try {
        parsed.add(RelationKind.fromValue(kind));
      } catch (IllegalArgumentException e) {
        throw new InvalidRetrievalRequestException("kinds", "Unknown relation kind: " + kind);
      }
    }
    return parsed;
  }
}
