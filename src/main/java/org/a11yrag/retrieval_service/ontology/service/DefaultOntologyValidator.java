package org.a11yrag.retrieval_service.ontology.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.a11yrag.retrieval_service.exceptions.OntologyConfigurationException;
import org.a11yrag.retrieval_service.ontology.model.Concept;
import org.a11yrag.retrieval_service.ontology.model.ConceptRelation;
import org.a11yrag.retrieval_service.ontology.model.OntologyGraph;
import org.springframework.stereotype.Component;

/**
 * Default validation rules:
 *
 * <ul>
 *   <li>every parent, child and relation target refers to an existing concept
 *   <li>the parent/child hierarchy is acyclic
 * </ul>
 *
 * Synonym and typed-relation edges may form cycles and are not checked for them.
 */
@Slf4j
@Component
public class DefaultOntologyValidator implements OntologyValidator {

  @Override
  public void validate(OntologyGraph graph) {
    if (graph == null || graph.getConceptCount() == 0) {
      throw new OntologyConfigurationException("Ontology graph is empty");
    }
    checkReferences(graph);
    checkHierarchyAcyclic(graph);
    log.debug("Ontology {} validated: {} concepts", graph.getVersion(), graph.getConceptCount());
  }

  private void checkReferences(OntologyGraph graph) {
    Map<String, Concept> concepts = new TreeMap<>(graph.getConcepts());
    for (Concept concept : concepts.values()) {
      reportMissing(graph, concept, "parent", concept.getParentIds());
      reportMissing(graph, concept, "child", concept.getChildIds());
      List<String> targets = new ArrayList<>();
      for (ConceptRelation relation : concept.getRelations()) {
        targets.add(relation.targetId());
      }
      reportMissing(graph, concept, "relation target", targets);
    }
  }

  private void reportMissing(
      OntologyGraph graph, Concept concept, String role, Collection<String> ids) {
    Set<String> missing = graph.missingIds(ids);
    if (!missing.isEmpty()) {
      throw new OntologyConfigurationException(
          "Concept '" + concept.getId() + "' references unknown " + role + " id(s) " + missing);
    }
  }

  /** Depth-first search over child edges with a visiting set; a back edge closes a cycle. */
  private void checkHierarchyAcyclic(OntologyGraph graph) {
    Map<String, Concept> concepts = new TreeMap<>(graph.getConcepts());
    Set<String> done = new HashSet<>();
    for (String id : concepts.keySet()) {
      if (!done.contains(id)) {
        visit(id, concepts, new LinkedHashSet<>(), done);
      }
    }
  }

  private void visit(
      String id, Map<String, Concept> concepts, LinkedHashSet<String> visiting, Set<String> done) {
    visiting.add(id);
    for (String childId : concepts.get(id).getChildIds()) {
      if (visiting.contains(childId)) {
        throw new OntologyConfigurationException(
            "Cycle in concept hierarchy: " + cyclePath(visiting, childId));
      }
      if (!done.contains(childId)) {
        visit(childId, concepts, visiting, done);
      }
    }
    visiting.remove(id);
    done.add(id);
  }

  private static String cyclePath(LinkedHashSet<String> visiting, String repeated) {
    List<String> path = new ArrayList<>();
    boolean inCycle = false;
    for (String id : visiting) {
      inCycle |= id.equals(repeated);
      if (inCycle) {
        path.add(id);
      }
    }
    path.add(repeated);
    return String.join(" -> ", path);
  }
}
