package org.a11yrag.retrieval_service.ontology.service;

import org.a11yrag.retrieval_service.ontology.model.OntologyGraph;

/** Checks structural invariants of a freshly built graph before it may be served. */
public interface OntologyValidator {

  /**
   * @param graph graph to check
   * @throws org.a11yrag.retrieval_service.exceptions.OntologyConfigurationException if the graph
   *     must not be served
   */
  void validate(OntologyGraph graph);
}
