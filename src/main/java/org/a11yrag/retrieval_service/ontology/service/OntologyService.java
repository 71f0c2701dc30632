package org.a11yrag.retrieval_service.ontology.service;

import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.a11yrag.retrieval_service.config.OntologyConfig;
import org.a11yrag.retrieval_service.ontology.loader.OntologySchemaLoader;
import org.a11yrag.retrieval_service.ontology.model.OntologyGraph;
import org.springframework.stereotype.Service;

/**
 * Owns the ontology snapshot served to requests.
 *
 * <p>A (re)load builds and validates a complete new graph and only then swaps the reference, so
 * in-flight requests keep reading the graph they started with. A failed reload leaves the current
 * snapshot in place.
 */
@Slf4j
@Service
public class OntologyService {

  private final OntologySchemaLoader loader;
  private final OntologyValidator validator;
  private final OntologyConfig ontologyConfig;

  private final AtomicReference<OntologyGraph> current = new AtomicReference<>();

  public OntologyService(
      OntologySchemaLoader loader, OntologyValidator validator, OntologyConfig ontologyConfig) {
    this.loader = loader;
    this.validator = validator;
    this.ontologyConfig = ontologyConfig;
  }

  /**
   * Loads the schema from the configured location, validates it and publishes it.
   *
   * @return the new snapshot
   * @throws org.a11yrag.retrieval_service.exceptions.OntologyConfigurationException if the schema
   *     is unreadable, malformed or structurally invalid
   */
  public OntologyGraph loadOntology() {
    return loadOntology(ontologyConfig.getSchemaLocation());
  }

  public synchronized OntologyGraph loadOntology(String location) {
    long start = System.currentTimeMillis();
    OntologyGraph graph = loader.loadFromResource(location);
    validator.validate(graph);

    OntologyGraph previous = current.getAndSet(graph);
    log.info(
        "Ontology {} loaded from {}: {} concepts in {} ms{}",
        graph.getVersion(),
        location,
        graph.getConceptCount(),
        System.currentTimeMillis() - start,
        previous == null ? "" : " (replaced " + previous.getVersion() + ")");
    return graph;
  }

  /**
   * @return the snapshot currently being served
   * @throws IllegalStateException if no ontology has been loaded yet
   */
  public OntologyGraph getCurrentGraph() {
    OntologyGraph graph = current.get();
    if (graph == null) {
      throw new IllegalStateException("Ontology not initialized - call loadOntology() first");
    }
    return graph;
  }

  public boolean isLoaded() {
    return current.get() != null;
  }
}
