package org.a11yrag.retrieval_service.ontology.loader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.a11yrag.retrieval_service.exceptions.OntologyConfigurationException;
import org.a11yrag.retrieval_service.ontology.mapper.OntologySchemaMapper;
import org.a11yrag.retrieval_service.ontology.model.OntologyGraph;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Reads an ontology schema from a Spring resource location ({@code classpath:}, {@code file:} or
 * plain path) and hands the JSON to the {@link OntologySchemaMapper}.
 *
 * <p>Resource access is kept apart from JSON mapping so each can be tested on its own.
 */
@Component
public class OntologySchemaLoader {

  private final Logger logger = LogManager.getLogger(OntologySchemaLoader.class.getName());

  private final OntologySchemaMapper schemaMapper;
  private final ResourceLoader resourceLoader;

  public OntologySchemaLoader(OntologySchemaMapper schemaMapper, ResourceLoader resourceLoader) {
    this.schemaMapper = schemaMapper;
    this.resourceLoader = resourceLoader;
  }

  /**
   * Loads and maps the schema at the given location.
   *
   * @param resourceLocation e.g. {@code classpath:ontology/accessibility-ontology.json}
   * @return the mapped, not yet validated, graph
   * @throws OntologyConfigurationException if the resource is missing, unreadable or malformed
   */
  public OntologyGraph loadFromResource(String resourceLocation) {
    logger.debug("Loading ontology schema from {}", resourceLocation);
    Resource resource = resourceLoader.getResource(resourceLocation);
    if (!resource.exists()) {
      throw new OntologyConfigurationException("Ontology schema not found: " + resourceLocation);
    }
    String json;
    try (InputStream is = resource.getInputStream()) {
      json = new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new OntologyConfigurationException(
          "Ontology schema unreadable: " + resourceLocation, e);
    }
    return schemaMapper.fromJson(json);
  }
}
