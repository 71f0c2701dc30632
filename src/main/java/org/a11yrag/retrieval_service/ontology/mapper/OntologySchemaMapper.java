package org.a11yrag.retrieval_service.ontology.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.a11yrag.retrieval_service.exceptions.OntologyConfigurationException;
import org.a11yrag.retrieval_service.ontology.dto.ConceptDto;
import org.a11yrag.retrieval_service.ontology.dto.OntologySchemaDto;
import org.a11yrag.retrieval_service.ontology.dto.RelationDto;
import org.a11yrag.retrieval_service.ontology.model.OntologyGraph;
import org.a11yrag.retrieval_service.ontology.model.RelationKind;
import org.springframework.stereotype.Component;

/**
 * Maps the JSON ontology schema into an {@link OntologyGraph}.
 *
 * <p>The mapper only translates structure. Referential integrity and hierarchy acyclicity are
 * checked afterwards by {@link
 * org.a11yrag.retrieval_service.ontology.service.OntologyValidator}.
 *
 * <pre>{@code
 * {
 *   "version": "2024-05",
 *   "concepts": {
 *     "color_contrast": {
 *       "label": "color contrast",
 *       "parents": ["visual"],
 *       "synonyms": ["contrast ratio"],
 *       "relations": [{"kind": "tested_by", "target": "contrast_checker"}]
 *     }
 *   }
 * }
 * }</pre>
 */
@Slf4j
@Component
public class OntologySchemaMapper {

  private final ObjectMapper objectMapper;

  public OntologySchemaMapper() {
    objectMapper =
        new ObjectMapper().configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, false);
  }

  /**
   * Parses the schema JSON and builds the (not yet validated) graph.
   *
   * @param json schema document
   * @return graph built from the schema
   * @throws OntologyConfigurationException if the JSON is empty, unparsable, has no concepts or
   *     uses an unknown relation kind
   */
  public OntologyGraph fromJson(String json) {
    if (json == null || json.isBlank()) {
      throw new OntologyConfigurationException("Null or empty ontology schema provided.");
    }

    OntologySchemaDto schema;
    try {
      schema = objectMapper.readValue(json, OntologySchemaDto.class);
    } catch (JsonProcessingException e) {
      log.error("Failed to parse ontology schema: {}", e.getOriginalMessage());
      throw new OntologyConfigurationException("Failed to parse ontology schema JSON.", e);
    }
    return toGraph(schema);
  }

  /** Builds the graph from an already parsed schema. */
  public OntologyGraph toGraph(OntologySchemaDto schema) {
    if (schema == null || schema.getConcepts() == null || schema.getConcepts().isEmpty()) {
      throw new OntologyConfigurationException("Ontology schema defines no concepts.");
    }

    OntologyGraph.Builder builder = OntologyGraph.builder().version(schema.getVersion());
    Map<String, ConceptDto> concepts = schema.getConcepts();

    // Nodes first so that edges can refer to any of them
    concepts.forEach((id, dto) -> builder.addConcept(id, dto.getLabel(), dto.getDefinition()));

    concepts.forEach(
        (id, dto) -> {
          nullSafe(dto.getSynonyms()).forEach(synonym -> builder.addSynonym(id, synonym));
          nullSafe(dto.getParents()).forEach(parentId -> builder.addParent(id, parentId));
          nullSafe(dto.getChildren()).forEach(childId -> builder.addChild(id, childId));
          for (RelationDto relation : nullSafe(dto.getRelations())) {
            builder.addRelation(id, parseKind(id, relation), relation.getTarget());
          }
        });

    return builder.build();
  }

  private RelationKind parseKind(String conceptId, RelationDto relation) {
    if (relation.getTarget() == null || relation.getTarget().isBlank()) {
      throw new OntologyConfigurationException(
          "Relation without target in concept '" + conceptId + "'");
    }
    try {
      return RelationKind.fromValue(relation.getKind());
    } catch (IllegalArgumentException e) {
      throw new OntologyConfigurationException(
          "Unknown relation kind '" + relation.getKind() + "' in concept '" + conceptId + "'", e);
    }
  }

  private static <T> List<T> nullSafe(List<T> list) {
    return list == null ? List.of() : list;
  }
}
