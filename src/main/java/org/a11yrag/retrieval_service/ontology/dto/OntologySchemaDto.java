package org.a11yrag.retrieval_service.ontology.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/** Top-level JSON document of an ontology schema. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OntologySchemaDto {
  private String version;
  private Map<String, ConceptDto> concepts = new LinkedHashMap<>();
}
