package org.a11yrag.retrieval_service.ontology.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConceptDto {
  private String label;
  private String definition;
  private List<String> parents = new ArrayList<>();
  private List<String> children = new ArrayList<>();
  private List<String> synonyms = new ArrayList<>();
  private List<RelationDto> relations = new ArrayList<>();
}
