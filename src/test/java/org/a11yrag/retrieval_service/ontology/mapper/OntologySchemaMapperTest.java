package org.a11yrag.retrieval_service.ontology.mapper;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.a11yrag.retrieval_service.exceptions.OntologyConfigurationException;
import org.a11yrag.retrieval_service.ontology.model.Concept;
import org.a11yrag.retrieval_service.ontology.model.ConceptRelation;
import org.a11yrag.retrieval_service.ontology.model.OntologyGraph;
import org.a11yrag.retrieval_service.ontology.model.RelationKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("OntologySchemaMapper Tests")
class OntologySchemaMapperTest {

  private OntologySchemaMapper mapper;

  @BeforeEach
  void setUp() {
    mapper = new OntologySchemaMapper();
  }

  @Test
  @DisplayName("Should map concepts, synonyms, hierarchy and relations")
  void shouldMapSchema() {
    String json =
        """
        {"version": "v1",
         "concepts": {
           "aria": {"label": "aria", "children": ["live_region"], "synonyms": ["wai-aria"]},
           "live_region": {"label": "live region",
                           "relations": [{"kind": "tested-by", "target": "aria"}]},
           "extra": {"unknownField": true}
         }}
        """;

    OntologyGraph graph = mapper.fromJson(json);

    assertEquals("v1", graph.getVersion());
    assertEquals(3, graph.getConceptCount());
    Concept liveRegion = graph.getConcept("live_region").orElseThrow();
    assertEquals(List.of(new ConceptRelation(RelationKind.TESTED_BY, "aria")), liveRegion.getRelations());
    assertTrue(liveRegion.getParentIds().contains("aria"));
    assertTrue(graph.getConcept("aria").orElseThrow().getSynonyms().contains("wai-aria"));
    assertEquals("extra", graph.getConcept("extra").orElseThrow().getLabel());
  }

  @Test
  @DisplayName("Should reject empty input")
  void shouldRejectEmptyInput() {
    assertThrows(OntologyConfigurationException.class, () -> mapper.fromJson("  "));
  }

  @Test
  @DisplayName("Should reject malformed JSON")
  void shouldRejectMalformedJson() {
    assertThrows(OntologyConfigurationException.class, () -> mapper.fromJson("{\"concepts\": ["));
  }

  @Test
  @DisplayName("Should reject schema without concepts")
  void shouldRejectNoConcepts() {
    OntologyConfigurationException ex =
        assertThrows(
            OntologyConfigurationException.class, () -> mapper.fromJson("{\"version\": \"x\"}"));
    assertTrue(ex.getMessage().contains("no concepts"));
  }

  @Test
  @DisplayName("Should reject unknown relation kind")
  void shouldRejectUnknownKind() {
    String json =
        "{\"concepts\": {\"a\": {\"relations\": [{\"kind\": \"contradicts\", \"target\": \"a\"}]}}}";

    OntologyConfigurationException ex =
        assertThrows(OntologyConfigurationException.class, () -> mapper.fromJson(json));
    assertTrue(ex.getMessage().contains("contradicts"));
  }

  @Test
  @DisplayName("Should reject relation without target")
  void shouldRejectMissingTarget() {
    String json = "{\"concepts\": {\"a\": {\"relations\": [{\"kind\": \"requires\"}]}}}";

    assertThrows(OntologyConfigurationException.class, () -> mapper.fromJson(json));
  }
}
