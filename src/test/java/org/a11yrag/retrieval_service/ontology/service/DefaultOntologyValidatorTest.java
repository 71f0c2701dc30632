package org.a11yrag.retrieval_service.ontology.service;

import static org.junit.jupiter.api.Assertions.*;

import org.a11yrag.retrieval_service.exceptions.FailureReason;
import org.a11yrag.retrieval_service.exceptions.OntologyConfigurationException;
import org.a11yrag.retrieval_service.ontology.OntologyTestData;
import org.a11yrag.retrieval_service.ontology.model.OntologyGraph;
import org.a11yrag.retrieval_service.ontology.model.RelationKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DefaultOntologyValidatorTest {
  private OntologyValidator validator;

  @BeforeEach
  void setUp() {
    validator = new DefaultOntologyValidator();
  }

  @Test
  void validate_withValidGraph_doesNotThrow() {
    assertDoesNotThrow(() -> validator.validate(OntologyTestData.contrastGraph()));
  }

  @Test
  void validate_withHierarchyCycle_namesTheCycle() {
    OntologyConfigurationException ex =
        assertThrows(
            OntologyConfigurationException.class,
            () -> validator.validate(OntologyTestData.cyclicGraph()));
    assertEquals(FailureReason.CONFIGURATION_ERROR, ex.getReason());
    assertEquals("Cycle in concept hierarchy: a -> b -> a", ex.getMessage());
  }

  @Test
  void validate_withSelfParent_throwsException() {
    OntologyGraph graph =
        OntologyGraph.builder().addConcept("a", "alpha", null).addParent("a", "a").build();
    OntologyConfigurationException ex =
        assertThrows(OntologyConfigurationException.class, () -> validator.validate(graph));
    assertTrue(ex.getMessage().contains("a -> a"));
  }

  @Test
  void validate_withRelationCycle_doesNotThrow() {
    OntologyGraph graph =
        OntologyGraph.builder()
            .addConcept("a", "alpha", null)
            .addConcept("b", "beta", null)
            .addRelation("a", RelationKind.REQUIRES, "b")
            .addRelation("b", RelationKind.ADDRESSES, "a")
            .build();
    assertDoesNotThrow(() -> validator.validate(graph));
  }

  @Test
  void validate_withDanglingRelationTarget_throwsException() {
    OntologyGraph graph =
        OntologyGraph.builder()
            .addConcept("a", "alpha", null)
            .addRelation("a", RelationKind.TESTED_BY, "ghost")
            .build();
    OntologyConfigurationException ex =
        assertThrows(OntologyConfigurationException.class, () -> validator.validate(graph));
    assertTrue(ex.getMessage().contains("ghost"));
  }

  @Test
  void validate_withDanglingParent_throwsException() {
    OntologyGraph graph =
        OntologyGraph.builder().addConcept("a", "alpha", null).addParent("a", "nowhere").build();
    OntologyConfigurationException ex =
        assertThrows(OntologyConfigurationException.class, () -> validator.validate(graph));
    assertTrue(ex.getMessage().contains("unknown parent"));
  }
}
