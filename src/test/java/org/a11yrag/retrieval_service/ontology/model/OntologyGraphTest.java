package org.a11yrag.retrieval_service.ontology.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.a11yrag.retrieval_service.ontology.OntologyTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("OntologyGraph Tests")
class OntologyGraphTest {

  private static final Set<RelationKind> ALL = EnumSet.allOf(RelationKind.class);

  private OntologyGraph graph;

  @BeforeEach
  void setUp() {
    graph = OntologyTestData.contrastGraph();
  }

  @Nested
  @DisplayName("Expansion")
  class ExpansionTests {

    @Test
    @DisplayName("Should return the input term first")
    void shouldReturnInputTermFirst() {
      Set<String> terms = graph.expand("Color Contrast", ALL, 2);

      assertEquals("Color Contrast", terms.iterator().next());
    }

    @Test
    @DisplayName("Should return singleton for unknown term")
    void shouldReturnSingletonForUnknownTerm() {
      assertEquals(Set.of("zebra crossing"), graph.expand("zebra crossing", ALL, 2));
    }

    @Test
    @DisplayName("Should return only the term when no edge kinds are requested")
    void shouldReturnOnlyTermWithoutKinds() {
      Set<String> terms = graph.expand("color contrast", EnumSet.noneOf(RelationKind.class), 2);

      assertEquals(List.of("color contrast"), new ArrayList<>(terms));
    }

    @Test
    @DisplayName("Should follow synonyms before hyponyms before related edges")
    void shouldOrderByEdgeKind() {
      List<String> terms = new ArrayList<>(graph.expand("color contrast", ALL, 1));

      assertEquals(
          List.of(
              "color contrast",
              "colour contrast",
              "contrast ratio",
              "non-text contrast",
              "text contrast",
              "minimum contrast",
              "contrast checker",
              "contrast minimum",
              "sc 1.4.3"),
          terms);
    }

    @Test
    @DisplayName("Should follow only requested edge kinds")
    void shouldFollowOnlyRequestedKinds() {
      Set<String> terms =
          graph.expand("color contrast", EnumSet.of(RelationKind.SYNONYM, RelationKind.HYPONYM), 2);

      assertTrue(terms.contains("text contrast"));
      assertFalse(terms.contains("contrast checker"));
      assertFalse(terms.contains("contrast minimum"));
    }

    @Test
    @DisplayName("Should respect maximum depth")
    void shouldRespectMaxDepth() {
      Set<String> depthZero = graph.expand("visual accessibility", ALL, 0);
      Set<String> depthOne = graph.expand("visual accessibility", ALL, 1);

      assertEquals(Set.of("visual accessibility"), depthZero);
      assertTrue(depthOne.contains("color contrast"));
      assertFalse(depthOne.contains("text contrast"));
    }

    @Test
    @DisplayName("Should never exceed maximum results")
    void shouldRespectMaxResults() {
      assertEquals(3, graph.expand("color contrast", ALL, 5, 3).size());
      assertEquals(1, graph.expand("color contrast", ALL, 5, 1).size());
    }

    @Test
    @DisplayName("Should produce identical output on repeated calls")
    void shouldBeDeterministic() {
      List<String> first = new ArrayList<>(graph.expand("contrast", ALL, 2));
      for (int i = 0; i < 10; i++) {
        assertEquals(first, new ArrayList<>(graph.expand("contrast", ALL, 2)));
      }
    }

    @Test
    @DisplayName("Should record provenance of expansion terms")
    void shouldRecordProvenance() {
      List<ExpansionTerm> terms =
          graph.expandWithProvenance("color contrast", ALL, 2, 25);

      assertTrue(terms.get(0).isInputTerm());
      ExpansionTerm synonym = find(terms, "contrast ratio");
      assertEquals(RelationKind.SYNONYM, synonym.via());
      assertEquals(0, synonym.depth());
      ExpansionTerm hyponym = find(terms, "minimum contrast");
      assertEquals(RelationKind.HYPONYM, hyponym.via());
      assertEquals(1, hyponym.depth());
      assertEquals("text_contrast", hyponym.conceptId());
      assertEquals(RelationKind.TESTED_BY, find(terms, "contrast checker").via());
    }

    private ExpansionTerm find(List<ExpansionTerm> terms, String term) {
      return terms.stream().filter(t -> t.term().equals(term)).findFirst().orElseThrow();
    }
  }

  @Nested
  @DisplayName("Concept lookup")
  class LookupTests {

    @Test
    @DisplayName("Should prefer exact matches on label, synonym or id")
    void shouldPreferExactMatches() {
      assertEquals("color_contrast", graph.findConcepts("CONTRAST RATIO").get(0).getId());
      assertEquals(1, graph.findConcepts("color_contrast").size());
    }

    @Test
    @DisplayName("Should fall back to substring matches ordered by label")
    void shouldFallBackToSubstring() {
      List<Concept> concepts = graph.findConcepts("contrast");

      assertTrue(concepts.size() >= 4);
      assertEquals("color contrast", concepts.get(0).getLabel());
    }

    @Test
    @DisplayName("Should not substring-match very short terms")
    void shouldNotSubstringMatchShortTerms() {
      assertTrue(graph.findConcepts("co").isEmpty());
      assertTrue(graph.findConcepts(" ").isEmpty());
    }

    @Test
    @DisplayName("Should match a plural form of a label or synonym")
    void shouldMatchPluralForms() {
      List<Concept> concepts = graph.findConcepts("contrast ratios");

      assertEquals(List.of("color_contrast"), concepts.stream().map(Concept::getId).toList());
    }

    @Test
    @DisplayName("Should find every concept named inside a compound term")
    void shouldFindConceptsInsideCompoundTerm() {
      List<String> ids =
          graph.findConcepts("text contrast checker").stream().map(Concept::getId).toList();

      assertEquals(List.of("contrast_checker", "text_contrast"), ids);
    }

    @Test
    @DisplayName("Should respect word boundaries including hyphens")
    void shouldRespectWordBoundaries() {
      List<String> ids =
          graph.findConcepts("non-text contrast issues").stream().map(Concept::getId).toList();

      assertEquals(List.of("non_text_contrast"), ids);
      assertTrue(graph.findConcepts("visualcolor contrastive").isEmpty());
    }

    @Test
    @DisplayName("Should expand a multi-word term that contains a label")
    void shouldExpandTermContainingLabel() {
      Set<String> terms =
          graph.expand("contrast ratios", EnumSet.of(RelationKind.SYNONYM), 1);

      assertTrue(terms.contains("colour contrast"));
      assertTrue(terms.contains("color contrast"));
    }

    @Test
    @DisplayName("Should match uppercase labels regardless of the default locale")
    void shouldIgnoreDefaultLocale() {
      OntologyGraph upper =
          OntologyGraph.builder().addConcept("live_region", "LIVE REGION", "ARIA LIVE").build();
      Locale previous = Locale.getDefault();
      Locale.setDefault(new Locale("tr", "TR"));
      try {
        assertEquals(1, upper.findConcepts("live reg").size());
        assertEquals(1, upper.findConcepts("polite live regions").size());
        assertEquals(1, upper.termFrequency("aria live"));
      } finally {
        Locale.setDefault(previous);
      }
    }

    @Test
    @DisplayName("Should count concepts mentioning a term")
    void shouldCountTermFrequency() {
      assertEquals(1, graph.termFrequency("luminance"));
      assertTrue(graph.termFrequency("contrast") > graph.termFrequency("contrast checker"));
      assertEquals(0, graph.termFrequency(""));
    }
  }

  @Nested
  @DisplayName("Builder")
  class BuilderTests {

    @Test
    @DisplayName("Should record hierarchy edges in both directions")
    void shouldLinkBothDirections() {
      Concept colorContrast = graph.getConcept("color_contrast").orElseThrow();

      assertEquals(Set.of("visual"), colorContrast.getParentIds());
      assertEquals(Set.of("non_text_contrast", "text_contrast"), colorContrast.getChildIds());
      assertTrue(graph.getConcept("visual").orElseThrow().hasChildren());
    }

    @Test
    @DisplayName("Should reject edges from unknown concepts")
    void shouldRejectUnknownSource() {
      OntologyGraph.Builder builder = OntologyGraph.builder().addConcept("a", "alpha", null);

      assertThrows(IllegalArgumentException.class, () -> builder.addSynonym("b", "beta"));
    }

    @Test
    @DisplayName("Should reject an empty graph")
    void shouldRejectEmptyGraph() {
      assertThrows(IllegalStateException.class, () -> OntologyGraph.builder().build());
    }

    @Test
    @DisplayName("Should report statistics")
    void shouldReportStats() {
      OntologyStats stats = graph.stats();

      assertEquals("test-1", stats.version());
      assertEquals(6, stats.conceptCount());
      assertEquals(4, stats.synonymCount());
      assertEquals(3, stats.hierarchyEdgeCount());
      assertEquals(1, stats.relationCounts().get(RelationKind.IMPLEMENTS));
    }
  }
}
