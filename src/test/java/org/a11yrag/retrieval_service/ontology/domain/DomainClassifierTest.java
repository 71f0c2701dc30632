package org.a11yrag.retrieval_service.ontology.domain;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.List;
import org.a11yrag.retrieval_service.config.DomainConfig;
import org.a11yrag.retrieval_service.ontology.OntologyTestData;
import org.a11yrag.retrieval_service.ontology.service.OntologyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("DomainClassifier Tests")
class DomainClassifierTest {

  @Mock private OntologyService ontologyService;

  private DomainClassifier classifier;

  @BeforeEach
  void setUp() {
    when(ontologyService.isLoaded()).thenReturn(true);
    when(ontologyService.getCurrentGraph()).thenReturn(OntologyTestData.contrastGraph());
    classifier = new DomainClassifier(new DomainConfig(), ontologyService);
  }

  private List<String> names(String query) {
    return classifier.classify(query).stream().map(DomainScore::domain).toList();
  }

  @Nested
  @DisplayName("Classification")
  class ClassificationTests {

    @Test
    @DisplayName("Should score the share of domain terms found in the query")
    void shouldScoreShareOfTerms() {
      List<DomainScore> scores = classifier.classify("keyboard navigation focus indicators");

      assertEquals(1, scores.size());
      DomainScore css = scores.get(0);
      assertEquals("css", css.domain());
      assertEquals(DomainCategory.TECHNOLOGY, css.category());
      assertEquals(1.0 / 8, css.score(), 1e-9);
      assertEquals(List.of("focus indicators"), css.matchedTerms());
    }

    @Test
    @DisplayName("Should order domains by score")
    void shouldOrderByScore() {
      List<DomainScore> scores =
          classifier.classify("screen reader users with low vision need high contrast focus indicators");

      assertEquals(List.of("visual", "css"), scores.stream().map(DomainScore::domain).toList());
      assertEquals(3.0 / 7, scores.get(0).score(), 1e-9);
      assertEquals(List.of("low vision", "screen reader", "high contrast"), scores.get(0).matchedTerms());
    }

    @Test
    @DisplayName("Should put accessibility domains before technology domains on equal score")
    void shouldBreakTiesByCategory() {
      assertEquals(List.of("motor", "javascript"), names("ajax widgets for users with tremor"));
    }

    @Test
    @DisplayName("Should match plural forms on word boundaries only")
    void shouldMatchWholeWords() {
      assertEquals(List.of("visual"), names("testing with screen readers"));
      assertTrue(classifier.classify("django formsets").isEmpty());
      assertTrue(classifier.classify("   ").isEmpty());
      assertTrue(classifier.classify(null).isEmpty());
    }

    @Test
    @DisplayName("Should accept configured domains with underscore terms")
    void shouldUseConfiguredDomains() {
      DomainConfig config = new DomainConfig();
      config.getTechnology().put("svg", List.of("role_img", "title"));
      DomainClassifier custom = new DomainClassifier(config, ontologyService);

      List<DomainScore> scores = custom.classify("SVG with role img");

      assertEquals("svg", scores.get(0).domain());
      assertEquals(0.5, scores.get(0).score(), 1e-9);
      assertEquals(List.of("role img"), custom.domainTerms("svg").subList(0, 1));
    }

    @Test
    @DisplayName("Should reject a domain without terms")
    void shouldRejectEmptyDomain() {
      DomainConfig config = new DomainConfig();
      config.getAccessibility().put("speech", List.of(" "));

      assertThrows(IllegalStateException.class, () -> new DomainClassifier(config, ontologyService));
    }
  }

  @Nested
  @DisplayName("Domain terms")
  class DomainTermsTests {

    @Test
    @DisplayName("Should return configured terms for a configured domain")
    void shouldReturnConfiguredTerms() {
      List<String> terms = classifier.domainTerms("Auditory");

      assertEquals(6, terms.size());
      assertTrue(terms.contains("hard of hearing"));
    }

    @Test
    @DisplayName("Should collect a concept and its children from the ontology")
    void shouldCollectOntologyTerms() {
      assertEquals(
          List.of(
              "color contrast",
              "colour contrast",
              "contrast ratio",
              "minimum contrast",
              "non-text contrast",
              "text contrast"),
          classifier.domainTerms("color_contrast"));
    }

    @Test
    @DisplayName("Should return nothing for unknown names or before the ontology loads")
    void shouldHandleUnknownDomains() {
      assertTrue(classifier.domainTerms("gustatory").isEmpty());
      assertTrue(classifier.domainTerms(" ").isEmpty());

      when(ontologyService.isLoaded()).thenReturn(false);
      assertTrue(classifier.domainTerms("color_contrast").isEmpty());
    }
  }
}
