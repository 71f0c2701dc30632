package org.a11yrag.retrieval_service.search.intent;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("IntentClassifier Tests")
class IntentClassifierTest {

  private IntentClassifier classifier;

  @BeforeEach
  void setUp() {
    classifier = new IntentClassifier();
  }

  @ParameterizedTest(name = "{0} -> {1}")
  @CsvSource(
      delimiter = '|',
      value = {
        "how to fix color contrast issues | IMPLEMENTATION",
        "How do I test a modal with NVDA? | TESTING",
        "tester found missing alt text on the homepage | TESTING",
        "What does WCAG require for focus indicators | STANDARDS",
        "section 508 conformance for PDFs | STANDARDS",
        "research shows captions help comprehension | RESEARCH",
        "latest accessibility news | NEWS",
        "why is my skip link not working | IMPLEMENTATION",
        "aria-live code example | IMPLEMENTATION",
        "color contrast | UNKNOWN"
      })
  void shouldClassifyQueries(String query, Intent expected) {
    assertEquals(expected, classifier.classify(query));
  }

  @Nested
  @DisplayName("Rule precedence")
  class PrecedenceTests {

    @Test
    @DisplayName("Should prefer testing over implementation")
    void shouldPreferTestingOverImplementation() {
      assertEquals(Intent.TESTING, classifier.classify("how to test keyboard navigation"));
    }

    @Test
    @DisplayName("Should prefer research over standards and news")
    void shouldPreferResearchOverStandards() {
      assertEquals(Intent.RESEARCH, classifier.classify("latest research on wcag contrast"));
    }

    @Test
    @DisplayName("Should use the first matching rule of a custom table")
    void shouldUseCustomRules() {
      IntentClassifier custom =
          new IntentClassifier(
              List.of(
                  IntentRule.of("vendor", Intent.NEWS, "release"),
                  IntentRule.of("fallback", Intent.RESEARCH, "release")));

      assertEquals(Intent.NEWS, custom.classify("NVDA release notes"));
      assertEquals(Intent.UNKNOWN, custom.classify("how to fix"));
    }
  }

  @Nested
  @DisplayName("Edge cases")
  class EdgeCaseTests {

    @Test
    @DisplayName("Should return UNKNOWN for blank input")
    void shouldReturnUnknownForBlank() {
      assertEquals(Intent.UNKNOWN, classifier.classify(null));
      assertEquals(Intent.UNKNOWN, classifier.classify("   "));
    }

    @Test
    @DisplayName("Should match markers only at word starts")
    void shouldMatchOnWordBoundary() {
      assertEquals(Intent.UNKNOWN, classifier.classify("prefixed selectors"));
    }

    @Test
    @DisplayName("Should not match a marker that is only the start of a longer word")
    void shouldNotMatchMarkerInsideLongerWord() {
      assertEquals(Intent.UNKNOWN, classifier.classify("test fixture setup"));
      assertEquals(Intent.UNKNOWN, classifier.classify("video codec support"));
      assertEquals(Intent.UNKNOWN, classifier.classify("newsletter archive"));
    }

    @Test
    @DisplayName("Should match prefix markers against inflected words")
    void shouldMatchPrefixMarkers() {
      assertEquals(Intent.IMPLEMENTATION, classifier.classify("implementing skip links"));
      assertEquals(Intent.IMPLEMENTATION, classifier.classify("landmark examples"));
      assertEquals(Intent.NEWS, classifier.classify("updated guidance on focus order"));
      assertEquals(Intent.RESEARCH, classifier.classify("researchers on dyslexia fonts"));
    }

    @Test
    @DisplayName("Should treat typographic apostrophes like plain ones")
    void shouldNormalizeApostrophes() {
      assertEquals(Intent.NEWS, classifier.classify("What’s new in ARIA 1.3"));
      assertEquals(Intent.IMPLEMENTATION, classifier.classify("focus trap doesn’t work"));
    }

    @Test
    @DisplayName("Should be case-insensitive")
    void shouldIgnoreCase() {
      assertEquals(Intent.STANDARDS, classifier.classify("SUCCESS CRITERION 1.4.3"));
    }
  }
}
