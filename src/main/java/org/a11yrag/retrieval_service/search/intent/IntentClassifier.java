package org.a11yrag.retrieval_service.search.intent;

import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Rule-based intent detection. Rules are evaluated top to bottom and the first match wins, so the
 * order below decides the outcome when a query contains markers of several intents ("how do I
 * test ..." is Testing, not Implementation).
 *
 * <table>
 *   <caption>Classification rules, in evaluation order</caption>
 *   <tr><th>#</th><th>Rule</th><th>Intent</th><th>Markers</th></tr>
 *   <tr><td>1</td><td>testing</td><td>TESTING</td>
 *       <td>tester found, how to test, how do i test, testing, audit found, user testing,
 *       test with</td></tr>
 *   <tr><td>2</td><td>research</td><td>RESEARCH</td>
 *       <td>research shows, studies show, study, evidence, research*</td></tr>
 *   <tr><td>3</td><td>standards</td><td>STANDARDS</td>
 *       <td>according to wcag, wcag, success criter*, section 508, en 301 549, conformance,
 *       compliance</td></tr>
 *   <tr><td>4</td><td>news</td><td>NEWS</td>
 *       <td>latest, news, recent*, what's new, update*</td></tr>
 *   <tr><td>5</td><td>implementation</td><td>IMPLEMENTATION</td>
 *       <td>how do i, how to, implement*, fix, fixes, fixing, code, coding, example*</td></tr>
 *   <tr><td>6</td><td>troubleshooting</td><td>IMPLEMENTATION</td>
 *       <td>why is, not working, doesn't work, broken</td></tr>
 *   <tr><td>-</td><td>(none)</td><td>UNKNOWN</td><td></td></tr>
 * </table>
 *
 * <p>Markers are whole words: "fix" does not match "fixture" and "code" does not match "codec".
 * A trailing {@code *} marks a prefix marker.
 */
@Slf4j
@Component
public class IntentClassifier {

  static final List<IntentRule> RULES =
      List.of(
          IntentRule.of(
              "testing",
              Intent.TESTING,
              "tester found",
              "how to test",
              "how do i test",
              "testing",
              "audit found",
              "user testing",
              "test with"),
          IntentRule.of(
              "research",
              Intent.RESEARCH,
              "research shows",
              "studies show",
              "study",
              "evidence",
              "research*"),
          IntentRule.of(
              "standards",
              Intent.STANDARDS,
              "according to wcag",
              "wcag",
              "success criter*",
              "section 508",
              "en 301 549",
              "conformance",
              "compliance"),
          IntentRule.of(
              "news", Intent.NEWS, "latest", "news", "recent*", "what's new", "update*"),
          IntentRule.of(
              "implementation",
              Intent.IMPLEMENTATION,
              "how do i",
              "how to",
              "implement*",
              "fix",
              "fixes",
              "fixing",
              "code",
              "coding",
              "example*"),
          IntentRule.of(
              "troubleshooting",
              Intent.IMPLEMENTATION,
              "why is",
              "not working",
              "doesn't work",
              "broken"));

  private final List<IntentRule> rules;

  public IntentClassifier() {
    this(RULES);
  }

  IntentClassifier(List<IntentRule> rules) {
    this.rules = List.copyOf(rules);
  }

  /**
   * @param queryText raw query text, may be null
   * @return the intent of the first matching rule, {@link Intent#UNKNOWN} if none matches
   */
  public Intent classify(String queryText) {
    if (queryText == null || queryText.isBlank()) {
      return Intent.UNKNOWN;
    }
    String lower = queryText.toLowerCase(Locale.ROOT).replace('’', '\'');
    for (IntentRule rule : rules) {
      if (rule.matches(lower)) {
        log.debug("Query classified as {} by rule '{}'", rule.intent(), rule.name());
        return rule.intent();
      }
    }
    return Intent.UNKNOWN;
  }

  public List<IntentRule> getRules() {
    return rules;
  }
}
