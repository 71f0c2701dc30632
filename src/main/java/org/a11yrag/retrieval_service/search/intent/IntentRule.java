package org.a11yrag.retrieval_service.search.intent;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * One row of the classification table: an intent and the marker phrases that select it. Markers
 * match as whole words against the lowercased query text. A marker ending in {@code *} is a prefix
 * marker and only needs a word boundary before it ({@code implement*} matches "implementing").
 */
public record IntentRule(String name, Intent intent, List<String> markers, Pattern pattern) {

  public IntentRule {
    Objects.requireNonNull(intent, "intent must not be null");
    markers = List.copyOf(markers);
  }

  public static IntentRule of(String name, Intent intent, String... markers) {
    List<String> list = List.of(markers);
    String alternation =
        list.stream().map(IntentRule::toRegex).collect(Collectors.joining("|", "\\b(?:", ")"));
    return new IntentRule(name, intent, list, Pattern.compile(alternation));
  }

  private static String toRegex(String marker) {
    if (marker.endsWith("*")) {
      return Pattern.quote(marker.substring(0, marker.length() - 1));
    }
    // Lookahead rather than \b so a marker may end in punctuation
    return Pattern.quote(marker) + "(?![\\p{L}\\p{N}])";
  }

  public boolean matches(String lowerText) {
    return pattern.matcher(lowerText).find();
  }
}
