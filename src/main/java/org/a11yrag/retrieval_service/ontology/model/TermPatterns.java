package org.a11yrag.retrieval_service.ontology.model;

import java.util.Locale;
import java.util.regex.Pattern;

/** Word-bounded phrase patterns shared by concept matching and domain classification. */
public final class TermPatterns {

  private static final String BEFORE = "(?<![\\p{L}\\p{N}-])";
  private static final String AFTER = "(?![\\p{L}\\p{N}-])";

  private TermPatterns() {}

  /**
   * Matches the lowercased phrase as whole words, optionally followed by a plural {@code s} or
   * {@code es}. Letters, digits and hyphens count as word characters.
   */
  public static Pattern wordBounded(String phrase) {
    return Pattern.compile(
        BEFORE + Pattern.quote(phrase.toLowerCase(Locale.ROOT)) + "(?:e?s)?" + AFTER);
  }
}
