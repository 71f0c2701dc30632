package org.a11yrag.retrieval_service.authority.service;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Name normalisation used by the authority lookup. Honorifics and trailing degrees are dropped,
 * accents folded, punctuation turned into spaces and whitespace collapsed, so that {@code "Dr.
 * Léonie Watson"} and {@code "leonie watson"} compare equal.
 */
public final class AuthorNameNormalizer {

  private static final Pattern HONORIFICS =
      Pattern.compile("\\b(?:dr|prof|professor|mr|ms|mrs)\\b\\.?", Pattern.CASE_INSENSITIVE);
  private static final Pattern SUFFIXES =
      Pattern.compile(
          "(?:[\\s,]+(?:jr|sr|phd|ph\\.d|md|m\\.d)\\.?)+\\s*$", Pattern.CASE_INSENSITIVE);
  private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
  private static final Pattern NON_NAME = Pattern.compile("[^\\p{L}\\p{N}\\s-]");
  private static final Pattern APOSTROPHE = Pattern.compile("['’]");
  private static final Pattern AUTHOR_SEPARATORS =
      Pattern.compile("\\s*(?:[,;&]|\\band\\b)\\s*", Pattern.CASE_INSENSITIVE);

  private AuthorNameNormalizer() {}

  /** Normalised form of a name or identifier; empty for null or blank input. */
  public static String normalize(String name) {
    if (name == null || name.isBlank()) {
      return "";
    }
    String cleaned = SUFFIXES.matcher(name.trim()).replaceAll("");
    cleaned = HONORIFICS.matcher(cleaned).replaceAll(" ");
    cleaned = Normalizer.normalize(cleaned, Normalizer.Form.NFD);
    cleaned = DIACRITICS.matcher(cleaned).replaceAll("");
    cleaned = APOSTROPHE.matcher(cleaned).replaceAll(" ");
    cleaned = NON_NAME.matcher(cleaned).replaceAll(" ");
    return String.join(" ", tokens(cleaned.toLowerCase(Locale.ROOT)));
  }

  /**
   * True if both names have at least two parts and the first and last part of one occur in the
   * other. Arguments must already be normalised.
   */
  public static boolean fuzzyMatches(String normalizedQuery, String normalizedKnown) {
    List<String> query = tokens(normalizedQuery);
    List<String> known = tokens(normalizedKnown);
    if (query.size() < 2 || known.size() < 2) {
      return false;
    }
    return (known.contains(query.get(0)) && known.contains(query.get(query.size() - 1)))
        || (query.contains(known.get(0)) && query.contains(known.get(known.size() - 1)));
  }

  /**
   * Splits a multi-author string such as {@code "Steve Faulkner, Léonie Watson and Scott
   * O'Hara"}. Single names come back as a one-element list.
   */
  public static List<String> splitAuthors(String authors) {
    List<String> result = new ArrayList<>();
    if (authors == null || authors.isBlank()) {
      return result;
    }
    for (String part : AUTHOR_SEPARATORS.split(authors)) {
      if (!part.isBlank()) {
        result.add(part.trim());
      }
    }
    return result;
  }

  private static List<String> tokens(String text) {
    List<String> tokens = new ArrayList<>();
    Arrays.stream(text.trim().split("\\s+")).filter(t -> !t.isEmpty()).forEach(tokens::add);
    return tokens;
  }
}
