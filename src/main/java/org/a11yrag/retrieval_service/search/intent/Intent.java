package org.a11yrag.retrieval_service.search.intent;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Classified purpose of a query. The set is fixed. */
public enum Intent {
  RESEARCH,
  STANDARDS,
  IMPLEMENTATION,
  TESTING,
  NEWS,
  UNKNOWN;

  /** Case-insensitive lookup, empty for blank or unknown names. */
  public static Optional<Intent> fromName(String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    String upper = name.trim().toUpperCase(Locale.ROOT);
    return Arrays.stream(values()).filter(i -> i.name().equals(upper)).findFirst();
  }
}
