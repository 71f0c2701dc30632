package org.a11yrag.retrieval_service.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Ontology loading and query-expansion settings. Properties loaded from {@code
 * application.properties} with prefix {@code ontology}.
 *
 * <p>Stop words and compound phrases are given as comma-separated lists and parsed after property
 * injection via {@link InitializingBean}.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "ontology")
public class OntologyConfig implements InitializingBean {

  private final Set<String> stopWordsSet = new HashSet<>();
  private final List<String> phraseList = new ArrayList<>();

  private String schemaLocation = "classpath:ontology/accessibility-ontology.json";
  private String stopwords;
  private String phrases;
  private int maxDepth = 2;
  private int maxResults = 25;

  @Override
  public void afterPropertiesSet() {
    stopWordsSet.clear();
    phraseList.clear();
    for (String word : split(stopwords)) {
      stopWordsSet.add(word);
    }
    for (String phrase : split(phrases)) {
      if (!phraseList.contains(phrase)) {
        phraseList.add(phrase);
      }
    }
    // Longest first so that "color contrast ratio" wins over "color contrast"
    phraseList.sort((a, b) -> Integer.compare(b.length(), a.length()));

    if (maxDepth < 0) {
      throw new IllegalStateException("ontology.max-depth must be >= 0, got " + maxDepth);
    }
    if (maxResults < 1) {
      throw new IllegalStateException("ontology.max-results must be >= 1, got " + maxResults);
    }
  }

  /** Unmodifiable view of the stop words (lowercase, trimmed). */
  public Set<String> getStopWordsSet() {
    return Collections.unmodifiableSet(stopWordsSet);
  }

  /** Unmodifiable view of the compound phrases, longest first. */
  public List<String> getPhraseList() {
    return Collections.unmodifiableList(phraseList);
  }

  private static List<String> split(String value) {
    List<String> out = new ArrayList<>();
    if (value != null && !value.isBlank()) {
      for (String item : value.split("\\s*,\\s*")) {
        if (!item.isBlank()) {
          out.add(item.trim().toLowerCase(Locale.ROOT));
        }
      }
    }
    return out;
  }
}
