package org.a11yrag.retrieval_service.search.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.a11yrag.retrieval_service.config.OntologyConfig;
import org.a11yrag.retrieval_service.config.RetrievalConfig;
import org.a11yrag.retrieval_service.ontology.model.ExpansionTerm;
import org.a11yrag.retrieval_service.ontology.model.OntologyGraph;
import org.a11yrag.retrieval_service.ontology.model.RelationKind;
import org.a11yrag.retrieval_service.ontology.service.OntologyService;
import org.a11yrag.retrieval_service.search.intent.Intent;
import org.springframework.stereotype.Component;

/**
 * Expands a query with ontology terms and derives a bounded set of search variants.
 *
 * <p>Candidate terms are the configured compound phrases found in the query plus the remaining
 * non-stop-word tokens. Each candidate is expanded through the current {@link OntologyGraph},
 * following the edge kinds the intent favours. Every expansion term yields one variant by
 * substituting it for the candidate in the original text; one extra variant lists the candidate
 * and expansion terms on their own.
 *
 * <p>The original query is always the first variant. The rest are ordered by provenance priority,
 * then by ontology term frequency (rarer first), then by text, and cut at {@code
 * retrieval.max-variants}.
 */
@Slf4j
@Component
public class QueryExpander {

  private static final Map<Intent, Set<RelationKind>> KINDS_BY_INTENT = new EnumMap<>(Intent.class);

  static {
    Set<RelationKind> relatedAndSynonym = EnumSet.of(RelationKind.SYNONYM);
    relatedAndSynonym.addAll(RelationKind.RELATED);
    KINDS_BY_INTENT.put(Intent.RESEARCH, relatedAndSynonym);
    KINDS_BY_INTENT.put(Intent.STANDARDS, relatedAndSynonym);
    KINDS_BY_INTENT.put(
        Intent.IMPLEMENTATION, EnumSet.of(RelationKind.SYNONYM, RelationKind.HYPONYM));
    KINDS_BY_INTENT.put(Intent.TESTING, EnumSet.of(RelationKind.SYNONYM, RelationKind.HYPONYM));
    KINDS_BY_INTENT.put(Intent.NEWS, EnumSet.of(RelationKind.SYNONYM));
    KINDS_BY_INTENT.put(Intent.UNKNOWN, EnumSet.allOf(RelationKind.class));
  }

  private static final Comparator<QueryVariant> VARIANT_ORDER =
      Comparator.comparingInt((QueryVariant v) -> v.provenance().priority())
          .thenComparingInt(QueryVariant::termFrequency)
          .thenComparing(v -> v.text().toLowerCase(Locale.ROOT));

  private final OntologyService ontologyService;
  private final OntologyConfig ontologyConfig;
  private final RetrievalConfig retrievalConfig;
  private final QueryTextAnalyzer analyzer;
  private final List<Pattern> phrasePatterns;

  public QueryExpander(
      OntologyService ontologyService,
      OntologyConfig ontologyConfig,
      RetrievalConfig retrievalConfig) {
    this.ontologyService = ontologyService;
    this.ontologyConfig = ontologyConfig;
    this.retrievalConfig = retrievalConfig;
    this.analyzer = new QueryTextAnalyzer(ontologyConfig.getStopWordsSet());
    List<Pattern> patterns = new ArrayList<>();
    for (String phrase : ontologyConfig.getPhraseList()) {
      patterns.add(wordPattern(phrase));
    }
    this.phrasePatterns = List.copyOf(patterns);
  }

  /** Edge kinds followed for the given intent. */
  public static Set<RelationKind> kindsFor(Intent intent) {
    return Collections.unmodifiableSet(
        KINDS_BY_INTENT.getOrDefault(intent, KINDS_BY_INTENT.get(Intent.UNKNOWN)));
  }

  /**
   * @param query validated request
   * @param intent classified or overridden intent
   * @return expansion with at most {@code retrieval.max-variants} variants, original first
   */
  public ExpandedQuery expand(RetrievalQuery query, Intent intent) {
    String text = query.text().trim();
    OntologyGraph graph = ontologyService.getCurrentGraph();
    Set<RelationKind> kinds = kindsFor(intent);

    List<String> candidates = extractCandidates(text);
    log.debug("Candidate terms for '{}': {}", text, candidates);

    Map<String, QueryVariant> variants = new LinkedHashMap<>();
    Set<String> expandedTerms = new LinkedHashSet<>();
    Set<String> seenTerms = new LinkedHashSet<>();
    for (String candidate : candidates) {
      seenTerms.add(candidate.toLowerCase(Locale.ROOT));
    }

    for (String candidate : candidates) {
      List<ExpansionTerm> terms =
          graph.expandWithProvenance(
              candidate, kinds, ontologyConfig.getMaxDepth(), ontologyConfig.getMaxResults());
      for (ExpansionTerm term : terms) {
        if (term.isInputTerm()) {
          continue;
        }
        String lower = term.term().toLowerCase(Locale.ROOT);
        if (seenTerms.add(lower)) {
          expandedTerms.add(term.term());
        }
        QueryVariant variant =
            new QueryVariant(
                substitute(text, candidate, term.term()),
                Provenance.fromRelation(term.via()),
                term.term(),
                graph.termFrequency(term.term()));
        variants.putIfAbsent(variant.text().toLowerCase(Locale.ROOT), variant);
      }
    }

    if (!expandedTerms.isEmpty()) {
      QueryVariant pureTerms = pureTermsVariant(candidates, expandedTerms);
      variants.putIfAbsent(pureTerms.text().toLowerCase(Locale.ROOT), pureTerms);
    }

    variants.remove(text.toLowerCase(Locale.ROOT));
    List<QueryVariant> ranked = new ArrayList<>(variants.values());
    ranked.sort(VARIANT_ORDER);

    List<QueryVariant> selected = new ArrayList<>();
    selected.add(QueryVariant.original(text));
    for (QueryVariant variant : ranked) {
      if (selected.size() >= retrievalConfig.getMaxVariants()) {
        break;
      }
      selected.add(variant);
    }
    if (ranked.size() + 1 > selected.size()) {
      log.debug(
          "Dropped {} of {} variants for '{}'",
          ranked.size() + 1 - selected.size(),
          ranked.size() + 1,
          text);
    }

    ExpandedQuery expanded =
        new ExpandedQuery(query, intent, candidates, new ArrayList<>(expandedTerms), selected);
    if (log.isDebugEnabled()) {
      selected.forEach(v -> log.debug("Variant [{}] {}", v.provenance(), v.text()));
    }
    return expanded;
  }

  /**
   * Configured phrases first claim their words, in text order with the longest phrase winning;
   * the rest of the text is tokenized and stop words are dropped.
   */
  List<String> extractCandidates(String text) {
    String lower = text.toLowerCase(Locale.ROOT);
    StringBuilder remainder = new StringBuilder(lower);
    Map<Integer, String> byPosition = new TreeMap<>();

    for (Pattern pattern : phrasePatterns) {
      Matcher matcher = pattern.matcher(remainder);
      while (matcher.find()) {
        byPosition.put(matcher.start(), matcher.group());
        for (int i = matcher.start(); i < matcher.end(); i++) {
          remainder.setCharAt(i, ' ');
        }
      }
    }

    // Token positions are approximated by the first free occurrence in the remainder
    int cursor = 0;
    String rest = remainder.toString();
    for (String token : analyzer.tokenize(rest)) {
      int at = rest.indexOf(token, cursor);
      int position = at >= 0 ? at : rest.length() + byPosition.size();
      cursor = at >= 0 ? at + token.length() : cursor;
      if (token.length() > 1) {
        byPosition.putIfAbsent(position, token);
      }
    }

    Set<String> unique = new LinkedHashSet<>(byPosition.values());
    return new ArrayList<>(unique);
  }

  private QueryVariant pureTermsVariant(List<String> candidates, Set<String> expandedTerms) {
    Set<String> terms = new LinkedHashSet<>();
    for (String term : candidates) {
      if (terms.size() < retrievalConfig.getMaxPureTerms()) {
        terms.add(term);
      }
    }
    for (String term : expandedTerms) {
      if (terms.size() < retrievalConfig.getMaxPureTerms()) {
        terms.add(term.toLowerCase(Locale.ROOT));
      }
    }
    return new QueryVariant(String.join(" ", terms), Provenance.RELATED, null, Integer.MAX_VALUE);
  }

  /** Replaces the candidate in the original text, or appends the term if it cannot be found. */
  static String substitute(String text, String candidate, String replacement) {
    Matcher matcher = wordPattern(candidate).matcher(text);
    if (matcher.find()) {
      return matcher.replaceAll(Matcher.quoteReplacement(replacement));
    }
    return text + " " + replacement;
  }

  private static Pattern wordPattern(String phrase) {
    return Pattern.compile(
        "(?<![\\p{L}\\p{N}-])" + Pattern.quote(phrase) + "(?![\\p{L}\\p{N}-])",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }
}
