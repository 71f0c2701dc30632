package org.a11yrag.retrieval_service.search.query;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.miscellaneous.ASCIIFoldingFilter;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.util.CharTokenizer;

/**
 * Splits free text into candidate terms.
 *
 * <p>Pipeline order:
 *
 * <ol>
 *   <li>{@link QueryTokenizer}: letters, digits, hyphens and apostrophes form a token.
 *   <li>{@link ASCIIFoldingFilter}: removes accents.
 *   <li>{@link LowerCaseFilter}
 *   <li>{@link StopFilter}: drops the configured stop words.
 * </ol>
 */
public final class QueryTextAnalyzer extends Analyzer {

  private final CharArraySet stopWords;

  public QueryTextAnalyzer(Collection<String> stopWords) {
    this(new CharArraySet(stopWords, true));
  }

  /** Uses a prebuilt Lucene stop set such as {@code EnglishAnalyzer.ENGLISH_STOP_WORDS_SET}. */
  public QueryTextAnalyzer(CharArraySet stopWords) {
    this.stopWords = CharArraySet.unmodifiableSet(stopWords);
  }

  @Override
  protected TokenStreamComponents createComponents(String fieldName) {
    Tokenizer source = new QueryTokenizer();
    TokenStream filter = new ASCIIFoldingFilter(source);
    filter = new LowerCaseFilter(filter);
    filter = new StopFilter(filter, stopWords);
    return new TokenStreamComponents(source, filter);
  }

  @Override
  protected TokenStream normalize(String fieldName, TokenStream in) {
    return new LowerCaseFilter(in);
  }

  /** Runs the pipeline over {@code text} and returns the tokens in order. */
  public List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return tokens;
    }
    try (TokenStream stream = tokenStream("query", text)) {
      CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
      stream.reset();
      while (stream.incrementToken()) {
        String token = stripQuotes(term.toString());
        if (!token.isEmpty()) {
          tokens.add(token);
        }
      }
      stream.end();
    } catch (IOException e) {
      // StringReader input never fails
      throw new UncheckedIOException(e);
    }
    return tokens;
  }

  private static String stripQuotes(String token) {
    int start = 0;
    int end = token.length();
    while (start < end && (token.charAt(start) == '\'' || token.charAt(start) == '-')) {
      start++;
    }
    while (end > start && (token.charAt(end - 1) == '\'' || token.charAt(end - 1) == '-')) {
      end--;
    }
    return token.substring(start, end);
  }

  private static class QueryTokenizer extends CharTokenizer {
    @Override
    protected boolean isTokenChar(int c) {
      return Character.isLetter(c) || Character.isDigit(c) || c == '-' || c == '\'';
    }
  }
}
