package org.a11yrag.retrieval_service.index;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.a11yrag.retrieval_service.config.PartitionIndexConfig;
import org.a11yrag.retrieval_service.search.query.QueryTextAnalyzer;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Deterministic bag-of-words embedder using feature hashing. Each token, and each pair of adjacent
 * tokens at half weight, is hashed into one signed bucket; the result is L2-normalised.
 *
 * <p>Needs no model and gives identical vectors across runs and machines, which keeps ranking
 * reproducible. Any other {@link Embedder} bean can replace it.
 */
@Component
public class HashingEmbedder implements Embedder {

  private static final HashFunction HASH = Hashing.murmur3_32_fixed();
  private static final float BIGRAM_WEIGHT = 0.5f;

  private final int dimension;
  private final QueryTextAnalyzer analyzer;

  @Autowired
  public HashingEmbedder(PartitionIndexConfig config) {
    this(config.getDimension());
  }

  public HashingEmbedder(int dimension) {
    if (dimension < 8) {
      throw new IllegalArgumentException("Embedding dimension must be >= 8, got " + dimension);
    }
    this.dimension = dimension;
    this.analyzer = new QueryTextAnalyzer(EnglishAnalyzer.ENGLISH_STOP_WORDS_SET);
  }

  @Override
  public float[] embed(String text) {
    float[] vector = new float[dimension];
    List<String> tokens = analyzer.tokenize(text);
    for (int i = 0; i < tokens.size(); i++) {
      addFeature(vector, tokens.get(i), 1.0f);
      if (i > 0) {
        addFeature(vector, tokens.get(i - 1) + " " + tokens.get(i), BIGRAM_WEIGHT);
      }
    }
    return normalize(vector);
  }

  @Override
  public boolean canEmbed(String text) {
    return !analyzer.tokenize(text).isEmpty();
  }

  @Override
  public int dimension() {
    return dimension;
  }

  private void addFeature(float[] vector, String feature, float weight) {
    int hash = HASH.hashString(feature, StandardCharsets.UTF_8).asInt();
    int bucket = Math.floorMod(hash, dimension);
    float sign = (hash & 0x80000000) == 0 ? 1.0f : -1.0f;
    vector[bucket] += sign * weight;
  }

  private static float[] normalize(float[] vector) {
    double norm = 0.0;
    for (float v : vector) {
      norm += v * v;
    }
    if (norm == 0.0) {
      // Cosine similarity is undefined for the zero vector; callers check canEmbed before querying
      vector[0] = 1.0f;
      return vector;
    }
    float scale = (float) (1.0 / Math.sqrt(norm));
    for (int i = 0; i < vector.length; i++) {
      vector[i] *= scale;
    }
    return vector;
  }
}
