package org.a11yrag.retrieval_service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Pipeline bounds, timeouts and fusion weights. Properties loaded from {@code
 * application.properties} with prefix {@code retrieval}.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "retrieval")
public class RetrievalConfig implements InitializingBean {

  private static final double WEIGHT_TOLERANCE = 1e-6;

  private int maxVariants = 5;
  private int topK = 10;
  private int resultCount = 10;
  private double diversityCap = 0.6;
  private int recencyHorizonYears = 5;
  private long defaultTimeoutMs = 2000;
  private long fanoutTimeoutMs = 1500;
  private int maxPureTerms = 8;
  private Weights weights = new Weights();

  @Override
  public void afterPropertiesSet() {
    requirePositive("max-variants", maxVariants);
    requirePositive("top-k", topK);
    requirePositive("result-count", resultCount);
    requirePositive("recency-horizon-years", recencyHorizonYears);
    requirePositive("default-timeout-ms", defaultTimeoutMs);
    requirePositive("fanout-timeout-ms", fanoutTimeoutMs);
    requirePositive("max-pure-terms", maxPureTerms);
    if (diversityCap <= 0.0 || diversityCap > 1.0) {
      throw new IllegalStateException(
          "retrieval.diversity-cap must be in (0,1], got " + diversityCap);
    }
    weights.validate();
  }

  private static void requirePositive(String key, long value) {
    if (value <= 0) {
      throw new IllegalStateException("retrieval." + key + " must be positive, got " + value);
    }
  }

  /** Composite score weights. Must be non-negative and sum to 1. */
  @Getter
  @Setter
  public static class Weights {
    private double similarity = 0.5;
    private double authority = 0.25;
    private double recency = 0.15;
    private double partition = 0.10;

    void validate() {
      if (similarity < 0 || authority < 0 || recency < 0 || partition < 0) {
        throw new IllegalStateException("retrieval.weights.* must not be negative");
      }
      double sum = similarity + authority + recency + partition;
      if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
        throw new IllegalStateException("retrieval.weights.* must sum to 1.0, got " + sum);
      }
    }
  }
}
