package org.a11yrag.retrieval_service.search.fanout;

/** Counts of dispatched searches by outcome. */
public record FanoutStats(int dispatched, int succeeded, int failed, int timedOut) {

  /** True if at least one search failed or timed out. */
  public boolean degraded() {
    return failed > 0 || timedOut > 0;
  }
}
