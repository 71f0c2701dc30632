package org.a11yrag.retrieval_service.search.fanout;

import java.util.List;
import org.a11yrag.retrieval_service.model.DocumentHit;

/**
 * Hits gathered by one fan-out, in dispatch order (variant order, then route order, then index
 * rank), never in completion order.
 */
public record FanoutResult(
    List<DocumentHit> hits, List<SearchTaskOutcome> outcomes, FanoutStats stats) {

  public FanoutResult {
    hits = List.copyOf(hits);
    outcomes = List.copyOf(outcomes);
  }

  public boolean degraded() {
    return stats.degraded();
  }
}
