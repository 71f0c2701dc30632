package org.a11yrag.retrieval_service.search.fanout;

import java.util.List;
import org.a11yrag.retrieval_service.model.DocumentHit;
import org.a11yrag.retrieval_service.search.query.QueryVariant;
import org.a11yrag.retrieval_service.search.routing.PartitionRoute;

/** Result of one (variant, partition) search. */
public record SearchTaskOutcome(
    QueryVariant variant,
    PartitionRoute route,
    Status status,
    List<DocumentHit> hits,
    String errorKind,
    long tookMs) {

  public enum Status {
    SUCCESS,
    ERROR,
    TIMED_OUT
  }

  public SearchTaskOutcome {
    hits = List.copyOf(hits);
  }

  static SearchTaskOutcome success(
      QueryVariant variant, PartitionRoute route, List<DocumentHit> hits, long tookMs) {
    return new SearchTaskOutcome(variant, route, Status.SUCCESS, hits, null, tookMs);
  }

  static SearchTaskOutcome error(
      QueryVariant variant, PartitionRoute route, String errorKind, long tookMs) {
    return new SearchTaskOutcome(variant, route, Status.ERROR, List.of(), errorKind, tookMs);
  }

  static SearchTaskOutcome timedOut(QueryVariant variant, PartitionRoute route) {
    return new SearchTaskOutcome(variant, route, Status.TIMED_OUT, List.of(), "timeout", -1);
  }

  public boolean isSuccess() {
    return status == Status.SUCCESS;
  }
}
